package com.dpw.robotqase.parser;

import com.dpw.robotqase.exception.ReportLoadException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a Robot Framework output.xml into an in-memory jsoup document. The whole file is
 * materialized before any record is looked at.
 */
@Slf4j
@Component
public class RobotReportLoader {

    private static final String CLASSPATH_PREFIX = "classpath:";

    public Document load(String location) {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            return loadFromClasspath(location.substring(CLASSPATH_PREFIX.length()));
        }
        return load(Path.of(location));
    }

    public Document load(Path file) {
        Path absolute = file.toAbsolutePath();
        log.info("Reading file: {}", absolute);
        if (!Files.isRegularFile(absolute)) {
            throw new ReportLoadException("Report file not found: " + absolute, null);
        }
        try {
            return parse(Files.readString(absolute, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ReportLoadException("Error reading XML file " + absolute + ": " + e.getMessage(), e);
        }
    }

    private Document loadFromClasspath(String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is == null) {
                throw new ReportLoadException("Report not found in classpath: " + path, null);
            }
            return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ReportLoadException("Error reading XML resource " + path + ": " + e.getMessage(), e);
        }
    }

    public Document parse(String xml) {
        return Jsoup.parse(xml, "", Parser.xmlParser());
    }
}
