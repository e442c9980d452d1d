package com.dpw.robotqase.parser;

import com.dpw.robotqase.exception.ReportParseException;
import com.dpw.robotqase.exception.ReportParseException.Reason;
import com.dpw.robotqase.model.NormalizedTestResult;
import com.dpw.robotqase.model.StatusTiming;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a loaded output.xml into normalized results, one per usable {@code <test>} element, in
 * document order. A record that cannot be decoded is logged and skipped; only a document that is
 * not a Robot Framework report at all fails the whole pass.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TestRecordExtractor {

    static final String ROOT_ELEMENT = "robot";
    static final String TEST_ELEMENT = "test";
    static final String STATUS_ELEMENT = "status";
    static final String SUITE_ELEMENT = "suite";

    private final QaseIdResolver qaseIdResolver;
    private final StatusTimeNormalizer statusTimeNormalizer;

    public List<NormalizedTestResult> extract(Document document) {
        Element root = document.children().first();
        if (root == null || !ROOT_ELEMENT.equals(root.tagName())) {
            throw new ReportParseException(Reason.INVALID_ROOT_ELEMENT, "Cannot find robot root node");
        }

        ParseSession session = new ParseSession(root);
        for (Element test : root.select(TEST_ELEMENT)) {
            session.accept(test);
        }

        log.info("Parsed {} test result(s) from {} test record(s), {} skipped",
                session.results.size(), session.position, session.skipped);
        return Collections.unmodifiableList(session.results);
    }

    NormalizedTestResult parseTestRecord(Element test) {
        long qaseId = qaseIdResolver.resolve(test);

        Element statusElement = QaseIdResolver.directChildren(test, STATUS_ELEMENT).stream()
                .findFirst()
                .orElseThrow(() -> new ReportParseException(Reason.MISSING_STATUS_ELEMENT, "Cannot find status tag"));
        StatusTiming timing = statusTimeNormalizer.normalize(statusElement);

        if (timing.getDurationMs() < 0) {
            throw new ReportParseException(Reason.NEGATIVE_DURATION, String.format(
                    "End time precedes start time by %d ms", -timing.getDurationMs()));
        }

        NormalizedTestResult result = NormalizedTestResult.builder()
                .externalId(qaseId)
                .status(timing.getStatus())
                .startTime(timing.getStartTime())
                .durationMs(timing.getDurationMs())
                .packageLabel(enclosingSuiteName(test))
                .build();
        log.debug("Test case ID: {}, Status: {}, Time: {}, TimeMs: {} ({})", result.getExternalId(),
                result.getStatus(), result.getStartTime(), result.getDurationMs(), timing.getSchemaVersion());
        return result;
    }

    private static String enclosingSuiteName(Element test) {
        for (Element parent : test.parents()) {
            if (SUITE_ELEMENT.equals(parent.tagName()) && !parent.attr("name").isEmpty()) {
                return parent.attr("name");
            }
        }
        return null;
    }

    private static String describe(Element test) {
        String id = test.attr("id");
        String name = test.attr("name");
        if (id.isEmpty()) {
            return "'" + name + "'";
        }
        return "'" + name + "' (" + id + ")";
    }

    /**
     * State of one extraction pass: the document being walked and the results collected so far.
     */
    private final class ParseSession {
        private final Element root;
        private final List<NormalizedTestResult> results = new ArrayList<>();
        private int position;
        private int skipped;

        private ParseSession(Element root) {
            this.root = root;
        }

        private void accept(Element test) {
            position++;
            try {
                results.add(parseTestRecord(test));
            } catch (ReportParseException e) {
                skipped++;
                log.warn("Error parsing test result #{} {} in <{}>: [{}] {}", position, describe(test),
                        root.tagName(), e.getReason(), e.getMessage());
            }
        }
    }
}
