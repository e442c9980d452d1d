package com.dpw.robotqase.command;

import com.dpw.robotqase.config.QaseProperties;
import com.dpw.robotqase.dto.ReportSummary;
import com.dpw.robotqase.model.QaseRunOptions;
import com.dpw.robotqase.services.IReporterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.Callable;

@Slf4j
@Component
@Command(name = "qase-robotframework-reporter", mixinStandardHelpOptions = true,
        version = "qase-robotframework-reporter 0.0.1",
        description = {
                "Reads a Robot Framework output.xml file and reports the results to Qase.",
                "Each test must carry a tag of the form Q-<case id>; tests without one are skipped."
        })
public class ReportCommand implements Callable<Integer> {

    static final DateTimeFormatter DEFAULT_TITLE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Parameters(index = "0", paramLabel = "<filename>", description = "The Robot Framework output.xml file.")
    private Path filename;

    @Option(names = {"-p", "--project"}, description = "Qase project code (env: QASE_TESTOPS_PROJECT).")
    private String project;

    @Option(names = {"-t", "--api-token"}, description = "Qase API token (env: QASE_TESTOPS_API_TOKEN).")
    private String apiToken;

    @Option(names = {"-r", "--run-title"}, description = "Qase run title (env: QASE_TESTOPS_RUN_TITLE).")
    private String runTitle;

    @Option(names = "--dry-run", description = "Parse the report and print the results without sending them.")
    private boolean dryRun;

    private final IReporterService reporterService;
    private final QaseProperties properties;
    private final Clock clock;

    @Autowired
    public ReportCommand(IReporterService reporterService, QaseProperties properties) {
        this(reporterService, properties, Clock.systemDefaultZone());
    }

    ReportCommand(IReporterService reporterService, QaseProperties properties, Clock clock) {
        this.reporterService = reporterService;
        this.properties = properties;
        this.clock = clock;
    }

    public static CommandLine commandLine(ReportCommand command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            log.error("Error reporting to Qase: {}", ex.getMessage());
            log.debug("Failure detail", ex);
            return 1;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        log.info("Running qase-robotframework-reporter");
        QaseRunOptions options = resolveOptions();
        ReportSummary summary = reporterService.report(filename, options, dryRun);
        log.info("Finished {}: {} result(s), status {}", summary.getReportFile(), summary.getTotal(), summary.getStatus());
        return 0;
    }

    // Command line flags win over configuration and environment
    QaseRunOptions resolveOptions() {
        String resolvedProject = firstNonBlank(project, properties.getProject());
        String resolvedToken = firstNonBlank(apiToken, properties.getApiToken());
        String resolvedTitle = firstNonBlank(runTitle, properties.getRunTitle());

        if (!dryRun) {
            if (resolvedProject == null) {
                throw new IllegalStateException("Qase project is required: use --project or QASE_TESTOPS_PROJECT");
            }
            if (resolvedToken == null) {
                throw new IllegalStateException("Qase API token is required: use --api-token or QASE_TESTOPS_API_TOKEN");
            }
        }
        if (resolvedTitle == null) {
            resolvedTitle = "Robot Framework run " + LocalDateTime.now(clock).format(DEFAULT_TITLE_FORMAT);
        }

        return QaseRunOptions.builder()
                .project(resolvedProject)
                .apiToken(resolvedToken)
                .runTitle(resolvedTitle)
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (StringUtils.hasText(preferred)) {
            return preferred;
        }
        return StringUtils.hasText(fallback) ? fallback : null;
    }
}
