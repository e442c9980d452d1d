package com.dpw.robotqase.command;

import com.dpw.robotqase.config.QaseProperties;
import com.dpw.robotqase.dto.ReportSummary;
import com.dpw.robotqase.exception.QaseApiException;
import com.dpw.robotqase.model.QaseRunOptions;
import com.dpw.robotqase.services.IReporterService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportCommandTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T08:30:00Z"), ZoneOffset.UTC);

    @Mock
    private IReporterService reporterService;

    private QaseProperties properties;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        properties = new QaseProperties();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine commandLine = ReportCommand.commandLine(new ReportCommand(reporterService, properties, CLOCK));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private static ReportSummary summary(String status) {
        ReportSummary summary = new ReportSummary();
        summary.setReportFile("output.xml");
        summary.setTotal(1);
        summary.setStatus(status);
        return summary;
    }

    private QaseRunOptions capturedOptions() {
        ArgumentCaptor<QaseRunOptions> captor = ArgumentCaptor.forClass(QaseRunOptions.class);
        verify(reporterService).report(eq(Path.of("output.xml")), captor.capture(), anyBoolean());
        return captor.getValue();
    }

    @Test
    void flagsOverrideConfiguration() {
        properties.setProject("FROM_ENV");
        properties.setApiToken("env-token");
        properties.setRunTitle("Env title");
        when(reporterService.report(any(), any(), eq(false))).thenReturn(summary("SUBMITTED"));

        int exitCode = execute("-p", "CLI", "--api-token", "cli-token", "-r", "CLI title", "output.xml");

        assertThat(exitCode).isZero();
        QaseRunOptions options = capturedOptions();
        assertThat(options.getProject()).isEqualTo("CLI");
        assertThat(options.getApiToken()).isEqualTo("cli-token");
        assertThat(options.getRunTitle()).isEqualTo("CLI title");
    }

    @Test
    void configurationIsUsedWhenFlagsAreAbsent() {
        properties.setProject("DEMO");
        properties.setApiToken("env-token");
        properties.setRunTitle("  ");
        when(reporterService.report(any(), any(), eq(false))).thenReturn(summary("SUBMITTED"));

        assertThat(execute("output.xml")).isZero();

        QaseRunOptions options = capturedOptions();
        assertThat(options.getProject()).isEqualTo("DEMO");
        assertThat(options.getApiToken()).isEqualTo("env-token");
        assertThat(options.getRunTitle()).isEqualTo("Robot Framework run 2024-03-01 08:30:00");
        assertThat(options.toString()).doesNotContain("env-token");
    }

    @Test
    void missingProjectFailsWithoutReporting() {
        properties.setApiToken("token");

        assertThat(execute("output.xml")).isEqualTo(1);
        verifyNoInteractions(reporterService);
    }

    @Test
    void missingTokenFailsWithoutReporting() {
        assertThat(execute("-p", "DEMO", "output.xml")).isEqualTo(1);
        verifyNoInteractions(reporterService);
    }

    @Test
    void dryRunNeedsNoCredentials() {
        when(reporterService.report(any(), any(), eq(true))).thenReturn(summary("DRY_RUN"));

        assertThat(execute("--dry-run", "output.xml")).isZero();
        verify(reporterService).report(eq(Path.of("output.xml")), any(), eq(true));
    }

    @Test
    void submissionFailureGivesExitCodeOne() {
        properties.setProject("DEMO");
        properties.setApiToken("token");
        when(reporterService.report(any(), any(), eq(false)))
                .thenThrow(new QaseApiException("create test run", 401, "{}", "status code: 401"));

        assertThat(execute("output.xml")).isEqualTo(1);
    }

    @Test
    void missingFilenameIsAUsageError() {
        assertThat(execute()).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("<filename>");
        verifyNoInteractions(reporterService);
    }
}
