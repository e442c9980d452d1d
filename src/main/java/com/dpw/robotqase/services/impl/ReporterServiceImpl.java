package com.dpw.robotqase.services.impl;

import com.dpw.robotqase.dto.ReportSummary;
import com.dpw.robotqase.model.NormalizedTestResult;
import com.dpw.robotqase.model.QaseRunOptions;
import com.dpw.robotqase.model.TestStatus;
import com.dpw.robotqase.parser.RobotReportLoader;
import com.dpw.robotqase.parser.TestRecordExtractor;
import com.dpw.robotqase.services.IReportSubmitter;
import com.dpw.robotqase.services.IReporterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReporterServiceImpl implements IReporterService {

    private final RobotReportLoader reportLoader;
    private final TestRecordExtractor testRecordExtractor;
    private final IReportSubmitter reportSubmitter;

    @Override
    public ReportSummary report(Path reportFile, QaseRunOptions options, boolean dryRun) {
        Document document = reportLoader.load(reportFile);
        List<NormalizedTestResult> results = testRecordExtractor.extract(document);

        ReportSummary summary = new ReportSummary();
        summary.setReportFile(reportFile.toString());
        summary.setTotal(results.size());
        summary.setPassed((int) results.stream().filter(r -> r.getStatus() == TestStatus.PASSED).count());
        summary.setFailed(results.size() - summary.getPassed());

        if (results.isEmpty()) {
            log.warn("No test results with a Qase ID found in {}, nothing to report", reportFile);
            summary.setStatus("EMPTY");
            return summary;
        }

        if (dryRun) {
            results.forEach(r -> log.info("[dry-run] Q-{} {} {}ms{}", r.getExternalId(), r.getStatus().getQaseValue(),
                    r.getDurationMs(), r.hasPackageLabel() ? " (" + r.getPackageLabel() + ")" : ""));
            summary.setStatus("DRY_RUN");
            return summary;
        }

        summary.setRunId(reportSubmitter.submit(options, results));
        summary.setStatus("SUBMITTED");
        log.info("Reported {} result(s) to Qase run {}: {} passed, {} failed",
                summary.getTotal(), summary.getRunId(), summary.getPassed(), summary.getFailed());
        return summary;
    }
}
