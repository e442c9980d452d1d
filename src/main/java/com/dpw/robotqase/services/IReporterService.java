package com.dpw.robotqase.services;

import com.dpw.robotqase.dto.ReportSummary;
import com.dpw.robotqase.model.QaseRunOptions;

import java.nio.file.Path;

public interface IReporterService {
    ReportSummary report(Path reportFile, QaseRunOptions options, boolean dryRun);
}
