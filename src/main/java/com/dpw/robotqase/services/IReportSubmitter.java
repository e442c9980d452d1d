package com.dpw.robotqase.services;

import com.dpw.robotqase.model.NormalizedTestResult;
import com.dpw.robotqase.model.QaseRunOptions;

import java.util.List;

public interface IReportSubmitter {
    /**
     * Creates a run scoped to the case ids of {@code results}, submits all results in one bulk call
     * and completes the run.
     *
     * @return the id of the created run
     */
    long submit(QaseRunOptions options, List<NormalizedTestResult> results);
}
