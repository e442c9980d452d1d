package com.dpw.robotqase.dto;

import lombok.Data;

@Data
public class ReportSummary {
    private String reportFile;
    private Integer total;
    private Integer passed;
    private Integer failed;
    private Long runId;        // null when nothing was submitted
    private String status;     // SUBMITTED, DRY_RUN, EMPTY
}
