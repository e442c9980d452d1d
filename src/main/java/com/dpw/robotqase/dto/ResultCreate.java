package com.dpw.robotqase.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultCreate {
    @JsonProperty("case_id")
    private Long caseId;
    private String status; // passed, failed
    @JsonProperty("time_ms")
    private Long timeMs;
    private String comment;
}
