package com.dpw.robotqase.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResultCreateBulkRequest {
    private List<ResultCreate> results;
}
