package com.dpw.robotqase.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class QaseRunOptions {
    String project;
    @ToString.Exclude
    String apiToken;
    String runTitle;
}
