package com.dpw.robotqase.model;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class StatusTiming {
    TestStatus status;
    LocalDateTime startTime;
    long durationMs; // may be negative for a legacy record whose endtime precedes its starttime
    SchemaVersion schemaVersion;
}
