package com.dpw.robotqase.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class NormalizedTestResult {
    long externalId;          // Qase case id taken from the Q-<digits> tag
    @NonNull
    TestStatus status;
    @NonNull
    LocalDateTime startTime;
    long durationMs;
    String packageLabel;      // name of the enclosing suite, null when there is none

    public boolean hasPackageLabel() {
        return packageLabel != null && !packageLabel.isEmpty();
    }
}
