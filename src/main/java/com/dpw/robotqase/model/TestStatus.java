package com.dpw.robotqase.model;

public enum TestStatus {
    PASSED("passed"),
    FAILED("failed");

    private final String qaseValue;

    TestStatus(String qaseValue) {
        this.qaseValue = qaseValue;
    }

    public String getQaseValue() {
        return qaseValue;
    }

    // Robot Framework writes PASS, FAIL, SKIP and NOT RUN; only PASS counts as passed
    public static TestStatus fromRobotStatus(String robotStatus) {
        return "PASS".equals(robotStatus) ? PASSED : FAILED;
    }
}
