package com.dpw.robotqase.exception;

public class ReportLoadException extends RuntimeException {

    public ReportLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
