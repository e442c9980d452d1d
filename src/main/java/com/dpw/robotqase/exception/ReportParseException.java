package com.dpw.robotqase.exception;

import lombok.Getter;

/**
 * Raised when a Robot Framework report, or one test record inside it, cannot be turned into a result.
 * Structural failures at the document root are fatal to the whole parse; every other reason only
 * disqualifies the record it was raised for.
 */
@Getter
public class ReportParseException extends RuntimeException {

    public enum Kind {
        STRUCTURAL,
        IDENTIFIER,
        ATTRIBUTE_MISSING,
        TIME_PARSE
    }

    @Getter
    public enum Reason {
        INVALID_ROOT_ELEMENT(Kind.STRUCTURAL),
        MISSING_STATUS_ELEMENT(Kind.STRUCTURAL),
        NO_TAGS_FOUND(Kind.IDENTIFIER),
        IDENTIFIER_NOT_FOUND(Kind.IDENTIFIER),
        MISSING_STATUS_ATTRIBUTE(Kind.ATTRIBUTE_MISSING),
        MISSING_START_TIME(Kind.ATTRIBUTE_MISSING),
        MISSING_ELAPSED(Kind.ATTRIBUTE_MISSING),
        MISSING_END_TIME(Kind.ATTRIBUTE_MISSING),
        TIME_PARSE_ERROR(Kind.TIME_PARSE),
        NEGATIVE_DURATION(Kind.TIME_PARSE);

        private final Kind kind;

        Reason(Kind kind) {
            this.kind = kind;
        }
    }

    private final Reason reason;
    private final String offendingText;

    public ReportParseException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public ReportParseException(Reason reason, String message, String offendingText, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.offendingText = offendingText;
    }

    public static ReportParseException timeParseError(String attribute, String text, Throwable cause) {
        return new ReportParseException(Reason.TIME_PARSE_ERROR,
                String.format("Cannot parse %s attribute value '%s'", attribute, text), text, cause);
    }

    public Kind getKind() {
        return reason.getKind();
    }

    public boolean isFatal() {
        return reason == Reason.INVALID_ROOT_ELEMENT;
    }
}
