package com.tempmail.domain;

/**
 * A failure tagged with its kind and the pipeline stage that produced it
 */
public record Failure(FailureKind kind, String stage, String detail) {

    public static Failure of(FailureKind kind, String stage, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new Failure(kind, stage, detail);
    }
}
