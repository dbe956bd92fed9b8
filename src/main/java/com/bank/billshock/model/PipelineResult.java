package com.bank.billshock.model;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Either the value produced by a training / detection run, or the kind and message of the
 * check that stopped it. Callers must inspect {@link #isSuccess()} before reading the value.
 */
public final class PipelineResult<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private PipelineResult(T value, ErrorKind errorKind, String errorMessage) {
        this.value = value;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static <T> PipelineResult<T> success(T value) {
        return new PipelineResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> PipelineResult<T> failure(ErrorKind kind, String message) {
        return new PipelineResult<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new NoSuchElementException("No value present: " + errorKind + " - " + errorMessage);
        }
        return value;
    }

    public ErrorKind getErrorKind() { return errorKind; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return isSuccess()
                ? "PipelineResult[success]"
                : "PipelineResult[" + errorKind + ": " + errorMessage + "]";
    }
}
