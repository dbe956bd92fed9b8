package com.bank.billshock.model;

/**
 * Outcome of a validation check. Validators return this instead of throwing.
 * {@code errorKind} and {@code errorMessage} are null when the check passed.
 */
public record ValidationResult(boolean valid, ErrorKind errorKind, String errorMessage) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult invalid(ErrorKind kind, String message) {
        return new ValidationResult(false, kind, message);
    }
}
