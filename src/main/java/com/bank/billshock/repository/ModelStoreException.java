package com.bank.billshock.repository;

import com.bank.billshock.model.ErrorKind;

public class ModelStoreException extends RuntimeException {

    private final ErrorKind errorKind;

    public ModelStoreException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ModelStoreException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
