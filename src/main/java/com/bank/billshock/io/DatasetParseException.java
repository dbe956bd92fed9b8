package com.bank.billshock.io;

import java.io.IOException;

/**
 * Thrown when a tabular source is readable but not well-formed CSV.
 */
public class DatasetParseException extends IOException {

    public DatasetParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
