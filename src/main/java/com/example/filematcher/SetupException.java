package com.example.filematcher;

/**
 * Fatal problem detected before any file is touched: bad directories, an unusable audit log,
 * or interactive confirmation requested without a console.
 */
public class SetupException extends Exception {
    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
