package com.webspec.alerts;

/** An alert configuration file could not be read or is malformed. */
public class AlertConfigException extends RuntimeException {

    public AlertConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
