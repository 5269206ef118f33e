package com.testplatform.exception;

/**
 * Exception thrown when run settings or runner options are invalid or unsupported.
 */
public class SettingsException extends TestPlatformException {

    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
