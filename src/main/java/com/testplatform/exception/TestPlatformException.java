package com.testplatform.exception;

/**
 * Base exception for the test platform.
 * Signals an operational failure of the platform or its execution engine.
 */
public class TestPlatformException extends RuntimeException {

    public TestPlatformException(String message) {
        super(message);
    }

    public TestPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
