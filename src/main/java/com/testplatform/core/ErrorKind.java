package com.testplatform.core;

import com.testplatform.exception.SettingsException;
import com.testplatform.exception.TestPlatformException;

/**
 * Classification of failures raised while a request is processed.
 * Every kind except {@link #UNKNOWN} is an expected operational failure.
 */
public enum ErrorKind {
    PLATFORM_ERROR,
    SETTINGS_ERROR,
    INVALID_OPERATION_ERROR,
    UNKNOWN;

    public static ErrorKind classify(Throwable failure) {
        if (failure instanceof SettingsException) {
            return SETTINGS_ERROR;
        }
        if (failure instanceof TestPlatformException) {
            return PLATFORM_ERROR;
        }
        if (failure instanceof IllegalStateException) {
            return INVALID_OPERATION_ERROR;
        }
        return UNKNOWN;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
