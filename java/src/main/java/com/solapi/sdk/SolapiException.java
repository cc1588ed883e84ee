package com.solapi.sdk;

/**
 * Base exception thrown by the SOLAPI Java SDK.
 */
public class SolapiException extends Exception {

    private static final long serialVersionUID = 1L;

    public SolapiException(String message) {
        super(message);
    }

    public SolapiException(String message, Throwable cause) {
        super(message, cause);
    }
}
