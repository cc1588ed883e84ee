package com.solapi.sdk;

/**
 * Raised when a request payload cannot be encoded as JSON. Nothing is sent in that case.
 */
public final class SerializationException extends SolapiException {

    private static final long serialVersionUID = 1L;

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
