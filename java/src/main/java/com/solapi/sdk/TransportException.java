package com.solapi.sdk;

/**
 * Raised when a request never produced an HTTP response: DNS, connect and TLS failures, or an interrupted call.
 */
public final class TransportException extends SolapiException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
