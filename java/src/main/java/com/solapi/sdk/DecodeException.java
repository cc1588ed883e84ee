package com.solapi.sdk;

/**
 * Raised when a response body cannot be decoded, either into the caller's result type (status 200) or into the
 * SOLAPI error envelope (any other status). The HTTP status is kept so callers can still tell the two apart.
 */
public final class DecodeException extends SolapiException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public DecodeException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the response whose body failed to decode.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
