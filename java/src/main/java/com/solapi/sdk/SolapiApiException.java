package com.solapi.sdk;

/**
 * Exception representing an error returned by SOLAPI. When the API answers with anything other than 200 the SDK
 * decodes the {@code errorCode}/{@code errorMessage} envelope into this type so callers can inspect both the HTTP
 * status and the SOLAPI error code.
 */
public final class SolapiApiException extends SolapiException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public SolapiApiException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by SOLAPI.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return SOLAPI error code such as {@code ValidationError} (nullable when the body did not include one).
     */
    public String getCode() {
        return code;
    }

    /**
     * @return {@code code[status]:message}, the compact form used in SOLAPI's own SDKs.
     */
    public String summary() {
        return code + "[" + statusCode + "]:" + getMessage();
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + summary();
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "SOLAPI request failed with status " + status;
        }
        return "SOLAPI request failed with status " + status + " (" + code + ")";
    }
}
