package com.solapi.sdk.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.solapi.sdk.DecodeException;
import com.solapi.sdk.SolapiApiException;

import java.io.IOException;

/**
 * Utility for decoding the {@code {errorCode, errorMessage}} envelope SOLAPI sends with every non-200 response.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    /**
     * @return the decoded API error, ready to be thrown by the caller.
     * @throws DecodeException when the body is empty or is not an error envelope; the status is kept on the exception.
     */
    public static SolapiApiException decode(int statusCode, byte[] body) throws DecodeException {
        if (body == null || body.length == 0) {
            throw new DecodeException(statusCode, "decode error response: empty body (status " + statusCode + ")", null);
        }

        try {
            ErrorBody error = MAPPER.readValue(body, ErrorBody.class);
            if (error == null) {
                throw new DecodeException(statusCode, "decode error response: null body (status " + statusCode + ")", null);
            }
            return new SolapiApiException(statusCode, error.errorCode(), error.errorMessage());
        } catch (IOException ex) {
            throw new DecodeException(statusCode,
                "decode error response (status " + statusCode + "): " + ex.getMessage(), ex);
        }
    }

    private record ErrorBody(String errorCode, String errorMessage) {
    }
}
