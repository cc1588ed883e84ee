package com.solapi.sdk.internal;

import com.solapi.sdk.DecodeException;
import com.solapi.sdk.SolapiApiException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void decodesErrorEnvelope() throws Exception {
        SolapiApiException ex = ApiErrorDecoder.decode(403,
            "{\"errorCode\":\"NotEnoughBalance\",\"errorMessage\":\"balance too low\"}".getBytes(StandardCharsets.UTF_8));

        assertEquals(403, ex.getStatusCode());
        assertEquals("NotEnoughBalance", ex.getCode());
        assertEquals("balance too low", ex.getMessage());
    }

    @Test
    void fallsBackToStatusMessageWhenEnvelopeIsSparse() throws Exception {
        SolapiApiException ex = ApiErrorDecoder.decode(500, "{}".getBytes(StandardCharsets.UTF_8));

        assertNull(ex.getCode());
        assertEquals("SOLAPI request failed with status 500", ex.getMessage());
    }

    @Test
    void emptyBodyIsDecodeError() {
        DecodeException ex = assertThrows(DecodeException.class, () -> ApiErrorDecoder.decode(404, new byte[0]));

        assertEquals(404, ex.getStatusCode());
    }

    @Test
    void nonJsonBodyIsDecodeError() {
        DecodeException ex = assertThrows(DecodeException.class,
            () -> ApiErrorDecoder.decode(503, "Service Unavailable".getBytes(StandardCharsets.UTF_8)));

        assertEquals(503, ex.getStatusCode());
        assertNotNull(ex.getCause());
    }
}
