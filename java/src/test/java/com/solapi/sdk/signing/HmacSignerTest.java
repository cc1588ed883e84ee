package com.solapi.sdk.signing;

import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HmacSignerTest {

    private static final String DATE = "2024-01-01T00:00:00Z";
    private static final String SALT = "0123456789abcdef0123456789abcdef01234567";
    private static final String EXPECTED_SIGNATURE = "4914119573fdb72a66ff2c1bdf12c91bcc8594c857a02ea71cfeb66447e81b84";
    private static final String EMPTY_SECRET_SIGNATURE = "a6464df29c104d0f1c4ae43277d844869877be25cd1cd906ea57544ad379109f";

    @Test
    void matchesReferenceVector() {
        HmacSigner signer = new HmacSigner(Clock.fixed(Instant.parse(DATE), ZoneOffset.UTC), new PatternRandom());

        Authorization authorization = signer.sign("test-key", "test-secret");

        assertEquals(DATE, authorization.date());
        assertEquals(SALT, authorization.salt());
        assertEquals(EXPECTED_SIGNATURE, authorization.signature());
        assertEquals("HMAC-SHA256 apiKey=test-key, date=" + DATE + ", salt=" + SALT + ", signature=" + EXPECTED_SIGNATURE,
            authorization.headerValue());
    }

    @Test
    void signatureIsDeterministicForFixedInputs() {
        assertEquals(EXPECTED_SIGNATURE, HmacSigner.signature("test-secret", DATE, SALT));
        assertEquals(HmacSigner.signature("test-secret", DATE, SALT), HmacSigner.signature("test-secret", DATE, SALT));
        assertNotEquals(EXPECTED_SIGNATURE, HmacSigner.signature("other-secret", DATE, SALT));
    }

    @Test
    void emptySecretStillSigns() {
        assertEquals(EMPTY_SECRET_SIGNATURE, HmacSigner.signature("", DATE, SALT));
        assertEquals(EMPTY_SECRET_SIGNATURE, HmacSigner.signature(null, DATE, SALT));

        Authorization authorization = new HmacSigner().sign(null, null);
        assertEquals("", authorization.apiKey());
        assertTrue(authorization.headerValue().matches(
            "HMAC-SHA256 apiKey=, date=\\S+, salt=[0-9a-f]{40}, signature=[0-9a-f]{64}"));
    }

    @Test
    void freshSaltForEveryCall() {
        HmacSigner signer = new HmacSigner(Clock.fixed(Instant.parse(DATE), ZoneOffset.UTC), new SecureRandom());

        Authorization first = signer.sign("key", "secret");
        Authorization second = signer.sign("key", "secret");

        assertEquals(first.date(), second.date());
        assertNotEquals(first.salt(), second.salt());
        assertNotEquals(first.signature(), second.signature());
    }

    @Test
    void formatsLocalOffsetAndDropsFractionalSeconds() {
        Clock seoul = Clock.fixed(Instant.parse("2024-01-01T00:00:00.789Z"), ZoneOffset.ofHours(9));

        Authorization authorization = new HmacSigner(seoul, new PatternRandom()).sign("key", "secret");

        assertEquals("2024-01-01T09:00:00+09:00", authorization.date());
    }

    /**
     * Fills buffers with 0x01 0x23 ... 0xef repeated.
     */
    private static final class PatternRandom extends Random {

        private static final long serialVersionUID = 1L;

        private static final byte[] PATTERN = {
            0x01, 0x23, 0x45, 0x67, (byte) 0x89, (byte) 0xab, (byte) 0xcd, (byte) 0xef
        };

        @Override
        public void nextBytes(byte[] bytes) {
            for (int i = 0; i < bytes.length; i++) {
                bytes[i] = PATTERN[i % PATTERN.length];
            }
        }
    }
}
