package com.solapi.sdk.signing;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Random;

/**
 * Signer implementing SOLAPI's HMAC-SHA256 scheme: a fresh random salt and the current time are signed with the API
 * secret for every call.
 */
public final class HmacSigner implements Signer {

    public static final String ALGORITHM = "HmacSHA256";
    public static final int SALT_BYTES = 20;

    // HMAC pads keys to the block size with zeros, so a single zero byte signs exactly like an empty key.
    private static final byte[] EMPTY_KEY = new byte[] {0};

    private static final HexFormat HEX = HexFormat.of();

    private final Clock clock;
    private final Random random;

    public HmacSigner() {
        this(Clock.systemDefaultZone(), new SecureRandom());
    }

    HmacSigner(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public Authorization sign(String apiKey, String apiSecret) {
        String date = OffsetDateTime.now(clock)
            .truncatedTo(ChronoUnit.SECONDS)
            .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String salt = salt();
        String signature = signature(apiSecret, date, salt);
        return new Authorization(apiKey == null ? "" : apiKey, date, salt, signature);
    }

    /**
     * Computes the hex signature for a fixed date and salt.
     */
    public static String signature(String apiSecret, String date, String salt) {
        byte[] key = apiSecret == null || apiSecret.isEmpty()
            ? EMPTY_KEY
            : apiSecret.getBytes(StandardCharsets.UTF_8);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] digest = mac.doFinal((date + salt).getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest);
        } catch (GeneralSecurityException ex) {
            // HmacSHA256 is mandatory on every Java platform.
            throw new IllegalStateException("HmacSHA256 unavailable", ex);
        }
    }

    private String salt() {
        byte[] bytes = new byte[SALT_BYTES];
        random.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }
}
