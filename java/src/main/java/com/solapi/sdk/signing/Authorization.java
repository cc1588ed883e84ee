package com.solapi.sdk.signing;

/**
 * One-shot credentials for a SOLAPI request.
 *
 * @param apiKey    public API key identifying the account.
 * @param date      RFC 3339 timestamp the signature is bound to.
 * @param salt      hex encoded random nonce.
 * @param signature hex encoded HMAC-SHA256 of {@code date + salt} keyed with the API secret.
 */
public record Authorization(String apiKey, String date, String salt, String signature) {

    public static final String SCHEME = "HMAC-SHA256";

    /**
     * @return the value for the {@code Authorization} request header.
     */
    public String headerValue() {
        return SCHEME + " apiKey=" + apiKey + ", date=" + date + ", salt=" + salt + ", signature=" + signature;
    }
}
