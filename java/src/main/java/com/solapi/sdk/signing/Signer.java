package com.solapi.sdk.signing;

/**
 * Produces the credentials attached to a single outbound request. Implementations must never hand out the same
 * authorization twice.
 */
public interface Signer {

    Authorization sign(String apiKey, String apiSecret);
}
