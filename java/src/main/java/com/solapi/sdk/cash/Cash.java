package com.solapi.sdk.cash;

import com.solapi.sdk.SignedRequestClient;
import com.solapi.sdk.SolapiException;

import java.util.Map;
import java.util.Objects;

/**
 * SOLAPI cash resource.
 */
public final class Cash {

    static final String BALANCE_PATH = "cash/v1/balance";

    private final SignedRequestClient requests;

    public Cash(SignedRequestClient requests) {
        this.requests = Objects.requireNonNull(requests, "requests");
    }

    public Balance getBalance() throws SolapiException {
        return requests.get(BALANCE_PATH, Map.of(), Balance.class);
    }
}
