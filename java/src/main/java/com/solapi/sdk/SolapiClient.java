package com.solapi.sdk;

import com.solapi.sdk.cash.Cash;
import com.solapi.sdk.messages.Messages;
import com.solapi.sdk.storage.Storage;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the SOLAPI SDK. The client is lightweight and thread-safe: create one per set of
 * credentials and reuse it. Every resource shares a single {@link SignedRequestClient}, so each call is signed
 * independently and no state is carried between calls.
 * </p>
 *
 * <pre>{@code
 * SolapiClient client = SolapiClient.fromEnvironment();
 * SendResult result = client.messages().sendSimpleMessage(Message.text("01000000000", "0212345678", "hello"));
 * }</pre>
 */
public final class SolapiClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SolapiClient.class.getName());

    private final SignedRequestClient requests;
    private final Messages messages;
    private final Storage storage;
    private final Cash cash;

    public SolapiClient(Config config) {
        this(new SignedRequestClient(Objects.requireNonNull(config, "config")));
    }

    public SolapiClient(SignedRequestClient requests) {
        this.requests = Objects.requireNonNull(requests, "requests");
        this.messages = new Messages(requests);
        this.storage = new Storage(requests);
        this.cash = new Cash(requests);
        LOGGER.fine(() -> "[solapi-sdk] client ready for " + requests.getConfig().getBaseUrl());
    }

    /**
     * Builds a client from the {@code SOLAPI_*} environment variables.
     *
     * @see EnvironmentConfig
     */
    public static SolapiClient fromEnvironment() {
        return new SolapiClient(new EnvironmentConfig().load());
    }

    public Messages messages() {
        return messages;
    }

    public Storage storage() {
        return storage;
    }

    public Cash cash() {
        return cash;
    }

    /**
     * @return the signed transport, for API endpoints without a dedicated resource wrapper.
     */
    public SignedRequestClient requests() {
        return requests;
    }

    /**
     * Closes the client. A no-op: the underlying {@link java.net.http.HttpClient} is owned by the configuration.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }
}
