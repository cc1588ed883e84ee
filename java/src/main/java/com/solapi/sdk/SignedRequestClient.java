package com.solapi.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solapi.sdk.internal.ApiErrorDecoder;
import com.solapi.sdk.internal.HttpUtil;
import com.solapi.sdk.internal.Json;
import com.solapi.sdk.signing.HmacSigner;
import com.solapi.sdk.signing.Signer;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * Authenticated transport shared by every SOLAPI resource. Each call signs a fresh {@code Authorization} header,
 * sends one request and either decodes the 200 body into the requested type or throws.
 * </p>
 *
 * <h2>Failure modes</h2>
 * <ul>
 *   <li>{@link TransportException}: no response was received (connect, TLS, interrupt).</li>
 *   <li>{@link SerializationException}: the request payload could not be encoded; nothing was sent.</li>
 *   <li>{@link SolapiApiException}: SOLAPI answered with a non-200 status and an error envelope.</li>
 *   <li>{@link DecodeException}: the body could not be decoded, whatever the status.</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and thread-safe. There are no retries.
 * </p>
 */
public final class SignedRequestClient {

    private static final Logger LOGGER = Logger.getLogger(SignedRequestClient.class.getName());

    private static final ObjectMapper MAPPER = Json.mapper();

    private final Config config;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Signer signer;

    public SignedRequestClient(Config config) {
        this(config, new HmacSigner());
    }

    /**
     * @param config configuration; defaults are applied to a copy, so later changes to the source have no effect.
     * @param signer produces the per-request authorization.
     */
    public SignedRequestClient(Config config, Signer signer) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.baseUrl = this.config.getBaseUrl();
        this.signer = Objects.requireNonNull(signer, "signer");
    }

    public Config getConfig() {
        return config;
    }

    public <T> T get(String resourcePath, Map<String, String> queryParams, Class<T> resultType) throws SolapiException {
        return execute("GET", HttpUtil.withQuery(url(resourcePath), queryParams), null, MAPPER.constructType(resultType));
    }

    public <T> T get(String resourcePath, Map<String, String> queryParams, TypeReference<T> resultType) throws SolapiException {
        return execute("GET", HttpUtil.withQuery(url(resourcePath), queryParams), null, MAPPER.constructType(resultType));
    }

    /**
     * Sends {@code payload} as a JSON body with the given method.
     *
     * @param payload any Jackson-serializable value; {@code null} is sent as a JSON {@code null}.
     */
    public <T> T send(String method, String resourcePath, Object payload, Class<T> resultType) throws SolapiException {
        return execute(method, url(resourcePath), encode(payload), MAPPER.constructType(resultType));
    }

    public <T> T send(String method, String resourcePath, Object payload, TypeReference<T> resultType) throws SolapiException {
        return execute(method, url(resourcePath), encode(payload), MAPPER.constructType(resultType));
    }

    public <T> T post(String resourcePath, Object payload, Class<T> resultType) throws SolapiException {
        return send("POST", resourcePath, payload, resultType);
    }

    public <T> T post(String resourcePath, Object payload, TypeReference<T> resultType) throws SolapiException {
        return send("POST", resourcePath, payload, resultType);
    }

    public <T> T put(String resourcePath, Object payload, Class<T> resultType) throws SolapiException {
        return send("PUT", resourcePath, payload, resultType);
    }

    public <T> T put(String resourcePath, Object payload, TypeReference<T> resultType) throws SolapiException {
        return send("PUT", resourcePath, payload, resultType);
    }

    public <T> T delete(String resourcePath, Object payload, Class<T> resultType) throws SolapiException {
        return send("DELETE", resourcePath, payload, resultType);
    }

    public <T> T delete(String resourcePath, Object payload, TypeReference<T> resultType) throws SolapiException {
        return send("DELETE", resourcePath, payload, resultType);
    }

    private <T> T execute(String method, String url, byte[] body, JavaType resultType) throws SolapiException {
        Objects.requireNonNull(method, "method");
        String verb = method.toUpperCase(Locale.ROOT);
        String authorization = signer.sign(config.getApiKey(), config.getApiSecret()).headerValue();

        LOGGER.fine(() -> String.format(Locale.ROOT, "[solapi-sdk] %s %s", verb, url));
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.sendJson(httpClient, verb, url, body, authorization);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new TransportException(verb + " " + url + " interrupted", ex);
            }
            LOGGER.log(Level.FINE, ex, () -> "[solapi-sdk] " + verb + " " + url + " failed before a response");
            throw new TransportException(verb + " " + url + ": " + ex.getMessage(), ex);
        }

        int status = response.statusCode();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[solapi-sdk] %s %s returned %d", verb, url, status));
        if (status != 200) {
            throw ApiErrorDecoder.decode(status, response.body());
        }

        try {
            return MAPPER.readValue(response.body(), resultType);
        } catch (IOException ex) {
            throw new DecodeException(status, "decode " + verb + " " + url + " response: " + ex.getMessage(), ex);
        }
    }

    private String url(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath");
        return baseUrl + resourcePath;
    }

    private static byte[] encode(Object payload) throws SerializationException {
        try {
            return MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new SerializationException("encode request payload: " + ex.getOriginalMessage(), ex);
        }
    }
}
