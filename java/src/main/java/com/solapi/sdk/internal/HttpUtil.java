package com.solapi.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Helper methods for issuing signed HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    /**
     * Sends one request and reads the whole response body, so the connection is released before this method returns.
     *
     * @param body encoded JSON, or {@code null} for a request without a body.
     */
    public static HttpResponse<byte[]> sendJson(HttpClient client, String method, String url, byte[] body, String authorization)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url));

        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        }

        builder.header("Content-Type", "application/json");
        builder.header("Accept", "application/json");
        builder.header("Authorization", authorization);

        HttpRequest request = builder.build();
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    /**
     * Appends URL-encoded query parameters, sorted by key, to {@code url}. Entries with a {@code null} key are skipped.
     */
    public static String withQuery(String url, Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return url;
        }
        Map<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() != null) {
                sorted.put(entry.getKey(), entry.getValue() == null ? "" : entry.getValue());
            }
        }
        if (sorted.isEmpty()) {
            return url;
        }
        StringJoiner query = new StringJoiner("&");
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            query.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
        }
        return url + (url.contains("?") ? "&" : "?") + query;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
