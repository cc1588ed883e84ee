package com.solapi.sdk;

import java.util.Map;
import java.util.Objects;

/**
 * Reads SDK settings from {@code SOLAPI_*} environment variables. Kept apart from {@link Config} so the rest of the SDK
 * never touches process-global state.
 */
public final class EnvironmentConfig {

    public static final String API_KEY = "SOLAPI_API_KEY";
    public static final String API_SECRET = "SOLAPI_API_SECRET";
    public static final String PROTOCOL = "SOLAPI_PROTOCOL";
    public static final String DOMAIN = "SOLAPI_DOMAIN";
    public static final String PREFIX = "SOLAPI_PREFIX";
    public static final String APP_ID = "SOLAPI_APP_ID";

    private final Map<String, String> variables;

    public EnvironmentConfig() {
        this(System.getenv());
    }

    public EnvironmentConfig(Map<String, String> variables) {
        this.variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    /**
     * @return a builder pre-populated from the environment. Unset or blank variables are skipped so builder defaults
     * still apply; callers may override any field before building.
     */
    public Config.Builder toBuilder() {
        Config.Builder builder = Config.builder();
        String value;
        if ((value = lookup(API_KEY)) != null) {
            builder.apiKey(value);
        }
        if ((value = lookup(API_SECRET)) != null) {
            builder.apiSecret(value);
        }
        if ((value = lookup(PROTOCOL)) != null) {
            builder.protocol(value);
        }
        if ((value = lookup(DOMAIN)) != null) {
            builder.domain(value);
        }
        if ((value = lookup(PREFIX)) != null) {
            builder.pathPrefix(value);
        }
        if ((value = lookup(APP_ID)) != null) {
            builder.appId(value);
        }
        return builder;
    }

    public Config load() {
        return toBuilder().build();
    }

    private String lookup(String name) {
        String value = variables.get(name);
        return value == null || value.isBlank() ? null : value;
    }
}
