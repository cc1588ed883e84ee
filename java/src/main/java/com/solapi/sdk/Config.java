package com.solapi.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Immutable configuration container used to bootstrap {@link SolapiClient} and {@link SignedRequestClient} instances.
 */
public final class Config {

    private static final Logger LOGGER = Logger.getLogger(Config.class.getName());

    public static final String DEFAULT_PROTOCOL = "https";
    public static final String DEFAULT_DOMAIN = "api.solapi.com";
    public static final String DEFAULT_PATH_PREFIX = "";
    public static final String SDK_VERSION = "JAVA-SDK v1.0";

    private final String apiKey;
    private final String apiSecret;
    private final String protocol;
    private final String domain;
    private final String pathPrefix;
    private final String appId;
    private final String sdkVersion;
    private final String osPlatform;
    private final HttpClient httpClient;

    private Config(Builder builder) {
        this.apiKey = builder.apiKey;
        this.apiSecret = builder.apiSecret;
        this.protocol = builder.protocol;
        this.domain = builder.domain;
        this.pathPrefix = builder.pathPrefix;
        this.appId = builder.appId;
        this.sdkVersion = builder.sdkVersion;
        this.osPlatform = builder.osPlatform;
        this.httpClient = builder.httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a copy with defaults applied and values validated. Blank credentials are kept as empty strings: requests
     * are still signed, the API simply rejects them.
     *
     * @throws IllegalArgumentException when the protocol is not http/https or the domain is malformed.
     */
    public Config withDefaults() {
        String resolvedProtocol = Optional.ofNullable(trimToNull(protocol)).orElse(DEFAULT_PROTOCOL)
            .toLowerCase(Locale.ROOT);
        if (!resolvedProtocol.equals("https") && !resolvedProtocol.equals("http")) {
            throw new IllegalArgumentException("unsupported Protocol " + protocol);
        }

        String resolvedDomain = Optional.ofNullable(trimToNull(domain)).orElse(DEFAULT_DOMAIN);
        validateDomain(resolvedProtocol, resolvedDomain);

        String resolvedPrefix = Optional.ofNullable(trimToNull(pathPrefix)).orElse(DEFAULT_PATH_PREFIX);
        while (resolvedPrefix.startsWith("/")) {
            resolvedPrefix = resolvedPrefix.substring(1);
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newHttpClient();
        }

        return new Builder()
            .apiKey(Optional.ofNullable(apiKey).orElse(""))
            .apiSecret(Optional.ofNullable(apiSecret).orElse(""))
            .protocol(resolvedProtocol)
            .domain(resolvedDomain)
            .pathPrefix(resolvedPrefix)
            .appId(trimToNull(appId))
            .sdkVersion(Optional.ofNullable(trimToNull(sdkVersion)).orElse(SDK_VERSION))
            .osPlatform(Optional.ofNullable(trimToNull(osPlatform)).orElseGet(Config::defaultOsPlatform))
            .httpClient(resolvedClient)
            .buildInternal();
    }

    /**
     * Returns a reconfigured copy. Recognised keys replace the current values, everything else is ignored. An option
     * whose value would not validate (for example {@code protocol=ftp}) is skipped and the current value kept, so this
     * method never throws.
     *
     * @see Builder#options(Map)
     */
    public Config withOptions(Map<String, String> options) {
        Config result = this;
        if (options == null || options.isEmpty()) {
            return result;
        }
        for (Map.Entry<String, String> entry : options.entrySet()) {
            if (entry.getKey() == null) {
                continue;
            }
            try {
                result = result.toBuilder()
                    .options(Collections.singletonMap(entry.getKey(), entry.getValue()))
                    .build();
            } catch (IllegalArgumentException ex) {
                LOGGER.warning(() -> "[solapi-sdk] ignoring option " + entry.getKey() + ": " + ex.getMessage());
            }
        }
        return result;
    }

    public Builder toBuilder() {
        return new Builder()
            .apiKey(apiKey)
            .apiSecret(apiSecret)
            .protocol(protocol)
            .domain(domain)
            .pathPrefix(pathPrefix)
            .appId(appId)
            .sdkVersion(sdkVersion)
            .osPlatform(osPlatform)
            .httpClient(httpClient);
    }

    /**
     * @return {@code protocol://domain/pathPrefix}, to which resource paths are appended verbatim.
     */
    public String getBaseUrl() {
        return protocol + "://" + domain + "/" + pathPrefix;
    }

    private static void validateDomain(String protocol, String domain) {
        if (domain.contains("/")) {
            throw new IllegalArgumentException("Domain must be a bare host[:port], got " + domain);
        }
        try {
            URI uri = new URI(protocol + "://" + domain + "/");
            // an unparseable port leaves the authority registry-based, with no host
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Domain must be a bare host[:port], got " + domain);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid Domain: " + domain, ex);
        }
    }

    static String defaultOsPlatform() {
        return System.getProperty("os.name", "unknown") + "/" + System.getProperty("java.version", "unknown");
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getApiSecret() {
        return apiSecret;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getDomain() {
        return domain;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public String getAppId() {
        return appId;
    }

    public String getSdkVersion() {
        return sdkVersion;
    }

    public String getOsPlatform() {
        return osPlatform;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public String toString() {
        return "Config{apiKey=" + apiKey + ", baseUrl=" + protocol + "://" + domain + "/" + pathPrefix
            + ", appId=" + appId + "}";
    }

    public static final class Builder {
        private String apiKey;
        private String apiSecret;
        private String protocol;
        private String domain;
        private String pathPrefix;
        private String appId;
        private String sdkVersion;
        private String osPlatform;
        private HttpClient httpClient;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder apiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder pathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
            return this;
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder sdkVersion(String sdkVersion) {
            this.sdkVersion = sdkVersion;
            return this;
        }

        public Builder osPlatform(String osPlatform) {
            this.osPlatform = osPlatform;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        /**
         * Applies a loosely typed option map, for example one assembled from a properties file. Keys are matched
         * case-insensitively against {@code apiKey}, {@code apiSecret}, {@code protocol}, {@code domain},
         * {@code pathPrefix} (or {@code prefix}) and {@code appId}; unknown keys are ignored. A {@code null} or empty
         * map leaves the builder untouched.
         */
        public Builder options(Map<String, String> options) {
            if (options == null || options.isEmpty()) {
                return this;
            }
            for (Map.Entry<String, String> entry : options.entrySet()) {
                if (entry.getKey() == null) {
                    continue;
                }
                String value = entry.getValue();
                switch (entry.getKey().trim().toLowerCase(Locale.ROOT)) {
                    case "apikey" -> apiKey = value;
                    case "apisecret" -> apiSecret = value;
                    case "protocol" -> protocol = value;
                    case "domain" -> domain = value;
                    case "pathprefix", "prefix" -> pathPrefix = value;
                    case "appid" -> appId = value;
                    default -> {
                        // not a configuration key
                    }
                }
            }
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
