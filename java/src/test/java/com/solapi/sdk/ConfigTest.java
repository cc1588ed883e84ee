package com.solapi.sdk;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder().build();

        assertEquals(Config.DEFAULT_PROTOCOL, config.getProtocol());
        assertEquals(Config.DEFAULT_DOMAIN, config.getDomain());
        assertEquals("", config.getPathPrefix());
        assertEquals("", config.getApiKey());
        assertEquals("", config.getApiSecret());
        assertNull(config.getAppId());
        assertEquals(Config.SDK_VERSION, config.getSdkVersion());
        assertEquals(Config.defaultOsPlatform(), config.getOsPlatform());
        assertNotNull(config.getHttpClient());
        assertEquals("https://api.solapi.com/", config.getBaseUrl());
    }

    @Test
    void optionsRecogniseKnownKeysAndIgnoreTheRest() {
        Map<String, String> options = new HashMap<>();
        options.put("apiKey", "key");
        options.put("APISecret", "secret");
        options.put("Protocol", "HTTP");
        options.put("domain", "localhost:8080");
        options.put("Prefix", "gateway/");
        options.put("AppId", "app-1");
        options.put("timeout", "30s");

        Config config = Config.builder().options(options).build();

        assertEquals("key", config.getApiKey());
        assertEquals("secret", config.getApiSecret());
        assertEquals("http", config.getProtocol());
        assertEquals("localhost:8080", config.getDomain());
        assertEquals("gateway/", config.getPathPrefix());
        assertEquals("app-1", config.getAppId());
        assertEquals("http://localhost:8080/gateway/", config.getBaseUrl());
    }

    @Test
    void emptyOptionsAreANoOp() {
        Config.Builder builder = Config.builder().apiKey("key");

        assertDoesNotThrow(() -> builder.options(null));
        assertDoesNotThrow(() -> builder.options(Map.of()));
        assertEquals("key", builder.build().getApiKey());
    }

    @Test
    void withOptionsReturnsReconfiguredCopy() {
        Config original = Config.builder().apiKey("key").apiSecret("secret").build();

        Config updated = original.withOptions(Map.of("pathPrefix", "v2/", "unknown", "x"));

        assertEquals("v2/", updated.getPathPrefix());
        assertEquals("key", updated.getApiKey());
        assertEquals("", original.getPathPrefix());
        assertSame(original.getHttpClient(), updated.getHttpClient());
    }

    @Test
    void withOptionsKeepsCurrentValuesForInvalidOptions() {
        Config original = Config.builder().apiKey("key").domain("localhost:8080").build();

        Config updated = assertDoesNotThrow(() -> original.withOptions(Map.of(
            "protocol", "ftp",
            "domain", "https://api.solapi.com",
            "appId", "app-2"
        )));

        assertEquals("https", updated.getProtocol());
        assertEquals("localhost:8080", updated.getDomain());
        assertEquals("app-2", updated.getAppId());
        assertEquals("key", updated.getApiKey());
    }

    @Test
    void withOptionsIgnoresMalformedDomains() {
        Config original = Config.builder().build();

        assertEquals(Config.DEFAULT_DOMAIN, original.withOptions(Map.of("domain", "api^solapi.com")).getDomain());
        assertEquals(Config.DEFAULT_DOMAIN, original.withOptions(Map.of("domain", "localhost:abc")).getDomain());
    }

    @Test
    void rejectsUnsupportedProtocol() {
        Config.Builder builder = Config.builder().protocol("ftp");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsDomainWithScheme() {
        Config.Builder builder = Config.builder().domain("https://api.solapi.com");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void rejectsMalformedHosts() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().domain("api^solapi.com").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().domain("localhost:abc").build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().domain("api.solapi.com/v4").build());
    }

    @Test
    void acceptsHostWithPort() {
        Config config = Config.builder().protocol("http").domain("127.0.0.1:8080").build();

        assertEquals("http://127.0.0.1:8080/", config.getBaseUrl());
    }

    @Test
    void toStringHidesSecret() {
        Config config = Config.builder().apiKey("key").apiSecret("top-secret").build();

        assertFalse(config.toString().contains("top-secret"));
    }
}
