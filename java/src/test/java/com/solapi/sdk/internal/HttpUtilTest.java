package com.solapi.sdk.internal;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpUtilTest {

    @Test
    void appendsSortedEncodedQuery() {
        Map<String, String> params = new HashMap<>();
        params.put("to", "010 1234");
        params.put("limit", "20");

        assertEquals("https://api.solapi.com/x?limit=20&to=010+1234",
            HttpUtil.withQuery("https://api.solapi.com/x", params));
    }

    @Test
    void skipsNullKeys() {
        Map<String, String> params = new HashMap<>();
        params.put(null, "ignored");
        params.put("type", "MMS");

        assertEquals("https://api.solapi.com/x?type=MMS", HttpUtil.withQuery("https://api.solapi.com/x", params));
    }

    @Test
    void onlyNullKeysLeaveUrlUntouched() {
        Map<String, String> params = new HashMap<>();
        params.put(null, "ignored");

        assertEquals("https://api.solapi.com/x", HttpUtil.withQuery("https://api.solapi.com/x", params));
    }
}
