package com.github.dimitryivaniuta.telemetry.proxy.cache;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;

/**
 * Cache key scheme shared with other deployments of the proxy. Keys must stay bit-for-bit
 * stable:
 * <ul>
 *   <li>{@code adx:<md5(query)>}</li>
 *   <li>{@code <batchPrefix>:<serial>:<md5(sorted names joined by ':')>}</li>
 * </ul>
 */
public final class CacheKeys {
    private CacheKeys() {}

    public static final String QUERY_PREFIX = "adx";

    public static String forQuery(String query) {
        return QUERY_PREFIX + ":" + md5Hex(query);
    }

    public static String forBatch(String batchPrefix, String serial, Collection<String> names) {
        List<String> sorted = names.stream().sorted().toList();
        return batchPrefix + ":" + serial + ":" + md5Hex(String.join(":", sorted));
    }

    // short suffix for logs
    public static String shortForm(String key) {
        return key.length() <= 8 ? key : key.substring(key.length() - 8);
    }

    private static String md5Hex(String text) {
        return DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
    }
}
