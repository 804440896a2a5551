package dev.apiproxy.protocol.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reserved metadata keys and the merge rule shared by all hooks. Metadata is the only state
 * carried from {@code on_request} to the paired {@code on_response} or {@code on_cache_hit}.
 */
public final class Metadata {

    /** Endpoint as the host first saw it, recorded before a plugin rewrites it. */
    public static final String ORIGINAL_ENDPOINT = "original_endpoint";

    public static final String PROVIDER = "provider";

    public static final String CACHED = "cached";

    private Metadata() {
    }

    /**
     * Merge {@code updates} over {@code base}: existing keys are kept, new keys are added and
     * the update wins on collision. Neither input is modified.
     * @param base current metadata, may be {@code null}
     * @param updates entries to apply, may be {@code null}
     * @return an unmodifiable merged view in insertion order
     */
    public static Map<String, String> merge(Map<String, String> base, Map<String, String> updates) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (updates != null) {
            merged.putAll(updates);
        }
        return Collections.unmodifiableMap(merged);
    }

    static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
