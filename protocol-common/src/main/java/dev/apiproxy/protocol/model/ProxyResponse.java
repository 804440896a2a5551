package dev.apiproxy.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An upstream or cached response as seen by a plugin.
 *
 * @param statusCode HTTP status
 * @param headers single valued headers
 * @param body response body
 * @param cached whether the host served this response from its cache
 * @param metadata plugin metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProxyResponse(
    @JsonProperty("status_code") int statusCode,
    @JsonProperty("headers") Map<String, String> headers,
    @JsonProperty("body") Payload body,
    @JsonProperty("cached") boolean cached,
    @JsonProperty("metadata") Map<String, String> metadata
) {

    public ProxyResponse {
        headers = Metadata.copyOf(headers);
        body = Objects.requireNonNullElse(body, Payload.empty());
        metadata = Metadata.copyOf(metadata);
    }

    public static ProxyResponse of(int statusCode, Payload body) {
        return new ProxyResponse(statusCode, null, body, false, null);
    }

    public ProxyResponse withStatusCode(int newStatusCode) {
        return new ProxyResponse(newStatusCode, headers, body, cached, metadata);
    }

    public ProxyResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ProxyResponse(statusCode, copy, body, cached, metadata);
    }

    public ProxyResponse withBody(Payload newBody) {
        return new ProxyResponse(statusCode, headers, newBody, cached, metadata);
    }

    public ProxyResponse withCached(boolean newCached) {
        return new ProxyResponse(statusCode, headers, body, newCached, metadata);
    }

    /**
     * Merge entries into the metadata, the new values winning on collision.
     * @param updates entries to add or replace
     * @return a copy with merged metadata
     */
    public ProxyResponse withMetadata(Map<String, String> updates) {
        return new ProxyResponse(statusCode, headers, body, cached, Metadata.merge(metadata, updates));
    }

    public ProxyResponse withMetadata(String key, String value) {
        return withMetadata(Map.of(key, value));
    }
}
