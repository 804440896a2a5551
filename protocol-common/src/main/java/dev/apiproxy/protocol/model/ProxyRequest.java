package dev.apiproxy.protocol.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A proxied client request as seen by a plugin. Instances are immutable; the {@code with*}
 * methods return modified copies.
 *
 * @param method HTTP method
 * @param endpoint request path
 * @param headers single valued headers
 * @param body request body
 * @param metadata plugin metadata carried to the paired response hook
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProxyRequest(
    @JsonProperty("method") String method,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty("headers") Map<String, String> headers,
    @JsonProperty("body") Payload body,
    @JsonProperty("metadata") Map<String, String> metadata
) {

    public ProxyRequest {
        method = Objects.requireNonNullElse(method, "GET");
        endpoint = Objects.requireNonNullElse(endpoint, "/");
        headers = Metadata.copyOf(headers);
        body = Objects.requireNonNullElse(body, Payload.empty());
        metadata = Metadata.copyOf(metadata);
    }

    public static ProxyRequest of(String method, String endpoint) {
        return new ProxyRequest(method, endpoint, null, null, null);
    }

    public ProxyRequest withEndpoint(String newEndpoint) {
        return new ProxyRequest(method, newEndpoint, headers, body, metadata);
    }

    public ProxyRequest withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new ProxyRequest(method, endpoint, copy, body, metadata);
    }

    public ProxyRequest withHeaders(Map<String, String> newHeaders) {
        return new ProxyRequest(method, endpoint, newHeaders, body, metadata);
    }

    public ProxyRequest withBody(Payload newBody) {
        return new ProxyRequest(method, endpoint, headers, newBody, metadata);
    }

    /**
     * Merge entries into the metadata, the new values winning on collision.
     * @param updates entries to add or replace
     * @return a copy with merged metadata
     */
    public ProxyRequest withMetadata(Map<String, String> updates) {
        return new ProxyRequest(method, endpoint, headers, body, Metadata.merge(metadata, updates));
    }

    public ProxyRequest withMetadata(String key, String value) {
        return withMetadata(Map.of(key, value));
    }

    /**
     * Rewrite the endpoint, recording the current one under {@link Metadata#ORIGINAL_ENDPOINT}
     * first. A value recorded by an earlier rewrite is kept.
     * @param newEndpoint the endpoint to forward to
     * @return a copy with the rewritten endpoint
     */
    public ProxyRequest rewriteEndpoint(String newEndpoint) {
        ProxyRequest recorded = metadata.containsKey(Metadata.ORIGINAL_ENDPOINT)
            ? this
            : withMetadata(Metadata.ORIGINAL_ENDPOINT, endpoint);
        return recorded.withEndpoint(newEndpoint);
    }

    public String metadataValue(String key) {
        return metadata.get(key);
    }
}
