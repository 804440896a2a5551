package dev.apiproxy.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A decoded call. The id is kept as the raw JSON node so that it can be echoed back exactly as
 * received; a Java {@code null} id means the member was absent (a notification), while a JSON
 * {@code null} id is represented by a {@link com.fasterxml.jackson.databind.node.NullNode}.
 *
 * @param method hook name
 * @param params positional parameters, never {@code null}
 * @param id call id, or {@code null} for a notification
 */
public record RpcRequest(String method, ArrayNode params, JsonNode id) {

    public static final String VERSION = "2.0";

    public RpcRequest {
        Objects.requireNonNull(method, "method");
        params = params == null ? JsonNodeFactory.instance.arrayNode() : params;
    }

    public boolean isNotification() {
        return id == null;
    }

    public int arity() {
        return params.size();
    }

    /**
     * Positional parameter access.
     * @param index zero based parameter index
     * @return the parameter, or {@code null} when fewer params were sent
     */
    public JsonNode param(int index) {
        return index < params.size() ? params.get(index) : null;
    }
}
