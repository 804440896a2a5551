package dev.apiproxy.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * A reply to exactly one call. Exactly one of {@code result} and {@code error} is set.
 *
 * @param id the id of the call being answered, or {@code null} when it could not be recovered
 * @param result success value, {@code null} for failure replies
 * @param error failure detail, {@code null} for success replies
 */
public record RpcResponse(JsonNode id, JsonNode result, RpcError error) {

    public RpcResponse {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static RpcResponse success(JsonNode id, JsonNode result) {
        return new RpcResponse(id, result == null ? NullNode.getInstance() : result, null);
    }

    public static RpcResponse failure(JsonNode id, RpcError error) {
        return new RpcResponse(id, null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
