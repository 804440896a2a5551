package dev.apiproxy.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Outcome of decoding one line: either a call, or an error together with whatever id could be
 * recovered from the line.
 */
public final class DecodeResult {

    private final RpcRequest request;
    private final RpcError error;
    private final JsonNode recoveredId;

    private DecodeResult(RpcRequest request, RpcError error, JsonNode recoveredId) {
        this.request = request;
        this.error = error;
        this.recoveredId = recoveredId;
    }

    public static DecodeResult success(RpcRequest request) {
        return new DecodeResult(Objects.requireNonNull(request, "request"), null, request.id());
    }

    public static DecodeResult failure(JsonNode recoveredId, RpcError error) {
        return new DecodeResult(null, Objects.requireNonNull(error, "error"), recoveredId);
    }

    public boolean isSuccess() {
        return request != null;
    }

    public RpcRequest request() {
        if (request == null) {
            throw new IllegalStateException("Decode failed: " + error.message());
        }
        return request;
    }

    public RpcError error() {
        return error;
    }

    /**
     * Id to answer with: the call id on success, the recovered id (possibly {@code null}) on
     * failure.
     * @return the reply id
     */
    public JsonNode replyId() {
        return recoveredId;
    }

    /**
     * The reply owed for a failed decode.
     * @return failure reply carrying the recovered id
     */
    public RpcResponse toFailureReply() {
        if (error == null) {
            throw new IllegalStateException("Decode succeeded");
        }
        return RpcResponse.failure(recoveredId, error);
    }
}
