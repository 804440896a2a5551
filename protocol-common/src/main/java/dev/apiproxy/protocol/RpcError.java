package dev.apiproxy.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The {@code error} member of a failure reply.
 *
 * @param code numeric error code
 * @param message human readable description
 * @param data optional structured detail, {@code null} when absent
 */
public record RpcError(int code, String message, JsonNode data) {

    /**
     * Code reserved for plugin-side failures. Hosts only need to recognise this one value.
     */
    public static final int PLUGIN_ERROR_CODE = -32000;

    public static RpcError of(ErrorKind kind, String message) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        data.put("kind", kind.name());
        return new RpcError(PLUGIN_ERROR_CODE, message, data);
    }

    /**
     * Resolve the failure kind from {@code data.kind}, falling back to
     * {@link ErrorKind#HANDLER_ERROR} when the peer did not send one.
     * @return the reported failure kind
     */
    public ErrorKind kind() {
        if (data != null && data.hasNonNull("kind")) {
            try {
                return ErrorKind.valueOf(data.get("kind").asText());
            } catch (IllegalArgumentException e) {
                return ErrorKind.HANDLER_ERROR;
            }
        }
        return ErrorKind.HANDLER_ERROR;
    }
}
