package dev.apiproxy.protocol;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import java.io.IOException;

/**
 * Line codec for the JSON-RPC 2.0 envelope. One message per line; decoding never throws, it
 * returns a {@link DecodeResult} instead.
 */
public final class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(JsonMapper.builder()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
            .build());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public DecodeResult decode(String line) {
        JsonNode root;
        try {
            root = mapper.readTree(line);
        } catch (JsonProcessingException e) {
            return DecodeResult.failure(recoverId(line),
                RpcError.of(ErrorKind.PARSE_ERROR, "Parse error: " + e.getOriginalMessage()));
        }
        if (root == null || !root.isObject()) {
            return DecodeResult.failure(null, RpcError.of(ErrorKind.PARSE_ERROR, "Parse error: message is not a JSON object"));
        }

        JsonNode id = root.get("id");
        if (id != null && !isValidId(id)) {
            return DecodeResult.failure(null, RpcError.of(ErrorKind.PARSE_ERROR, "Parse error: id must be a string, number or null"));
        }
        if (id != null && id.isFloatingPointNumber()) {
            // Keep the id as it was spelled; 1e2 must not come back as 1E+2.
            JsonNode spelled = recoverId(line);
            if (spelled != null) {
                id = spelled;
            }
        }
        JsonNode version = root.get("jsonrpc");
        if (version != null && !(version.isTextual() && RpcRequest.VERSION.equals(version.asText()))) {
            return DecodeResult.failure(id,
                RpcError.of(ErrorKind.VERSION_ERROR, "Unsupported jsonrpc version: " + version));
        }
        JsonNode method = root.get("method");
        if (method == null || !method.isTextual()) {
            return DecodeResult.failure(id, RpcError.of(ErrorKind.PARSE_ERROR, "Parse error: method must be a string"));
        }
        JsonNode params = root.get("params");
        ArrayNode paramsArray;
        if (params == null || params.isNull()) {
            paramsArray = mapper.createArrayNode();
        } else if (params.isArray()) {
            paramsArray = (ArrayNode) params;
        } else {
            return DecodeResult.failure(id, RpcError.of(ErrorKind.PARSE_ERROR, "Parse error: params must be an array"));
        }
        return DecodeResult.success(new RpcRequest(method.asText(), paramsArray, id));
    }

    /**
     * Serialize a reply as one newline-terminated line. The id member is always written,
     * as {@code null} when unknown.
     * @param response reply to serialize
     * @return the encoded line including the trailing newline
     */
    public String encode(RpcResponse response) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", RpcRequest.VERSION);
        if (response.isError()) {
            RpcError error = response.error();
            ObjectNode errorNode = node.putObject("error");
            errorNode.put("code", error.code());
            errorNode.put("message", error.message());
            if (error.data() != null && !error.data().isNull()) {
                errorNode.set("data", error.data());
            }
        } else {
            node.set("result", response.result());
        }
        node.set("id", response.id() == null ? mapper.nullNode() : response.id());
        return write(node) + "\n";
    }

    public String encodeRequest(RpcRequest request) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", RpcRequest.VERSION);
        node.put("method", request.method());
        node.set("params", request.params());
        if (!request.isNotification()) {
            node.set("id", request.id());
        }
        return write(node) + "\n";
    }

    /**
     * Host side decoding of a reply line.
     * @param line reply line as read from the plugin
     * @return the decoded reply
     * @throws IOException when the line is not a well-formed reply
     */
    public RpcResponse decodeResponse(String line) throws IOException {
        JsonNode root = mapper.readTree(line);
        if (root == null || !root.isObject()) {
            throw new IOException("Reply is not a JSON object");
        }
        JsonNode version = root.get("jsonrpc");
        if (version != null && !RpcRequest.VERSION.equals(version.asText())) {
            throw new IOException("Unsupported jsonrpc version in reply: " + version);
        }
        JsonNode id = root.get("id");
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            if (!error.isObject()) {
                throw new IOException("Reply error member is not an object");
            }
            RpcError rpcError = new RpcError(error.path("code").asInt(RpcError.PLUGIN_ERROR_CODE),
                error.path("message").asText(""), error.get("data"));
            return RpcResponse.failure(id, rpcError);
        }
        if (!root.has("result")) {
            throw new IOException("Reply carries neither result nor error");
        }
        return RpcResponse.success(id, root.get("result"));
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize envelope", e);
        }
    }

    private static boolean isValidId(JsonNode id) {
        return id.isTextual() || id.isNumber() || id.isNull();
    }

    /**
     * Best effort scan for a top level {@code "id"} member in a line that failed to parse as a
     * whole. Tokens are consumed until the id is found or the parser gives up.
     */
    private JsonNode recoverId(String line) {
        try (JsonParser parser = mapper.getFactory().createParser(line)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            int depth = 1;
            JsonToken token;
            while (depth > 0 && (token = parser.nextToken()) != null) {
                if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
                    depth++;
                } else if (token == JsonToken.END_OBJECT || token == JsonToken.END_ARRAY) {
                    depth--;
                } else if (depth == 1 && token == JsonToken.FIELD_NAME && "id".equals(parser.getCurrentName())) {
                    return scalarId(parser, parser.nextToken());
                }
            }
            return null;
        } catch (IOException e) {
            return null;
        }
    }

    /**
     * Id node for the scalar the parser stands on, or {@code null} when it is not a legal id.
     * Fractional and exponent numbers keep their source text.
     */
    private JsonNode scalarId(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            return null;
        }
        JsonNodeFactory nodes = mapper.getNodeFactory();
        return switch (token) {
            case VALUE_STRING -> nodes.textNode(parser.getText());
            case VALUE_NUMBER_INT -> nodes.numberNode(parser.getBigIntegerValue());
            case VALUE_NUMBER_FLOAT -> nodes.rawValueNode(new RawValue(parser.getText()));
            case VALUE_NULL -> nodes.nullNode();
            default -> null;
        };
    }
}
