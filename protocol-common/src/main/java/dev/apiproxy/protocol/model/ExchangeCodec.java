package dev.apiproxy.protocol.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;

/**
 * Maps exchange values to and from the forms they take inside an envelope. Hook params carry
 * {@link ProxyRequest} and {@link ProxyResponse} as encoded JSON text; hook results carry them as
 * JSON objects. Decoding accepts either form.
 */
public final class ExchangeCodec {

    public static final String FIELD_REQUEST = "request";
    public static final String FIELD_CONTINUE = "continue";
    public static final String FIELD_RESPONSE = "response";

    private final ObjectMapper mapper;

    public ExchangeCodec() {
        this(JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build());
    }

    public ExchangeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encodeRequest(ProxyRequest request) {
        return writeText(request);
    }

    public String encodeResponse(ProxyResponse response) {
        return writeText(response);
    }

    public ProxyRequest decodeRequest(JsonNode value) throws IOException {
        return read(value, ProxyRequest.class);
    }

    public ProxyResponse decodeResponse(JsonNode value) throws IOException {
        return read(value, ProxyResponse.class);
    }

    public JsonNode toTree(ProxyRequest request) {
        return mapper.valueToTree(request);
    }

    public JsonNode toTree(ProxyResponse response) {
        return mapper.valueToTree(response);
    }

    public JsonNode toTree(RequestOutcome outcome) {
        ObjectNode node = mapper.createObjectNode();
        node.set(FIELD_REQUEST, toTree(outcome.request()));
        node.put(FIELD_CONTINUE, outcome.proceed());
        if (outcome.response() != null) {
            node.set(FIELD_RESPONSE, toTree(outcome.response()));
        }
        return node;
    }

    /**
     * Decode an {@code on_request} result.
     * @param value the {@code result} member of the reply
     * @return the decoded outcome
     * @throws IOException when the result is malformed, including a short-circuit without a
     * response
     */
    public RequestOutcome decodeOutcome(JsonNode value) throws IOException {
        if (value == null || !value.isObject()) {
            throw new IOException("on_request result is not an object");
        }
        JsonNode requestNode = value.get(FIELD_REQUEST);
        if (requestNode == null || requestNode.isNull()) {
            throw new IOException("on_request result has no request");
        }
        JsonNode proceedNode = value.get(FIELD_CONTINUE);
        if (proceedNode == null || !proceedNode.isBoolean()) {
            throw new IOException("on_request result has no boolean continue flag");
        }
        ProxyRequest request = decodeRequest(requestNode);
        if (proceedNode.booleanValue()) {
            return RequestOutcome.proceed(request);
        }
        JsonNode responseNode = value.get(FIELD_RESPONSE);
        if (responseNode == null || responseNode.isNull()) {
            throw new IOException("on_request short-circuited without a response");
        }
        return RequestOutcome.shortCircuit(request, decodeResponse(responseNode));
    }

    private <T> T read(JsonNode value, Class<T> type) throws IOException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new IOException("Missing " + type.getSimpleName());
        }
        if (value.isTextual()) {
            return mapper.readValue(value.asText(), type);
        }
        if (value.isObject()) {
            return mapper.treeToValue(value, type);
        }
        throw new IOException(type.getSimpleName() + " must be encoded text or an object, got " + value.getNodeType());
    }

    private String writeText(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
