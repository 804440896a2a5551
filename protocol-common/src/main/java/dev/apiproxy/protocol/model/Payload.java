package dev.apiproxy.protocol.model;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * A request or response body. The representation the host sent (text or binary) is kept
 * through every rewrite so the host gets back what it expects.
 * <p>
 * Wire form: a JSON string is a text payload, {@code {"base64": "..."}} is a binary payload and
 * {@code null} is an empty text payload.
 */
@JsonSerialize(using = Payload.Serializer.class)
@JsonDeserialize(using = Payload.Deserializer.class)
public final class Payload {

    private static final Payload EMPTY = new Payload(Representation.TEXT, new byte[0]);

    public enum Representation {
        TEXT, BINARY
    }

    private final Representation representation;
    private final byte[] bytes;

    private Payload(Representation representation, byte[] bytes) {
        this.representation = representation;
        this.bytes = bytes;
    }

    public static Payload empty() {
        return EMPTY;
    }

    public static Payload text(String text) {
        return text == null || text.isEmpty() ? EMPTY : new Payload(Representation.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static Payload binary(byte[] bytes) {
        return new Payload(Representation.BINARY, bytes == null ? new byte[0] : bytes.clone());
    }

    public Representation representation() {
        return representation;
    }

    public boolean isBinary() {
        return representation == Representation.BINARY;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public int size() {
        return bytes.length;
    }

    public String asText() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public byte[] asBytes() {
        return bytes.clone();
    }

    /**
     * Replace the content while keeping this payload's representation.
     * @param text new content
     * @return a payload of the same representation holding {@code text}
     */
    public Payload withText(String text) {
        if (representation == Representation.BINARY) {
            return new Payload(Representation.BINARY, text.getBytes(StandardCharsets.UTF_8));
        }
        return text(text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Payload other)) {
            return false;
        }
        return representation == other.representation && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * representation.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Payload[" + representation + ", " + bytes.length + " bytes]";
    }

    static final class Serializer extends JsonSerializer<Payload> {

        @Override
        public void serialize(Payload value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value.isBinary()) {
                gen.writeStartObject();
                gen.writeStringField("base64", Base64.getEncoder().encodeToString(value.bytes));
                gen.writeEndObject();
            } else {
                gen.writeString(value.asText());
            }
        }
    }

    static final class Deserializer extends JsonDeserializer<Payload> {

        @Override
        public Payload deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                return Payload.text(p.getText());
            }
            JsonNode node = p.readValueAsTree();
            if (node != null && node.isObject() && node.path("base64").isTextual()) {
                try {
                    return Payload.binary(Base64.getDecoder().decode(node.get("base64").asText()));
                } catch (IllegalArgumentException e) {
                    return (Payload) ctxt.handleWeirdStringValue(Payload.class, node.get("base64").asText(),
                        "invalid base64 body");
                }
            }
            return (Payload) ctxt.handleUnexpectedToken(Payload.class, p);
        }

        @Override
        public Payload getNullValue(DeserializationContext ctxt) {
            return Payload.empty();
        }
    }
}
