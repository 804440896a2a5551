package dev.apiproxy.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dev.apiproxy.plugins.logger.RequestLoggerPlugin;
import dev.apiproxy.protocol.ErrorKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginConnection")
class PluginConnectionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper mapper = new ObjectMapper();
    private PluginConnection connection;

    @AfterEach
    void tearDown() throws IOException {
        if (connection != null) {
            connection.close();
        }
    }

    private ArrayNode noParams() {
        return mapper.createArrayNode();
    }

    @Nested
    @DisplayName("against a running plugin")
    class Live {

        @Test
        @DisplayName("returns the result of the call")
        void result() throws PluginCallException {
            connection = InProcessPlugin.start("logger", new RequestLoggerPlugin());

            JsonNode info = connection.call("get_info", noParams(), TIMEOUT);

            assertEquals("request_logger", info.get("name").asText());
            assertEquals("1.0.0", info.get("version").asText());
        }

        @Test
        @DisplayName("error replies surface with their kind")
        void errorReply() {
            connection = InProcessPlugin.start("logger", new RequestLoggerPlugin());

            PluginCallException e = assertThrows(PluginCallException.class,
                () -> connection.call("shutdown", noParams(), TIMEOUT));

            assertEquals(ErrorKind.STATE_ERROR, e.getKind());
            assertEquals("shutdown", e.getMethod());
            assertTrue(connection.isOpen());
        }

        @Test
        @DisplayName("unknown methods are reported as method not found")
        void unknownMethod() {
            connection = InProcessPlugin.start("logger", new RequestLoggerPlugin());

            PluginCallException e = assertThrows(PluginCallException.class,
                () -> connection.call("frobnicate", noParams(), TIMEOUT));

            assertEquals(ErrorKind.METHOD_NOT_FOUND, e.getKind());
        }
    }

    @Nested
    @DisplayName("against a scripted peer")
    class Scripted {

        private QueueLineTransport[] ends;

        private void open() {
            ends = QueueLineTransport.pair();
            connection = new PluginConnection("scripted", ends[0], null);
        }

        @Test
        @DisplayName("times out and discards the late reply on the next call")
        void timeoutThenStaleReply() throws Exception {
            open();

            PluginCallException timeout = assertThrows(PluginCallException.class,
                () -> connection.call("get_info", noParams(), Duration.ofMillis(100)));
            assertNull(timeout.getKind());
            assertEquals(1, mapper.readTree(ends[0].takeWritten()).get("id").asInt());

            ends[0].inject("{\"jsonrpc\":\"2.0\",\"result\":{\"name\":\"late\"},\"id\":1}");
            ends[0].inject("{\"jsonrpc\":\"2.0\",\"result\":{\"name\":\"fresh\"},\"id\":2}");

            JsonNode result = connection.call("get_info", noParams(), TIMEOUT);

            assertEquals("fresh", result.get("name").asText());
            assertEquals(2, mapper.readTree(ends[0].takeWritten()).get("id").asInt());
        }

        @Test
        @DisplayName("a null-id error answers the call in flight")
        void nullIdError() {
            open();
            ends[0].inject("{\"jsonrpc\":\"2.0\",\"error\":{\"code\":-32000,\"message\":\"Parse error\",\"data\":{\"kind\":\"PARSE_ERROR\"}},\"id\":null}");

            PluginCallException e = assertThrows(PluginCallException.class,
                () -> connection.call("get_info", noParams(), TIMEOUT));

            assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
        }

        @Test
        @DisplayName("malformed replies fail the call")
        void malformedReply() {
            open();
            ends[0].inject("this is not json");

            assertThrows(PluginCallException.class, () -> connection.call("get_info", noParams(), TIMEOUT));
        }

        @Test
        @DisplayName("end of plugin output breaks the connection")
        void pluginClosedOutput() {
            open();
            ends[1].close();

            assertThrows(PluginCallException.class, () -> connection.call("get_info", noParams(), TIMEOUT));
            assertFalse(connection.isOpen());
            PluginCallException again = assertThrows(PluginCallException.class,
                () -> connection.call("get_info", noParams(), TIMEOUT));
            assertTrue(again.getMessage().contains("connection closed"));
        }
    }
}
