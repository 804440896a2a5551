package dev.apiproxy.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
@DisplayName("PluginProcess")
class PluginProcessTest {

    private static final String REPLY = "{\"jsonrpc\":\"2.0\",\"result\":{\"name\":\"$PLUGIN_NAME\",\"version\":\"0\"},\"id\":1}";

    @Test
    @DisplayName("talks to a child process over its standard streams")
    void childProcess() throws IOException {
        List<String> command = List.of("sh", "-c",
            "read line; echo \"starting\" >&2; echo '" + REPLY.replace("$PLUGIN_NAME", "'\"$PLUGIN_NAME\"'") + "'; cat > /dev/null");

        try (PluginConnection connection = PluginProcess.launch("sh", command, Map.of("PLUGIN_NAME", "shell"),
                Duration.ofSeconds(2))) {
            JsonNode result = connection.call("get_info", new ObjectMapper().createArrayNode(), Duration.ofSeconds(10));

            assertEquals("shell", result.get("name").asText());
        }
    }

    @Test
    @DisplayName("a process that exits early breaks the connection")
    void earlyExit() throws IOException {
        try (PluginConnection connection = PluginProcess.launch("exit", List.of("sh", "-c", "exit 3"), Map.of(),
                Duration.ofSeconds(2))) {
            assertThrows(PluginCallException.class,
                () -> connection.call("get_info", new ObjectMapper().createArrayNode(), Duration.ofSeconds(10)));
        }
    }

    @Test
    @DisplayName("an empty command is rejected")
    void emptyCommand() {
        assertThrows(IOException.class, () -> PluginProcess.launch("none", List.of(), Map.of(), Duration.ofSeconds(1)));
    }
}
