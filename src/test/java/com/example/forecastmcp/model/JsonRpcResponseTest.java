package com.example.forecastmcp.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRpcResponseTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void errorEnvelopeKeepsNullId() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(
                JsonRpcResponse.failure(null, -32700, "Parse error: x")));

        assertThat(node.has("id")).isTrue();
        assertThat(node.get("id").isNull()).isTrue();
        assertThat(node.has("result")).isFalse();
        assertThat(node.get("error").get("code").asInt()).isEqualTo(-32700);
        assertThat(node.get("error").has("data")).isFalse();
    }

    @Test
    void idTypeSurvivesSerialization() throws Exception {
        JsonNode numeric = mapper.readTree(mapper.writeValueAsString(JsonRpcResponse.success(7, Map.of())));
        JsonNode text = mapper.readTree(mapper.writeValueAsString(JsonRpcResponse.success("7", Map.of())));

        assertThat(numeric.get("id").isInt()).isTrue();
        assertThat(text.get("id").isTextual()).isTrue();
        assertThat(numeric.has("error")).isFalse();
        assertThat(numeric.get("jsonrpc").asText()).isEqualTo("2.0");
    }

    @Test
    void toolResultOmitsErrorFlagOnSuccess() throws Exception {
        assertThat(mapper.writeValueAsString(ToolResult.success("{}")))
                .isEqualTo("{\"content\":[{\"type\":\"text\",\"text\":\"{}\"}]}");
        assertThat(mapper.writeValueAsString(ToolResult.error("Tool not found: nope")))
                .isEqualTo("{\"content\":[{\"type\":\"text\",\"text\":\"Tool not found: nope\"}],\"isError\":true}");
    }
}
