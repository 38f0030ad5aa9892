package com.github.spud.sample.ai.orchestrator.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * 检查点 JSON 列的读写
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    if (json == null || json.isBlank()) {
      return objectMapper.createObjectNode();
    }
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  /**
   * 读取 JSON 对象，非对象（数组、标量）视为空对象
   */
  public static ObjectNode readObject(String json) {
    JsonNode node = readTree(json);
    return node instanceof ObjectNode ? (ObjectNode) node : objectMapper.createObjectNode();
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return Collections.emptyMap();
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return Collections.emptyList();
  }
}
