package com.github.spud.sample.ai.orchestrator.domain.checkpoint;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.orchestrator.domain.state.AgentTraceEntry;
import com.github.spud.sample.ai.orchestrator.domain.state.BookingResult;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * ConversationState 与检查点 channel_values 之间的编解码。
 * <pre>
 * schema_version:
 *   1 (缺失)  早期写入，消息可能是 LangChain 结构 {type|role, content | kwargs.content}
 *   2         当前格式
 * </pre>
 * 解码时先把 v1 升级为 v2，再逐字段读取；格式不对的字段直接丢弃，使用默认值。
 * 上下文（tenant / business 等）不进入检查点，恢复时总是重新加载。
 */
@Slf4j
@Component
public class CheckpointStateCodec {

  public static final int SCHEMA_VERSION = 2;
  public static final String VERSION_FIELD = "schema_version";

  static final String MESSAGES = "messages";
  static final String CONTROL = "control";
  static final String AGENT_TRACE = "agent_trace";
  static final String ERRORS = "errors";
  static final String CURRENT_MESSAGE = "current_message";
  static final String CURRENT_AGENT = "current_agent";
  static final String NEXT_AGENT = "next_agent";
  static final String FINAL_RESPONSE = "final_response";
  static final String DETECTED_INTENT = "detected_intent";
  static final String DETECTED_SIGNALS = "detected_signals";
  static final String SCORE_CHANGE = "score_change";
  static final String EXTRACTED_DATA = "extracted_data";
  static final String BOOKING_RESULT = "booking_result";
  static final String TOKENS_USED = "tokens_used";
  static final String PROCESSING_TIME_MS = "processing_time_ms";

  private final ObjectMapper objectMapper;

  public CheckpointStateCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  // ===== encode =====

  public ObjectNode encode(ConversationState state) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put(VERSION_FIELD, SCHEMA_VERSION);
    root.set(MESSAGES, encodeMessages(state.getMessages()));
    root.set(CONTROL, encodeControl(state.getControl()));
    root.set(AGENT_TRACE, encodeTrace(state.getAgentTrace()));
    root.set(ERRORS, objectMapper.valueToTree(state.getErrors()));
    putIfPresent(root, CURRENT_MESSAGE, state.getCurrentMessage());
    putIfPresent(root, CURRENT_AGENT, state.getCurrentAgent());
    putIfPresent(root, NEXT_AGENT, state.getNextAgent());
    putIfPresent(root, FINAL_RESPONSE, state.getFinalResponse());
    if (state.getDetectedIntent() != null) {
      root.put(DETECTED_INTENT, state.getDetectedIntent().name());
    }
    root.set(DETECTED_SIGNALS, objectMapper.valueToTree(state.getDetectedSignals()));
    root.put(SCORE_CHANGE, state.getScoreChange());
    if (state.getExtractedData() != null) {
      root.set(EXTRACTED_DATA, objectMapper.valueToTree(state.getExtractedData()));
    }
    if (state.getBookingResult() != null) {
      root.set(BOOKING_RESULT, objectMapper.valueToTree(state.getBookingResult()));
    }
    root.put(TOKENS_USED, state.getTokensUsed());
    if (state.getProcessingTimeMs() != null) {
      root.put(PROCESSING_TIME_MS, state.getProcessingTimeMs());
    }
    return root;
  }

  /**
   * 把一个节点补丁拆成 通道 -> 值，用于 pending writes
   */
  public Map<String, JsonNode> encodePatch(StatePatch patch) {
    Map<String, JsonNode> channels = new LinkedHashMap<>();
    if (patch.getMessages() != null) {
      channels.put(MESSAGES, encodeMessages(patch.getMessages()));
    }
    if (patch.getAgentTrace() != null) {
      channels.put(AGENT_TRACE, encodeTrace(patch.getAgentTrace()));
    }
    if (patch.getErrors() != null) {
      channels.put(ERRORS, objectMapper.valueToTree(patch.getErrors()));
    }
    if (patch.getControl() != null) {
      channels.put(CONTROL, objectMapper.valueToTree(patch.getControl()));
    }
    putIfPresent(channels, CURRENT_AGENT, patch.getCurrentAgent());
    putIfPresent(channels, NEXT_AGENT, patch.getNextAgent());
    putIfPresent(channels, FINAL_RESPONSE, patch.getFinalResponse());
    if (patch.getDetectedIntent() != null) {
      channels.put(DETECTED_INTENT, objectMapper.getNodeFactory().textNode(patch.getDetectedIntent().name()));
    }
    if (patch.getDetectedSignals() != null) {
      channels.put(DETECTED_SIGNALS, objectMapper.valueToTree(patch.getDetectedSignals()));
    }
    if (patch.getScoreChange() != null) {
      channels.put(SCORE_CHANGE, objectMapper.getNodeFactory().numberNode(patch.getScoreChange()));
    }
    if (patch.getExtractedData() != null) {
      channels.put(EXTRACTED_DATA, objectMapper.valueToTree(patch.getExtractedData()));
    }
    if (patch.getBookingResult() != null) {
      channels.put(BOOKING_RESULT, objectMapper.valueToTree(patch.getBookingResult()));
    }
    if (patch.getTokensUsed() != null) {
      channels.put(TOKENS_USED, objectMapper.getNodeFactory().numberNode(patch.getTokensUsed()));
    }
    return channels;
  }

  private ArrayNode encodeMessages(List<ChatMessage> messages) {
    ArrayNode array = objectMapper.createArrayNode();
    for (ChatMessage message : messages) {
      ObjectNode node = array.addObject();
      node.put("role", message.getRole().name().toLowerCase(Locale.ROOT));
      node.put("content", message.getContent());
    }
    return array;
  }

  private ObjectNode encodeControl(ControlFlags control) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("iteration_count", control.getIterationCount());
    node.put("max_iterations", control.getMaxIterations());
    node.put("should_escalate", control.isShouldEscalate());
    if (control.getEscalationReason() != null) {
      node.put("escalation_reason", control.getEscalationReason());
    }
    node.put("response_ready", control.isResponseReady());
    return node;
  }

  private ArrayNode encodeTrace(List<AgentTraceEntry> trace) {
    ArrayNode array = objectMapper.createArrayNode();
    for (AgentTraceEntry entry : trace) {
      ObjectNode node = array.addObject();
      node.put("agent_name", entry.getAgentName());
      if (entry.getStartedAt() != null) {
        node.put("started_at", entry.getStartedAt().toString());
      }
      if (entry.getDurationMs() != null) {
        node.put("duration_ms", entry.getDurationMs());
      }
    }
    return array;
  }

  // ===== decode =====

  /**
   * 从 channel_values 还原状态的可持久化部分，上下文字段为空
   */
  public ConversationState decode(JsonNode channelValues) {
    ConversationState.ConversationStateBuilder builder = ConversationState.builder();
    if (channelValues == null || !channelValues.isObject()) {
      log.warn("Checkpoint channel values are not an object, ignoring");
      return builder.build();
    }
    ObjectNode values = upgrade((ObjectNode) channelValues.deepCopy());

    builder.messages(decodeMessages(values.get(MESSAGES)));
    builder.control(decodeControl(values.get(CONTROL)));
    builder.agentTrace(decodeTrace(values.get(AGENT_TRACE)));
    builder.errors(decodeStrings(values.get(ERRORS)));
    builder.currentMessage(text(values, CURRENT_MESSAGE));
    builder.currentAgent(text(values, CURRENT_AGENT));
    builder.nextAgent(text(values, NEXT_AGENT));
    builder.finalResponse(text(values, FINAL_RESPONSE));
    builder.detectedIntent(decodeIntent(values.get(DETECTED_INTENT)));
    builder.detectedSignals(decodeSignals(values.get(DETECTED_SIGNALS)));
    builder.scoreChange(intValue(values.get(SCORE_CHANGE), 0));
    builder.extractedData(treeToValue(values.get(EXTRACTED_DATA), ExtractedData.class));
    builder.bookingResult(treeToValue(values.get(BOOKING_RESULT), BookingResult.class));
    builder.tokensUsed(intValue(values.get(TOKENS_USED), 0));
    JsonNode processingTime = values.get(PROCESSING_TIME_MS);
    if (processingTime != null && processingTime.isNumber()) {
      builder.processingTimeMs(processingTime.asLong());
    }
    return builder.build();
  }

  /**
   * 升级到当前 schema。v1: 消息结构统一为 {role, content}，trace 的 timestamp 改名为 started_at
   */
  ObjectNode upgrade(ObjectNode values) {
    int version = values.path(VERSION_FIELD).asInt(1);
    if (version > SCHEMA_VERSION) {
      log.warn("Checkpoint schema_version {} is newer than supported {}, reading known fields only",
        version, SCHEMA_VERSION);
      return values;
    }
    if (version < 2) {
      JsonNode messages = values.get(MESSAGES);
      if (messages != null && messages.isArray()) {
        ArrayNode upgraded = objectMapper.createArrayNode();
        for (JsonNode message : messages) {
          ObjectNode normalized = upgradeV1Message(message);
          if (normalized != null) {
            upgraded.add(normalized);
          }
        }
        values.set(MESSAGES, upgraded);
      }
      JsonNode trace = values.get(AGENT_TRACE);
      if (trace != null && trace.isArray()) {
        for (JsonNode entry : trace) {
          if (entry.isObject() && !entry.has("started_at") && entry.has("timestamp")) {
            ((ObjectNode) entry).set("started_at", entry.get("timestamp"));
          }
        }
      }
      values.put(VERSION_FIELD, SCHEMA_VERSION);
    }
    return values;
  }

  private ObjectNode upgradeV1Message(JsonNode message) {
    if (!message.isObject()) {
      return null;
    }
    String role = firstText(message, "role", "type", "_getType");
    if (mapRole(role) == null && message.path("id").isArray() && message.path("id").size() > 0) {
      // LangChain 序列化格式: {"lc":1,"id":["langchain_core","messages","HumanMessage"],"kwargs":{...}}
      JsonNode ids = message.path("id");
      role = ids.get(ids.size() - 1).asText();
    }
    JsonNode content = message.get("content");
    if (content == null && message.path("kwargs").isObject()) {
      content = message.path("kwargs").get("content");
    }
    ChatMessage.Role mapped = mapRole(role);
    if (mapped == null || content == null || !content.isTextual()) {
      return null;
    }
    ObjectNode node = objectMapper.createObjectNode();
    node.put("role", mapped.name().toLowerCase(Locale.ROOT));
    node.put("content", content.asText());
    return node;
  }

  private static ChatMessage.Role mapRole(String role) {
    if (role == null) {
      return null;
    }
    switch (role.toLowerCase(Locale.ROOT)) {
      case "human":
      case "user":
      case "humanmessage":
        return ChatMessage.Role.HUMAN;
      case "ai":
      case "assistant":
      case "aimessage":
        return ChatMessage.Role.ASSISTANT;
      default:
        return null;
    }
  }

  private List<ChatMessage> decodeMessages(JsonNode node) {
    List<ChatMessage> messages = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return messages;
    }
    for (JsonNode message : node) {
      ChatMessage.Role role = mapRole(message.path("role").asText(null));
      JsonNode content = message.get("content");
      if (role == null || content == null || !content.isTextual()) {
        log.debug("Dropping malformed checkpoint message: {}", message);
        continue;
      }
      messages.add(ChatMessage.builder().role(role).content(content.asText()).build());
    }
    return messages;
  }

  private ControlFlags decodeControl(JsonNode node) {
    ControlFlags.ControlFlagsBuilder control = ControlFlags.builder();
    if (node == null || !node.isObject()) {
      return control.build();
    }
    JsonNode iteration = node.get("iteration_count");
    if (iteration != null && iteration.canConvertToInt() && iteration.asInt() >= 0) {
      control.iterationCount(iteration.asInt());
    }
    JsonNode max = node.get("max_iterations");
    if (max != null && max.canConvertToInt() && max.asInt() > 0) {
      control.maxIterations(max.asInt());
    }
    JsonNode escalate = node.get("should_escalate");
    if (escalate != null && escalate.isBoolean()) {
      control.shouldEscalate(escalate.asBoolean());
    }
    JsonNode reason = node.get("escalation_reason");
    if (reason != null && reason.isTextual()) {
      control.escalationReason(reason.asText());
    }
    JsonNode ready = node.get("response_ready");
    if (ready != null && ready.isBoolean()) {
      control.responseReady(ready.asBoolean());
    }
    return control.build();
  }

  private List<AgentTraceEntry> decodeTrace(JsonNode node) {
    List<AgentTraceEntry> trace = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return trace;
    }
    for (JsonNode entry : node) {
      JsonNode name = entry.get("agent_name");
      if (name == null || !name.isTextual()) {
        continue;
      }
      AgentTraceEntry.AgentTraceEntryBuilder builder = AgentTraceEntry.builder().agentName(name.asText());
      JsonNode startedAt = entry.get("started_at");
      if (startedAt != null && startedAt.isTextual()) {
        try {
          builder.startedAt(Instant.parse(startedAt.asText()));
        } catch (RuntimeException e) {
          log.debug("Dropping malformed started_at '{}'", startedAt.asText());
        }
      } else if (startedAt != null && startedAt.isNumber()) {
        builder.startedAt(Instant.ofEpochMilli(startedAt.asLong()));
      }
      JsonNode duration = entry.get("duration_ms");
      if (duration != null && duration.isNumber()) {
        builder.durationMs(duration.asLong());
      }
      trace.add(builder.build());
    }
    return trace;
  }

  private List<String> decodeStrings(JsonNode node) {
    List<String> strings = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return strings;
    }
    for (JsonNode element : node) {
      if (element.isTextual()) {
        strings.add(element.asText());
      }
    }
    return strings;
  }

  private List<DetectedSignal> decodeSignals(JsonNode node) {
    List<DetectedSignal> signals = new ArrayList<>();
    if (node == null || !node.isArray()) {
      return signals;
    }
    for (JsonNode element : node) {
      JsonNode name = element.get("signal");
      JsonNode points = element.get("points");
      if (name != null && name.isTextual() && points != null && points.canConvertToInt()) {
        signals.add(new DetectedSignal(name.asText(), points.asInt()));
      }
    }
    return signals;
  }

  private Intent decodeIntent(JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    try {
      return Intent.valueOf(node.asText().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      log.debug("Dropping unknown intent '{}'", node.asText());
      return null;
    }
  }

  private <T> T treeToValue(JsonNode node, Class<T> type) {
    if (node == null || !node.isObject()) {
      return null;
    }
    try {
      return objectMapper.treeToValue(node, type);
    } catch (Exception e) {
      log.debug("Dropping malformed {} in checkpoint: {}", type.getSimpleName(), e.getMessage());
      return null;
    }
  }

  private static String text(ObjectNode values, String field) {
    JsonNode node = values.get(field);
    return node != null && node.isTextual() ? node.asText() : null;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isTextual()) {
        return value.asText();
      }
    }
    return null;
  }

  private static int intValue(JsonNode node, int fallback) {
    return node != null && node.canConvertToInt() ? node.asInt() : fallback;
  }

  private static void putIfPresent(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private void putIfPresent(Map<String, JsonNode> channels, String field, String value) {
    if (value != null) {
      channels.put(field, objectMapper.getNodeFactory().textNode(value));
    }
  }

  /**
   * 通道名 -> 版本号，版本号为该通道在本线程被写入的次数
   */
  public Map<String, Integer> nextChannelVersions(Map<String, Integer> previous, ObjectNode values) {
    Map<String, Integer> versions = new LinkedHashMap<>();
    Iterator<String> names = values.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (VERSION_FIELD.equals(name)) {
        continue;
      }
      int prior = previous != null ? previous.getOrDefault(name, 0) : 0;
      versions.put(name, prior + 1);
    }
    return versions;
  }
}
