package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 会话中的一条消息（human / assistant）
 */
@Value
@Builder
@Jacksonized
public class ChatMessage {

  Role role;
  String content;

  public static ChatMessage human(String content) {
    return new ChatMessage(Role.HUMAN, content);
  }

  public static ChatMessage assistant(String content) {
    return new ChatMessage(Role.ASSISTANT, content);
  }

  public enum Role {
    HUMAN,
    ASSISTANT;

    @JsonValue
    public String code() {
      return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 兼容 user / ai 等常见写法
     */
    @JsonCreator
    public static Role fromCode(String code) {
      if (code == null) {
        return null;
      }
      switch (code.trim().toLowerCase(Locale.ROOT)) {
        case "human":
        case "user":
          return HUMAN;
        case "assistant":
        case "ai":
          return ASSISTANT;
        default:
          throw new IllegalArgumentException("Unknown message role: " + code);
      }
    }
  }
}
