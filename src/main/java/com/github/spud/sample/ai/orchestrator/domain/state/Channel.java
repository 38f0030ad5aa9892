package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Channel {
  WHATSAPP,
  INSTAGRAM,
  FACEBOOK,
  WEBCHAT,
  VOICE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Channel fromCode(String code) {
    if (code == null) {
      return WEBCHAT;
    }
    for (Channel channel : values()) {
      if (channel.code().equalsIgnoreCase(code.trim())) {
        return channel;
      }
    }
    return WEBCHAT;
  }
}
