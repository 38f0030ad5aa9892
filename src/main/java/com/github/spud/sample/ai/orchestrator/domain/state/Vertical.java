package com.github.spud.sample.ai.orchestrator.domain.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 租户所属的业务垂直领域
 */
public enum Vertical {
  DENTAL,
  RESTAURANT,
  MEDICAL,
  GENERAL;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Vertical fromCode(String code) {
    if (code == null || code.isBlank()) {
      return GENERAL;
    }
    for (Vertical vertical : values()) {
      if (vertical.code().equalsIgnoreCase(code.trim())) {
        return vertical;
      }
    }
    return GENERAL;
  }
}
