package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 图中节点的封闭目录
 */
public enum NodeId {
  INITIALIZE("initialize", Kind.CONTROL),
  SUPERVISOR("supervisor", Kind.CONTROL),
  VERTICAL_ROUTER("vertical_router", Kind.CONTROL),

  GREETING("greeting", Kind.SPECIALIST),
  PRICING("pricing", Kind.SPECIALIST),
  LOCATION("location", Kind.SPECIALIST),
  HOURS("hours", Kind.SPECIALIST),
  FAQ("faq", Kind.SPECIALIST),
  BOOKING_DENTAL("booking_dental", Kind.SPECIALIST),
  BOOKING_RESTAURANT("booking_restaurant", Kind.SPECIALIST),
  BOOKING_MEDICAL("booking_medical", Kind.SPECIALIST),
  ORDERING_RESTAURANT("ordering_restaurant", Kind.SPECIALIST),
  INVOICING_RESTAURANT("invoicing_restaurant", Kind.SPECIALIST),
  GENERAL("general", Kind.SPECIALIST),
  URGENT_CARE("urgent_care", Kind.SPECIALIST),

  ESCALATION("escalation", Kind.CONTROL),
  FINALIZE("finalize", Kind.TERMINAL);

  private static final Map<String, NodeId> BY_NAME = Arrays.stream(values())
    .collect(Collectors.toUnmodifiableMap(NodeId::nodeName, Function.identity()));

  private final String nodeName;
  private final Kind kind;

  NodeId(String nodeName, Kind kind) {
    this.nodeName = nodeName;
    this.kind = kind;
  }

  public String nodeName() {
    return nodeName;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isSpecialist() {
    return kind == Kind.SPECIALIST;
  }

  public static Optional<NodeId> fromName(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(BY_NAME.get(name));
  }

  public static Set<NodeId> specialists() {
    return Arrays.stream(values())
      .filter(NodeId::isSpecialist)
      .collect(Collectors.toCollection(() -> EnumSet.noneOf(NodeId.class)));
  }

  @Override
  public String toString() {
    return nodeName;
  }

  public enum Kind {
    CONTROL,
    SPECIALIST,
    TERMINAL
  }
}
