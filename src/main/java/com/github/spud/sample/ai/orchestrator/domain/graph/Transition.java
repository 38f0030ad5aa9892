package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.util.EnumSet;
import java.util.Set;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 节点的出边：固定边、条件边（路由）或结束
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Transition {

  private final NodeId fixedTarget;
  private final Router router;

  public static Transition to(NodeId target) {
    return new Transition(target, null);
  }

  public static Transition route(Router router) {
    return new Transition(null, router);
  }

  public static Transition end() {
    return new Transition(null, null);
  }

  public boolean isEnd() {
    return fixedTarget == null && router == null;
  }

  public boolean isConditional() {
    return router != null;
  }

  public Set<NodeId> possibleTargets() {
    if (fixedTarget != null) {
      return EnumSet.of(fixedTarget);
    }
    if (router != null) {
      return router.targets().isEmpty() ? EnumSet.noneOf(NodeId.class) : EnumSet.copyOf(router.targets());
    }
    return EnumSet.noneOf(NodeId.class);
  }

  @Override
  public String toString() {
    if (isEnd()) {
      return "END";
    }
    return isConditional() ? "route(" + router.name() + ")" : "-> " + fixedTarget;
  }
}
