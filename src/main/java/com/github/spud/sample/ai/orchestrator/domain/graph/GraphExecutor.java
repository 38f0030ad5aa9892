package com.github.spud.sample.ai.orchestrator.domain.graph;

import com.github.spud.sample.ai.orchestrator.domain.state.AgentTraceEntry;
import com.github.spud.sample.ai.orchestrator.domain.state.ControlPatch;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.domain.state.StateMergeException;
import com.github.spud.sample.ai.orchestrator.domain.state.StateMerger;
import com.github.spud.sample.ai.orchestrator.domain.state.StatePatch;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 图执行器：在一个编译好的图上运行一轮对话
 * <p>
 * 关键约束：<p> - 节点严格串行执行，每个节点的补丁合并后才路由<p> - 专家节点的 iteration_count 由执行器递增，节点自身不负责<p>
 * - 节点异常降级为升级；瞬时错误与路由/契约缺陷则中止本轮<p> - 硬性步数上限独立于 max_iterations，防止路由缺陷导致死循环<p>
 * 执行器本身无状态，可被并发的轮次共享。
 */
@Slf4j
@Component
public class GraphExecutor {

  private final StateMerger stateMerger;
  private final OutcomeValidator outcomeValidator;
  private final TransientErrorClassifier transientErrorClassifier;

  @Value("${orchestrator.graph.step-ceiling-factor:2}")
  private int stepCeilingFactor;

  @Value("${orchestrator.graph.step-ceiling-overhead:5}")
  private int stepCeilingOverhead;

  @Value("${orchestrator.turn.fallback-response:Lo siento, ocurrió un error al procesar tu mensaje. Un asesor te atenderá pronto.}")
  private String fallbackResponse;

  public GraphExecutor(StateMerger stateMerger, OutcomeValidator outcomeValidator,
    TransientErrorClassifier transientErrorClassifier) {
    this.stateMerger = stateMerger;
    this.outcomeValidator = outcomeValidator;
    this.transientErrorClassifier = transientErrorClassifier;
  }

  public GraphExecution execute(CompiledGraph graph, ConversationState initialState) {
    int ceiling = stepCeiling(initialState);
    ConversationState state = initialState;
    List<NodeId> path = new ArrayList<>();
    List<NodeWrite> writes = new ArrayList<>();
    NodeId current = graph.entry();
    int step = 0;

    try {
      while (true) {
        step++;
        if (step > ceiling) {
          throw new RoutingDefectException(String.format(
            "Step ceiling %d exceeded (path: %s)", ceiling, path));
        }

        if (current.isSpecialist() && state.iterationLimitReached()) {
          log.warn("Iteration limit reached before {} ({}/{}), forcing escalation",
            current, state.getControl().getIterationCount(), state.maxIterations());
          current = NodeId.ESCALATION;
        }

        state = stateMerger.apply(state, enterPatch(state, current));

        Instant startedAt = Instant.now();
        StatePatch patch;
        boolean degraded = false;
        try {
          patch = graph.node(current).execute(state);
          if (patch == null) {
            throw new NodeContractViolationException("Node " + current + " returned no state update");
          }
          if (current.isSpecialist()) {
            outcomeValidator.validate(current, patch);
          }
        } catch (NodeContractViolationException | StateMergeException | RoutingDefectException e) {
          throw e;
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new GraphAbortedException("Interrupted while running " + current, e, state, path, writes);
        } catch (Exception e) {
          if (transientErrorClassifier.isTransient(e)) {
            throw new GraphAbortedException(
              "Transient failure in node " + current + ": " + describe(e), e, state, path, writes);
          }
          log.warn("Node {} failed, degrading to escalation: {}", current, describe(e), e);
          patch = degradedPatch(state, current, e);
          degraded = true;
        }

        writes.add(new NodeWrite(current, step, patch));
        state = stateMerger.apply(state, patch);
        state = stateMerger.apply(state, tracePatch(state, current, startedAt));
        path.add(current);

        Transition transition = graph.transition(current);
        if (transition.isEnd()) {
          log.debug("Graph reached END after {} steps, path={}", step, path);
          return new GraphExecution(state, List.copyOf(path), List.copyOf(writes), step);
        }

        NodeId next;
        if (degraded && current != NodeId.ESCALATION
          && !transition.possibleTargets().contains(NodeId.ESCALATION)) {
          next = NodeId.ESCALATION;
        } else {
          next = nextNode(graph, transition, current, state);
        }
        log.debug("Route {} -> {} ({})", current, next, transition);
        current = next;
      }
    } catch (GraphAbortedException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new GraphAbortedException(describe(e), e, state, path, writes);
    }
  }

  /**
   * 步数上限 = factor * max_iterations + overhead
   */
  public int stepCeiling(ConversationState state) {
    return stepCeilingFactor * state.maxIterations() + stepCeilingOverhead;
  }

  private NodeId nextNode(CompiledGraph graph, Transition transition, NodeId from,
    ConversationState state) {
    if (!transition.isConditional()) {
      return transition.getFixedTarget();
    }
    Router router = transition.getRouter();
    NodeId next = router.route(state);
    if (next == null || !router.targets().contains(next)) {
      throw new RoutingDefectException(String.format(
        "Router %s on %s returned undeclared target %s", router.name(), from, next));
    }
    if (!graph.contains(next)) {
      throw new RoutingDefectException(String.format(
        "Router %s on %s returned unregistered node %s", router.name(), from, next));
    }
    return next;
  }

  private StatePatch enterPatch(ConversationState state, NodeId node) {
    StatePatch.StatePatchBuilder patch = StatePatch.builder().currentAgent(node.nodeName());
    if (node.isSpecialist()) {
      patch.control(ControlPatch.builder()
        .iterationCount(state.getControl().getIterationCount() + 1)
        .build());
    }
    return patch.build();
  }

  private StatePatch tracePatch(ConversationState state, NodeId node, Instant startedAt) {
    AgentTraceEntry entry = AgentTraceEntry.builder()
      .agentName(node.nodeName())
      .startedAt(startedAt)
      .durationMs(Duration.between(startedAt, Instant.now()).toMillis())
      .build();
    return StatePatch.builder()
      .agentTrace(StateMerger.appended(state.getAgentTrace(), entry))
      .build();
  }

  private StatePatch degradedPatch(ConversationState state, NodeId node, Exception error) {
    String cause = describe(error);
    ControlPatch.ControlPatchBuilder control = ControlPatch.builder()
      .shouldEscalate(true)
      .escalationReason("node failure: " + cause);
    StatePatch.StatePatchBuilder patch = StatePatch.builder()
      .errors(StateMerger.appended(state.getErrors(), node.nodeName() + ": " + cause));

    if (node == NodeId.ESCALATION) {
      patch.finalResponse(fallbackResponse);
      control.responseReady(true);
    } else if (node == NodeId.FINALIZE) {
      control.responseReady(true);
    }
    return patch.control(control.build()).build();
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
