package com.github.spud.sample.ai.orchestrator.domain.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.orchestrator.domain.state.ControlFlags;
import com.github.spud.sample.ai.orchestrator.domain.state.ConversationState;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import org.junit.jupiter.api.Test;

/**
 * 路由函数测试
 */
class RoutersTest {

  private final MainRouter mainRouter = new MainRouter();
  private final AgentRouter agentRouter = new AgentRouter();
  private final PostAgentRouter postAgentRouter = new PostAgentRouter(agentRouter);

  private static ConversationState withControl(ControlFlags control) {
    return TestStates.state("hola").toBuilder().control(control).build();
  }

  // ===== mainRouter =====

  @Test
  void mainRouterShouldCheckEscalationBeforeFinalResponse() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder()
      .shouldEscalate(true).responseReady(true).build())
      .toBuilder().finalResponse("listo").build();

    assertEquals(NodeId.ESCALATION, mainRouter.route(state));
  }

  @Test
  void mainRouterShouldEscalateAtIterationLimit() {
    assertEquals(NodeId.ESCALATION,
      mainRouter.route(withControl(ControlFlags.initial(5).toBuilder().iterationCount(5).build())));
  }

  @Test
  void mainRouterShouldFinalizeReadyResponse() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder().responseReady(true).build())
      .toBuilder().finalResponse("listo").build();

    assertEquals(NodeId.FINALIZE, mainRouter.route(state));
  }

  @Test
  void mainRouterShouldDefaultToVerticalRouter() {
    assertEquals(NodeId.VERTICAL_ROUTER, mainRouter.route(TestStates.state("hola")));
  }

  // ===== agentRouter =====

  @Test
  void agentRouterShouldMapKnownSpecialists() {
    ConversationState state = TestStates.state("hola").toBuilder().nextAgent("booking_dental").build();
    assertEquals(NodeId.BOOKING_DENTAL, agentRouter.route(state));
  }

  @Test
  void agentRouterShouldFallBackToGeneral() {
    assertEquals(NodeId.GENERAL,
      agentRouter.route(TestStates.state("hola").toBuilder().nextAgent("booking_spa").build()));
    assertEquals(NodeId.GENERAL, agentRouter.route(TestStates.state("hola")));
    // 非专家节点名也不能作为目标
    assertEquals(NodeId.GENERAL,
      agentRouter.route(TestStates.state("hola").toBuilder().nextAgent("finalize").build()));
  }

  // ===== postAgentRouter =====

  @Test
  void postAgentRouterShouldPreferEscalation() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder()
      .shouldEscalate(true).responseReady(true).build())
      .toBuilder().finalResponse("listo").build();

    assertEquals(NodeId.ESCALATION, postAgentRouter.route(state));
  }

  @Test
  void postAgentRouterShouldFinalizeReadyResponse() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder().responseReady(true).build())
      .toBuilder().currentAgent("pricing").nextAgent("pricing").finalResponse("Cuesta 500").build();

    assertEquals(NodeId.FINALIZE, postAgentRouter.route(state));
  }

  @Test
  void postAgentRouterShouldFollowHandoffBelowLimit() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder().iterationCount(2).build())
      .toBuilder().currentAgent("pricing").nextAgent("booking_dental").build();

    assertEquals(NodeId.BOOKING_DENTAL, postAgentRouter.route(state));
  }

  @Test
  void postAgentRouterShouldEscalateHandoffAtLimit() {
    ConversationState state = withControl(ControlFlags.initial(5).toBuilder().iterationCount(5).build())
      .toBuilder().currentAgent("pricing").nextAgent("booking_dental").build();

    assertEquals(NodeId.ESCALATION, postAgentRouter.route(state));
  }

  @Test
  void postAgentRouterShouldFinalizeResponseWithoutReadyFlag() {
    ConversationState state = TestStates.state("hola").toBuilder()
      .currentAgent("general").nextAgent("general").finalResponse("respuesta").build();

    assertEquals(NodeId.FINALIZE, postAgentRouter.route(state));
  }

  @Test
  void postAgentRouterShouldNeverDeadEnd() {
    ConversationState state = TestStates.state("hola").toBuilder()
      .currentAgent("faq").nextAgent("faq").build();

    assertEquals(NodeId.GENERAL, postAgentRouter.route(state));
  }

  @Test
  void declaredTargetsShouldCoverEveryRoute() {
    assertTrue(postAgentRouter.targets().containsAll(NodeId.specialists()));
    assertTrue(postAgentRouter.targets().contains(NodeId.ESCALATION));
    assertTrue(postAgentRouter.targets().contains(NodeId.FINALIZE));
    assertTrue(mainRouter.targets().contains(NodeId.VERTICAL_ROUTER));
  }
}
