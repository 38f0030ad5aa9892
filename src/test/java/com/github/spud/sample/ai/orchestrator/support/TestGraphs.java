package com.github.spud.sample.ai.orchestrator.support;

import com.github.spud.sample.ai.orchestrator.domain.graph.AgentRouter;
import com.github.spud.sample.ai.orchestrator.domain.graph.CompiledGraph;
import com.github.spud.sample.ai.orchestrator.domain.graph.ConversationGraph;
import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.MainRouter;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.graph.PostAgentRouter;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.node.BookingNode;
import com.github.spud.sample.ai.orchestrator.domain.node.FaqNode;
import com.github.spud.sample.ai.orchestrator.domain.node.FinalizeNode;
import com.github.spud.sample.ai.orchestrator.domain.node.GeneralNode;
import com.github.spud.sample.ai.orchestrator.domain.node.GreetingNode;
import com.github.spud.sample.ai.orchestrator.domain.node.HoursNode;
import com.github.spud.sample.ai.orchestrator.domain.node.InitializeNode;
import com.github.spud.sample.ai.orchestrator.domain.node.IntentDetector;
import com.github.spud.sample.ai.orchestrator.domain.node.InvoicingNode;
import com.github.spud.sample.ai.orchestrator.domain.node.LocationNode;
import com.github.spud.sample.ai.orchestrator.domain.node.OrderingNode;
import com.github.spud.sample.ai.orchestrator.domain.node.PricingNode;
import com.github.spud.sample.ai.orchestrator.domain.node.SupervisorNode;
import com.github.spud.sample.ai.orchestrator.domain.node.UrgentCareNode;
import com.github.spud.sample.ai.orchestrator.domain.node.VerticalRouterNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 与生产环境相同拓扑的图，可替换其中部分节点
 */
public final class TestGraphs {

  private TestGraphs() {
  }

  public static List<GraphNode> productionNodes(LlmClient llm) {
    return new ArrayList<>(List.of(
      new InitializeNode(),
      new SupervisorNode(new IntentDetector()),
      new VerticalRouterNode(),
      new GreetingNode(llm),
      new PricingNode(llm),
      new LocationNode(llm),
      new HoursNode(llm),
      new FaqNode(llm),
      new BookingNode(NodeId.BOOKING_DENTAL, llm),
      new BookingNode(NodeId.BOOKING_RESTAURANT, llm),
      new BookingNode(NodeId.BOOKING_MEDICAL, llm),
      new OrderingNode(llm),
      new InvoicingNode(llm),
      new GeneralNode(llm),
      new UrgentCareNode(llm),
      TestStates.escalationNode(),
      new FinalizeNode()));
  }

  public static CompiledGraph production(LlmClient llm) {
    return withOverrides(llm, Map.of());
  }

  /**
   * 用给定节点替换同 ID 的生产节点
   */
  public static CompiledGraph withOverrides(LlmClient llm, Map<NodeId, GraphNode> overrides) {
    List<GraphNode> nodes = productionNodes(llm);
    nodes.replaceAll(node -> overrides.getOrDefault(node.id(), node));
    AgentRouter agentRouter = new AgentRouter();
    return ConversationGraph.compile(nodes, new MainRouter(), agentRouter,
      new PostAgentRouter(agentRouter));
  }
}
