package com.github.spud.sample.ai.orchestrator.application.config;

import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointCleanupScheduler;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStateCodec;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointStore;
import com.github.spud.sample.ai.orchestrator.domain.checkpoint.CheckpointWriter;
import com.github.spud.sample.ai.orchestrator.domain.graph.AgentRouter;
import com.github.spud.sample.ai.orchestrator.domain.graph.CompiledGraph;
import com.github.spud.sample.ai.orchestrator.domain.graph.ConversationGraph;
import com.github.spud.sample.ai.orchestrator.domain.graph.GraphNode;
import com.github.spud.sample.ai.orchestrator.domain.graph.MainRouter;
import com.github.spud.sample.ai.orchestrator.domain.graph.NodeId;
import com.github.spud.sample.ai.orchestrator.domain.graph.PostAgentRouter;
import com.github.spud.sample.ai.orchestrator.domain.graph.TransientErrorClassifier;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.node.BookingNode;
import com.github.spud.sample.ai.orchestrator.domain.turn.DeadLetterSink;
import com.github.spud.sample.ai.orchestrator.domain.turn.OutputSanitizer;
import com.github.spud.sample.ai.orchestrator.domain.turn.RateLimiter;
import com.github.spud.sample.ai.orchestrator.infrastructure.collaborator.LoggingDeadLetterSink;
import com.github.spud.sample.ai.orchestrator.infrastructure.collaborator.NoopRateLimiter;
import com.github.spud.sample.ai.orchestrator.infrastructure.collaborator.PassThroughOutputSanitizer;
import com.github.spud.sample.ai.orchestrator.infrastructure.llm.SpringAiLlmClient;
import com.github.spud.sample.ai.orchestrator.infrastructure.persistence.InMemoryCheckpointStore;
import com.github.spud.sample.ai.orchestrator.infrastructure.persistence.JdbcCheckpointStore;
import java.util.List;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
@Configuration
public class OrchestratorConfig {

  @Bean
  @ConditionalOnMissingBean(LlmClient.class)
  public LlmClient llmClient(ChatClient.Builder chatClientBuilder) {
    return new SpringAiLlmClient(chatClientBuilder.build());
  }

  // ===== graph =====

  @Bean
  public BookingNode bookingDentalNode(LlmClient llmClient) {
    return new BookingNode(NodeId.BOOKING_DENTAL, llmClient);
  }

  @Bean
  public BookingNode bookingRestaurantNode(LlmClient llmClient) {
    return new BookingNode(NodeId.BOOKING_RESTAURANT, llmClient);
  }

  @Bean
  public BookingNode bookingMedicalNode(LlmClient llmClient) {
    return new BookingNode(NodeId.BOOKING_MEDICAL, llmClient);
  }

  @Bean
  public TransientErrorClassifier transientErrorClassifier(OrchestratorProperties properties) {
    return new TransientErrorClassifier(properties.getTurn().getTransientErrorMarkers());
  }

  /**
   * 编译后的图在进程内只构建一次，由所有轮次共享
   */
  @Bean
  public CompiledGraph conversationGraph(List<GraphNode> nodes, MainRouter mainRouter,
    AgentRouter agentRouter, PostAgentRouter postAgentRouter) {
    CompiledGraph graph = ConversationGraph.compile(nodes, mainRouter, agentRouter, postAgentRouter);
    log.info("Conversation graph compiled with {} nodes", graph.nodeIds().size());
    return graph;
  }

  // ===== checkpoint =====

  @Bean
  public CheckpointStore checkpointStore(OrchestratorProperties properties,
    JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
    OrchestratorProperties.Checkpoint checkpoint = properties.getCheckpoint();
    if (checkpoint.getStore() == OrchestratorProperties.StoreType.MEMORY) {
      log.info("Using in-memory checkpoint store");
      return new InMemoryCheckpointStore(checkpoint.getNamespace());
    }
    return new JdbcCheckpointStore(jdbcTemplate, transactionTemplate, checkpoint.getNamespace());
  }

  @Bean
  public ThreadPoolTaskExecutor checkpointExecutor(OrchestratorProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getCheckpoint().getWriterThreads());
    executor.setMaxPoolSize(properties.getCheckpoint().getWriterThreads());
    executor.setQueueCapacity(properties.getCheckpoint().getWriterQueueCapacity());
    executor.setThreadNamePrefix("checkpoint-");
    // 队列满时由提交线程自己写
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean
  public CheckpointWriter checkpointWriter(CheckpointStore checkpointStore,
    CheckpointStateCodec codec, @Qualifier("checkpointExecutor") ThreadPoolTaskExecutor executor,
    OrchestratorProperties properties) {
    return new CheckpointWriter(checkpointStore, codec, executor,
      properties.getCheckpoint().getNamespace());
  }

  @Bean
  public CheckpointCleanupScheduler checkpointCleanupScheduler(CheckpointStore checkpointStore,
    OrchestratorProperties properties) {
    return new CheckpointCleanupScheduler(checkpointStore, properties.getCheckpoint().getMaxAge());
  }

  // ===== 外部协作方的默认实现 =====

  @Bean
  @ConditionalOnMissingBean(RateLimiter.class)
  public RateLimiter rateLimiter() {
    return new NoopRateLimiter();
  }

  @Bean
  @ConditionalOnMissingBean(DeadLetterSink.class)
  public DeadLetterSink deadLetterSink() {
    return new LoggingDeadLetterSink();
  }

  @Bean
  @ConditionalOnMissingBean(OutputSanitizer.class)
  public OutputSanitizer outputSanitizer() {
    return new PassThroughOutputSanitizer();
  }
}
