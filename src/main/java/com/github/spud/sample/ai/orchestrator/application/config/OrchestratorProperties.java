package com.github.spud.sample.ai.orchestrator.application.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 编排引擎配置，前缀 orchestrator
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "orchestrator")
public class OrchestratorProperties {

  private Graph graph = new Graph();
  private Checkpoint checkpoint = new Checkpoint();
  private Turn turn = new Turn();

  @Getter
  @Setter
  public static class Graph {

    /**
     * 租户未配置 max_iterations 时使用
     */
    private int defaultMaxIterations = 5;

    /**
     * 步数上限 = stepCeilingFactor * max_iterations + stepCeilingOverhead
     */
    private int stepCeilingFactor = 2;
    private int stepCeilingOverhead = 5;
  }

  @Getter
  @Setter
  public static class Checkpoint {

    private boolean enabled = true;

    /**
     * checkpoint_ns，默认空字符串
     */
    private String namespace = "";

    private Duration maxAge = Duration.ofDays(7);
    private Duration cleanupInterval = Duration.ofHours(6);
    private Duration cleanupInitialDelay = Duration.ofMinutes(5);

    private StoreType store = StoreType.JDBC;

    /**
     * 异步写检查点的线程池大小
     */
    private int writerThreads = 2;
    private int writerQueueCapacity = 500;

    /**
     * 读取最新检查点前等待本线程未完成写入的上限（毫秒）
     */
    private long flushTimeoutMs = 2000;
  }

  @Getter
  @Setter
  public static class Turn {

    private String escalationResponse =
      "Gracias por tu mensaje. Un asesor de nuestro equipo te atenderá en breve.";
    private String fallbackResponse =
      "Lo siento, ocurrió un error al procesar tu mensaje. Un asesor te atenderá pronto.";
    private String rateLimitedResponse =
      "Estamos recibiendo muchos mensajes. Por favor intenta de nuevo en unos momentos.";
    private String invalidOutputResponse =
      "Gracias por tu mensaje. Un asesor te responderá en breve.";

    /**
     * 错误信息中出现这些子串即视为瞬时错误（不区分大小写）
     */
    private List<String> transientErrorMarkers = new ArrayList<>(
      List.of("timeout", "ETIMEDOUT", "ECONNRESET", "Connection reset"));
  }

  public enum StoreType {
    JDBC,
    MEMORY
  }
}
