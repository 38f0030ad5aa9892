package com.github.spud.sample.ai.orchestrator.domain.graph;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * 判断异常是否为瞬时基础设施错误（超时、连接重置），沿 cause 链逐层检查
 */
public class TransientErrorClassifier {

  private final List<String> markers;

  public TransientErrorClassifier(List<String> markers) {
    this.markers = markers.stream()
      .map(m -> m.toLowerCase(Locale.ROOT))
      .toList();
  }

  public boolean isTransient(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth++ < 16) {
      if (current instanceof TimeoutException || current instanceof SocketTimeoutException) {
        return true;
      }
      String message = current.getMessage();
      if (message != null) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
          if (lower.contains(marker)) {
            return true;
          }
        }
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
