package com.github.spud.sample.ai.orchestrator.infrastructure.llm;

import com.github.spud.sample.ai.orchestrator.domain.llm.LlmClient;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmReply;
import com.github.spud.sample.ai.orchestrator.domain.llm.LlmRequest;
import com.github.spud.sample.ai.orchestrator.domain.state.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;

/**
 * 基于 Spring AI ChatClient 的 LLM 调用，超时等异常原样抛出，由图执行器分类处理
 */
@Slf4j
public class SpringAiLlmClient implements LlmClient {

  private final ChatClient chatClient;

  public SpringAiLlmClient(ChatClient chatClient) {
    this.chatClient = chatClient;
  }

  @Override
  public LlmReply complete(LlmRequest request) {
    List<Message> messages = new ArrayList<>();
    if (request.getSystemPrompt() != null) {
      messages.add(new SystemMessage(request.getSystemPrompt()));
    }
    if (request.getHistory() != null) {
      for (ChatMessage message : request.getHistory()) {
        messages.add(toMessage(message));
      }
    }
    messages.add(new UserMessage(request.getUserMessage()));

    long startTime = System.currentTimeMillis();
    ChatResponse response = chatClient.prompt(new Prompt(messages))
      .call()
      .chatResponse();

    if (response == null || response.getResult() == null) {
      log.warn("[{}] empty chat response", request.getAgentName());
      return new LlmReply(null, 0);
    }
    String text = response.getResult().getOutput().getText();
    int tokens = totalTokens(response);
    log.debug("[{}] LLM replied in {}ms, tokens={}", request.getAgentName(),
      System.currentTimeMillis() - startTime, tokens);
    return new LlmReply(text, tokens);
  }

  private static Message toMessage(ChatMessage message) {
    if (message.getRole() == ChatMessage.Role.ASSISTANT) {
      return new AssistantMessage(message.getContent());
    }
    return new UserMessage(message.getContent());
  }

  private static int totalTokens(ChatResponse response) {
    if (response.getMetadata() == null) {
      return 0;
    }
    Usage usage = response.getMetadata().getUsage();
    if (usage == null || usage.getTotalTokens() == null) {
      return 0;
    }
    return usage.getTotalTokens();
  }
}
