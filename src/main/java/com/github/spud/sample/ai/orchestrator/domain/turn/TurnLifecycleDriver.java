package com.github.spud.sample.ai.orchestrator.domain.turn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 生命周期状态机驱动器，每轮创建一个实例
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnLifecycleDriver {

  private final StateMachineFactory<TurnLifecycleState, TurnLifecycleEvent> stateMachineFactory;

  public StateMachine<TurnLifecycleState, TurnLifecycleEvent> create(String machineId) {
    StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm =
      stateMachineFactory.getStateMachine(machineId);
    sm.startReactively().block();
    return sm;
  }

  public TurnLifecycleState getCurrentState(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成，被拒绝时只记录日志
   */
  public boolean sendEvent(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm,
    TurnLifecycleEvent event) {
    StateMachineEventResult<TurnLifecycleState, TurnLifecycleEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
    if (accepted) {
      log.debug("Lifecycle event {} accepted, state: {}", event, getCurrentState(sm));
    } else {
      log.warn("Lifecycle event {} rejected in state {}", event, getCurrentState(sm));
    }
    return accepted;
  }

  public void stop(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm) {
    sm.stopReactively().block();
  }

  public boolean isInFinalState(StateMachine<TurnLifecycleState, TurnLifecycleEvent> sm) {
    return TurnLifecycleState.isFinal(getCurrentState(sm));
  }
}
