package com.github.spud.sample.ai.orchestrator.domain.turn;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * 轮次生命周期状态机配置
 * <pre>
 * 状态流转:
 *   RECEIVED --(START)--> LOADING
 *   LOADING --(CONTEXT_READY)--> RUNNING
 *   LOADING --(REPLAY)--> REPLAYED
 *   RUNNING --(GRAPH_DONE)--> PERSISTING
 *   PERSISTING --(PERSISTED)--> COMPLETED
 *   RUNNING --(TRANSIENT_FAILURE)--> RECOVERING
 *   RECOVERING --(RECOVERED)--> RECOVERED
 *   RECOVERING | LOADING | RUNNING | PERSISTING --(FAIL)--> FAILED
 *   RECEIVED | LOADING | RUNNING --(REJECT)--> REJECTED
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class TurnLifecycleConfig
  extends EnumStateMachineConfigurerAdapter<TurnLifecycleState, TurnLifecycleEvent> {

  @Override
  public void configure(
    StateMachineConfigurationConfigurer<TurnLifecycleState, TurnLifecycleEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<TurnLifecycleState, TurnLifecycleEvent> states)
    throws Exception {
    configureStates(states);
  }

  @Override
  public void configure(
    StateMachineTransitionConfigurer<TurnLifecycleState, TurnLifecycleEvent> transitions)
    throws Exception {
    configureTransitions(transitions);
  }

  /**
   * 不依赖 Spring 容器直接构建一个状态机实例，测试使用
   */
  public static StateMachine<TurnLifecycleState, TurnLifecycleEvent> buildMachine()
    throws Exception {
    StateMachineBuilder.Builder<TurnLifecycleState, TurnLifecycleEvent> builder =
      StateMachineBuilder.builder();
    builder.configureConfiguration()
      .withConfiguration()
      .autoStartup(false);
    configureStates(builder.configureStates());
    configureTransitions(builder.configureTransitions());
    return builder.build();
  }

  static void configureStates(
    StateMachineStateConfigurer<TurnLifecycleState, TurnLifecycleEvent> states) throws Exception {
    states
      .withStates()
      .initial(TurnLifecycleState.RECEIVED)
      .states(EnumSet.allOf(TurnLifecycleState.class))
      .end(TurnLifecycleState.COMPLETED)
      .end(TurnLifecycleState.REPLAYED)
      .end(TurnLifecycleState.RECOVERED)
      .end(TurnLifecycleState.FAILED)
      .end(TurnLifecycleState.REJECTED);
  }

  static void configureTransitions(
    StateMachineTransitionConfigurer<TurnLifecycleState, TurnLifecycleEvent> transitions)
    throws Exception {
    transitions
      // 正常路径
      .withExternal()
      .source(TurnLifecycleState.RECEIVED).target(TurnLifecycleState.LOADING)
      .event(TurnLifecycleEvent.START)
      .and()
      .withExternal()
      .source(TurnLifecycleState.LOADING).target(TurnLifecycleState.RUNNING)
      .event(TurnLifecycleEvent.CONTEXT_READY)
      .and()
      .withExternal()
      .source(TurnLifecycleState.RUNNING).target(TurnLifecycleState.PERSISTING)
      .event(TurnLifecycleEvent.GRAPH_DONE)
      .and()
      .withExternal()
      .source(TurnLifecycleState.PERSISTING).target(TurnLifecycleState.COMPLETED)
      .event(TurnLifecycleEvent.PERSISTED)
      .and()

      // 检查点重放
      .withExternal()
      .source(TurnLifecycleState.LOADING).target(TurnLifecycleState.REPLAYED)
      .event(TurnLifecycleEvent.REPLAY)
      .and()

      // 瞬时错误恢复
      .withExternal()
      .source(TurnLifecycleState.RUNNING).target(TurnLifecycleState.RECOVERING)
      .event(TurnLifecycleEvent.TRANSIENT_FAILURE)
      .and()
      .withExternal()
      .source(TurnLifecycleState.RECOVERING).target(TurnLifecycleState.RECOVERED)
      .event(TurnLifecycleEvent.RECOVERED)
      .and()

      // 限流
      .withExternal()
      .source(TurnLifecycleState.RECEIVED).target(TurnLifecycleState.REJECTED)
      .event(TurnLifecycleEvent.REJECT)
      .and()
      .withExternal()
      .source(TurnLifecycleState.LOADING).target(TurnLifecycleState.REJECTED)
      .event(TurnLifecycleEvent.REJECT)
      .and()
      .withExternal()
      .source(TurnLifecycleState.RUNNING).target(TurnLifecycleState.REJECTED)
      .event(TurnLifecycleEvent.REJECT)
      .and()

      // 错误处理
      .withExternal()
      .source(TurnLifecycleState.LOADING).target(TurnLifecycleState.FAILED)
      .event(TurnLifecycleEvent.FAIL)
      .and()
      .withExternal()
      .source(TurnLifecycleState.RUNNING).target(TurnLifecycleState.FAILED)
      .event(TurnLifecycleEvent.FAIL)
      .and()
      .withExternal()
      .source(TurnLifecycleState.PERSISTING).target(TurnLifecycleState.FAILED)
      .event(TurnLifecycleEvent.FAIL)
      .and()
      .withExternal()
      .source(TurnLifecycleState.RECOVERING).target(TurnLifecycleState.FAILED)
      .event(TurnLifecycleEvent.FAIL);
  }
}
