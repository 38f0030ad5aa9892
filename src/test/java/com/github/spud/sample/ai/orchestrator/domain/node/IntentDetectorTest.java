package com.github.spud.sample.ai.orchestrator.domain.node;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import com.github.spud.sample.ai.orchestrator.support.TestStates;
import java.util.List;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

/**
 * 规则意图识别测试
 */
class IntentDetectorTest {

  private final IntentDetector detector = new IntentDetector();

  @ParameterizedTest
  @CsvSource(delimiter = '|', value = {
    "Me duele mucho la muela|PAIN_URGENT",
    "Quiero hablar con un asesor|HUMAN_REQUEST",
    "Necesito factura de mi consumo|INVOICE_REQUEST",
    "Quiero pedir dos tacos para llevar|ORDER_REQUEST",
    "Puedo agendar una cita el lunes?|BOOK_APPOINTMENT",
    "Cuánto cuesta una limpieza?|PRICE_INQUIRY",
    "Dónde están ubicados?|LOCATION",
    "A qué hora abren?|HOURS",
    "Aceptan tarjeta de crédito?|FAQ",
    "Hola!|GREETING",
    "ok gracias|UNKNOWN"
  })
  void shouldDetectIntentInPriorityOrder(String message, Intent expected) {
    assertThat(detector.detectIntent(message)).isEqualTo(expected);
  }

  @Test
  void painShouldWinOverBooking() {
    assertThat(detector.detectIntent("Tengo dolor, quiero una cita hoy")).isEqualTo(Intent.PAIN_URGENT);
  }

  @Test
  void greetingOnlyMatchesAtStart() {
    assertThat(detector.detectIntent("y entonces hola")).isEqualTo(Intent.UNKNOWN);
  }

  @Test
  void shouldCountEachScoringRuleOnce() {
    List<DetectedSignal> signals = detector.detectSignals(
      "Cual es el precio y costo del implante?", TestStates.business());

    assertThat(signals).extracting(DetectedSignal::getSignal)
      .containsExactly("implant_interest", "price_interest");
    assertThat(signals).extracting(DetectedSignal::getPoints).containsExactly(20, 5);
  }

  @Test
  void shouldExtractContactAndScheduling() {
    ExtractedData data = detector.extract(
      "Soy ana@example.com, mi cel 81 1234 5678, mañana por la tarde");

    assertThat(data.getEmail()).isEqualTo("ana@example.com");
    assertThat(data.getPhone()).isEqualTo("8112345678");
    assertThat(data.getPreferredDate()).isEqualTo("tomorrow");
    assertThat(data.getPreferredTime()).isEqualTo("afternoon");
    assertThat(data.getPainLevel()).isNull();
  }

  @Test
  void shouldGradePainLevel() {
    assertThat(detector.extract("tengo un dolor fuerte").getPainLevel()).isEqualTo(5);
    assertThat(detector.extract("tengo bastante dolor").getPainLevel()).isEqualTo(3);
    assertThat(detector.extract("una molestia leve").getPainLevel()).isEqualTo(1);
  }

  @Test
  void shouldExplainEscalation() {
    List<DetectedSignal> none = List.of();
    ExtractedData empty = ExtractedData.builder().build();

    assertThat(detector.escalationReason(Intent.HUMAN_REQUEST, none, empty, "x", List.of()))
      .contains("Customer asked to talk to a human");
    assertThat(detector.escalationReason(Intent.PAIN_URGENT, none, empty, "x", List.of()))
      .contains("Pain or urgency detected");
    assertThat(detector.escalationReason(Intent.UNKNOWN, none,
      ExtractedData.builder().painLevel(4).build(), "x", List.of()))
      .contains("Pain level 4 reported");
    assertThat(detector.escalationReason(Intent.FAQ, none, empty, "Llamaré a mi ABOGADO", List.of("abogado")))
      .contains("Escalation keyword: abogado");
    assertThat(detector.escalationReason(Intent.PRICE_INQUIRY,
      List.of(new DetectedSignal("a", 15), new DetectedSignal("b", 20)), empty, "x", List.of()))
      .contains("High-value lead detected");
    assertThat(detector.escalationReason(Intent.PRICE_INQUIRY,
      List.of(new DetectedSignal("a", 15), new DetectedSignal("b", 5)), empty, "x", List.of()))
      .isEmpty();
  }

  @Test
  void normalizeShouldStripAccents() {
    assertThat(IntentDetector.normalize("  Mañana Dónde ")).isEqualTo("manana donde");
  }
}
