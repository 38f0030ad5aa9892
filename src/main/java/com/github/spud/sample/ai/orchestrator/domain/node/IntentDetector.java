package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.state.BusinessContext;
import com.github.spud.sample.ai.orchestrator.domain.state.DetectedSignal;
import com.github.spud.sample.ai.orchestrator.domain.state.ExtractedData;
import com.github.spud.sample.ai.orchestrator.domain.state.Intent;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * 基于规则的意图与信号识别，按优先级顺序匹配，先命中者胜出
 */
@Component
public class IntentDetector {

  /**
   * 高价值信号的分值阈值，命中两个及以上即升级
   */
  static final int HIGH_VALUE_POINTS = 15;

  static final int ESCALATION_PAIN_LEVEL = 4;

  private static final Map<Intent, Pattern> INTENT_PATTERNS = new LinkedHashMap<>();

  static {
    INTENT_PATTERNS.put(Intent.PAIN_URGENT, Pattern.compile(
      "\\b(dolor|duele|urgen\\w*|emergen\\w*|sangr\\w*|hinchad\\w*|inflamad\\w*|roto|rota|quebr\\w*|fractur\\w*|accidente)\\b"));
    INTENT_PATTERNS.put(Intent.HUMAN_REQUEST, Pattern.compile(
      "\\b(humano|persona|asesor|gerente|encargado|supervisor|hablar con alguien|quiero hablar)\\b"));
    INTENT_PATTERNS.put(Intent.INVOICE_REQUEST, Pattern.compile(
      "\\b(factura|facturar|facturacion|cfdi|rfc|datos fiscales|comprobante fiscal)\\b"));
    INTENT_PATTERNS.put(Intent.ORDER_REQUEST, Pattern.compile(
      "\\b(pedido|ordenar|quiero pedir|para llevar|a domicilio)\\b"));
    INTENT_PATTERNS.put(Intent.BOOK_APPOINTMENT, Pattern.compile(
      "\\b(cita|agendar|reservar|reservacion|appointment|disponib\\w*|agenda|turno|cuando pueden|cuando puedo|fecha|manana|pasado|semana|lunes|martes|miercoles|jueves|viernes|sabado|domingo)\\b"));
    INTENT_PATTERNS.put(Intent.PRICE_INQUIRY, Pattern.compile(
      "\\b(precio\\w*|costo\\w*|cuesta\\w*|cuanto|valor|cotiz\\w*|tarifa\\w*|presupuesto|cobra\\w*|pagar|caro|barato|economico|financ\\w*|meses sin)\\b"));
    INTENT_PATTERNS.put(Intent.LOCATION, Pattern.compile(
      "\\b(donde|ubicacion|ubicados|direccion|llegar|mapa|sucursal\\w*|consultorio|clinica|local|estaciona\\w*|cerca)\\b"));
    INTENT_PATTERNS.put(Intent.HOURS, Pattern.compile(
      "\\b(horario\\w*|abren|cierran|atienden|hora de|que hora|hasta que hora|a que hora)\\b"));
    INTENT_PATTERNS.put(Intent.FAQ, Pattern.compile(
      "\\b(como funciona|que incluye|cuanto dura|requisitos|necesito|puedo|se puede|acepta\\w*|tienen|ofrecen|hacen|realizan)\\b"));
    INTENT_PATTERNS.put(Intent.GREETING, Pattern.compile(
      "^(hola|buenos|buenas|hi|hello|hey|saludos|que tal|buen dia)"));
  }

  private static final Pattern STRONG_PAIN =
    Pattern.compile("\\b(mucho dolor|dolor fuerte|insoportable|no aguanto)\\b");
  private static final Pattern MODERATE_PAIN =
    Pattern.compile("\\b(bastante dolor|dolor moderado)\\b");
  private static final Pattern MILD_PAIN =
    Pattern.compile("\\b(molestia|incomodidad|leve)\\b");

  private static final Pattern EMAIL = Pattern.compile("[\\w.-]+@[\\w.-]+\\.\\w+");
  private static final Pattern PHONE =
    Pattern.compile("(\\+?52)?[\\s.-]?\\d{2,3}[\\s.-]?\\d{3,4}[\\s.-]?\\d{4}\\b");

  public Intent detectIntent(String message) {
    String normalized = normalize(message);
    for (Map.Entry<Intent, Pattern> entry : INTENT_PATTERNS.entrySet()) {
      if (entry.getValue().matcher(normalized).find()) {
        return entry.getKey();
      }
    }
    return Intent.UNKNOWN;
  }

  /**
   * 按评分规则匹配关键词，每条规则最多计一次
   */
  public List<DetectedSignal> detectSignals(String message, BusinessContext business) {
    List<DetectedSignal> signals = new ArrayList<>();
    if (message == null || business == null || business.getScoringRules() == null) {
      return signals;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (BusinessContext.ScoringRule rule : business.getScoringRules()) {
      if (rule.getKeywords() == null) {
        continue;
      }
      for (String keyword : rule.getKeywords()) {
        if (keyword != null && !keyword.isBlank() && lower.contains(keyword.toLowerCase(Locale.ROOT))) {
          signals.add(new DetectedSignal(rule.getSignalName(), rule.getPoints()));
          break;
        }
      }
    }
    return signals;
  }

  public ExtractedData extract(String message) {
    ExtractedData.ExtractedDataBuilder data = ExtractedData.builder();
    if (message == null) {
      return data.build();
    }

    Matcher email = EMAIL.matcher(message);
    if (email.find()) {
      data.email(email.group());
    }
    Matcher phone = PHONE.matcher(message);
    if (phone.find()) {
      data.phone(phone.group().replaceAll("[\\s.-]", ""));
    }

    String normalized = normalize(message);
    if (Pattern.compile("\\b(hoy|ahora)\\b").matcher(normalized).find()) {
      data.preferredDate("today");
    } else if (Pattern.compile("\\bmanana\\b").matcher(normalized).find()) {
      data.preferredDate("tomorrow");
    } else if (Pattern.compile("\\b(esta semana|proxima semana)\\b").matcher(normalized).find()) {
      data.preferredDate("this_week");
    }
    if (Pattern.compile("\\b(temprano|am)\\b").matcher(normalized).find()) {
      data.preferredTime("morning");
    } else if (Pattern.compile("\\b(tarde|pm)\\b").matcher(normalized).find()) {
      data.preferredTime("afternoon");
    }

    if (STRONG_PAIN.matcher(normalized).find()) {
      data.painLevel(5).symptoms(List.of("dolor intenso"));
    } else if (MODERATE_PAIN.matcher(normalized).find()) {
      data.painLevel(3);
    } else if (MILD_PAIN.matcher(normalized).find()) {
      data.painLevel(1);
    }
    return data.build();
  }

  /**
   * 是否需要立即转人工，返回原因
   */
  public Optional<String> escalationReason(Intent intent, List<DetectedSignal> signals,
    ExtractedData extracted, String message, List<String> autoEscalateKeywords) {
    if (intent == Intent.HUMAN_REQUEST) {
      return Optional.of("Customer asked to talk to a human");
    }
    if (intent == Intent.PAIN_URGENT) {
      return Optional.of("Pain or urgency detected");
    }
    if (extracted != null && extracted.getPainLevel() != null
      && extracted.getPainLevel() >= ESCALATION_PAIN_LEVEL) {
      return Optional.of("Pain level " + extracted.getPainLevel() + " reported");
    }
    if (message != null && autoEscalateKeywords != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      for (String keyword : autoEscalateKeywords) {
        if (keyword != null && !keyword.isBlank() && lower.contains(keyword.toLowerCase(Locale.ROOT))) {
          return Optional.of("Escalation keyword: " + keyword);
        }
      }
    }
    long highValue = signals.stream().filter(s -> s.getPoints() >= HIGH_VALUE_POINTS).count();
    if (highValue >= 2) {
      return Optional.of("High-value lead detected");
    }
    return Optional.empty();
  }

  static String normalize(String message) {
    if (message == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(message.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
    return decomposed.replaceAll("\\p{M}", "").trim();
  }
}
