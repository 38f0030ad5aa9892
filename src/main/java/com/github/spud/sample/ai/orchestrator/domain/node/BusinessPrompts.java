package com.github.spud.sample.ai.orchestrator.domain.node;

import com.github.spud.sample.ai.orchestrator.domain.state.BusinessContext;
import java.util.List;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * 把业务数据格式化进提示词
 */
@UtilityClass
class BusinessPrompts {

  String services(BusinessContext business) {
    List<BusinessContext.Service> services = business != null ? business.getServices() : null;
    if (services == null || services.isEmpty()) {
      return "No services are configured.";
    }
    return services.stream()
      .map(s -> "- " + s.getName() + price(s)
        + (s.getDurationMinutes() != null ? " (" + s.getDurationMinutes() + " min)" : ""))
      .collect(Collectors.joining("\n"));
  }

  String branches(BusinessContext business, boolean withHours) {
    if (business == null || !business.hasBranches()) {
      return "No branches are configured.";
    }
    return business.getBranches().stream()
      .map(b -> "- " + b.getName() + ": " + nullToEmpty(b.getAddress())
        + (b.getGoogleMapsUrl() != null ? " " + b.getGoogleMapsUrl() : "")
        + (withHours && b.getOpeningHours() != null ? " | " + b.getOpeningHours() : ""))
      .collect(Collectors.joining("\n"));
  }

  String faqs(BusinessContext business) {
    if (business == null || !business.hasFaqs()) {
      return "No FAQs are configured.";
    }
    return business.getFaqs().stream()
      .map(f -> "Q: " + f.getQuestion() + "\nA: " + f.getAnswer())
      .collect(Collectors.joining("\n"));
  }

  private String price(BusinessContext.Service service) {
    if (service.getPriceMin() == null) {
      return "";
    }
    String currency = service.getCurrency() != null ? " " + service.getCurrency() : "";
    if (service.getPriceMax() == null || service.getPriceMax().equals(service.getPriceMin())) {
      return ": " + service.getPriceMin() + currency;
    }
    return ": " + service.getPriceMin() + " - " + service.getPriceMax() + currency;
  }

  private String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
