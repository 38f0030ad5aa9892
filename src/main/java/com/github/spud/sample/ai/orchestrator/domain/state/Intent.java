package com.github.spud.sample.ai.orchestrator.domain.state;

/**
 * Supervisor 识别出的用户意图
 */
public enum Intent {
  GREETING,
  PRICE_INQUIRY,
  BOOK_APPOINTMENT,
  ORDER_REQUEST,
  PAIN_URGENT,
  HUMAN_REQUEST,
  LOCATION,
  HOURS,
  FAQ,
  INVOICE_REQUEST,
  UNKNOWN,
  /**
   * Only reported on turn results rejected by the rate limiter, never detected.
   */
  RATE_LIMITED
}
