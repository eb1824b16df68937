package com.helpline.crm.freepbx;

import com.helpline.crm.config.FreePbxProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class FreePbxStartupValidator {
  private static final Logger log = LoggerFactory.getLogger(FreePbxStartupValidator.class);
  private final FreePbxProperties properties;

  public FreePbxStartupValidator(FreePbxProperties properties) {
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void validateOnReady() {
    if (!properties.hasWebhookSecret()) {
      log.warn("FREEPBX_WEBHOOK_SECRET is not set: POST /api/freepbx/call-event accepts unauthenticated deliveries");
    }
  }
}
