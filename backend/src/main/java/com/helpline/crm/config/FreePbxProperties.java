package com.helpline.crm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
@ConfigurationProperties(prefix = "app.freepbx")
public class FreePbxProperties {
  private String webhookSecret = "";

  public String getWebhookSecret() {
    return webhookSecret;
  }

  public void setWebhookSecret(String webhookSecret) {
    this.webhookSecret = webhookSecret == null ? "" : webhookSecret.trim();
  }

  public boolean hasWebhookSecret() {
    return StringUtils.hasText(webhookSecret);
  }
}
