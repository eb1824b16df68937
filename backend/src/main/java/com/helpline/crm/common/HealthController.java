package com.helpline.crm.common;

import com.helpline.crm.domain.Entities.UserEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public liveness probe. A valid bearer token is honoured but never required; this is the only
 * route that reads an optional identity, and it must stay read-only.
 */
@RestController
public class HealthController {
  @GetMapping({"/api", "/api/"})
  Map<String, Object> root(@AuthenticationPrincipal UserEntity user) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("message", "HelplineOS CRM API");
    body.put("status", "healthy");
    if (user != null) body.put("authenticated_as", user.email);
    return body;
  }
}
