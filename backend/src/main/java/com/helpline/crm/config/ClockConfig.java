package com.helpline.crm.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {
  @Bean Clock clock(@Value("${app.stats-zone:UTC}") String zone){ return Clock.system(ZoneId.of(zone)); }
}
