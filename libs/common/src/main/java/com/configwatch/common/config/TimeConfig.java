/*
 * Where: Shared configuration
 * What: Exposes a Clock bean
 * Why: Every application injects the same time source and tests can pin it
 */
package com.configwatch.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
