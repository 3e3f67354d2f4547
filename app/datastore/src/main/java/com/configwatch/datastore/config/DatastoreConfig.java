/*
 * Where: Datastore application configuration
 * What: Exposes the bound retry settings as a RetryPolicy bean
 * Why: Services depend on the policy value, not on the property binding
 */
package com.configwatch.datastore.config;

import com.configwatch.datastore.service.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DatastoreConfig {

  @Bean
  public RetryPolicy retryPolicy(DatastoreRetryProperties properties) {
    return properties.toPolicy();
  }
}
