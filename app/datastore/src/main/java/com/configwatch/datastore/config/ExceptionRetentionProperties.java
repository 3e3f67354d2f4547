/*
 * Where: Datastore application configuration binding
 * What: Holds exception ledger cleanup settings
 * Why: Keep the cleanup schedule tunable per environment
 */
package com.configwatch.datastore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "datastore.exceptions.retention")
public record ExceptionRetentionProperties(boolean enabled, Duration cleanupInterval) {}
