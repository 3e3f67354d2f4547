/*
 * Where: Datastore cleanup worker
 * What: Triggers exception ledger retention on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.configwatch.datastore.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "datastore.exceptions.retention.enabled", havingValue = "true")
public class ExceptionRetentionWorker {

  private final ExceptionRetentionService retentionService;

  @Scheduled(fixedDelayString = "${datastore.exceptions.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
