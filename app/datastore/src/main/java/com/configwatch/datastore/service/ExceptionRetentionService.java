/*
 * Where: Datastore service layer
 * What: Purges exception ledger records whose ttl has passed
 * Why: The ledger is diagnostic only and must not grow without bound
 */
package com.configwatch.datastore.service;

import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExceptionRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionRetentionService.class);

  private final ExceptionLedger exceptionLedger;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final int deleted = exceptionLedger.purgeExpired(now);
    if (deleted > 0) {
      logger.info("exception retention cleanup deleted={} now={}", deleted, now);
    }
    return deleted;
  }
}
