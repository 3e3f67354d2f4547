/*
 * Where: Datastore service layer
 * What: Persists diagnostic records for failures, tagged with kind, account, region and item
 * Why: Recording must never fail the caller, which is usually already handling an error
 */
package com.configwatch.datastore.service;

import com.configwatch.datastore.config.ExceptionLedgerProperties;
import com.configwatch.datastore.model.AccountRecord;
import com.configwatch.datastore.model.ExceptionLogRecord;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.TechnologyRecord;
import com.configwatch.datastore.repository.AccountRepository;
import com.configwatch.datastore.repository.ExceptionLogRepository;
import com.configwatch.datastore.repository.ItemRepository;
import com.configwatch.datastore.repository.TechnologyRepository;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class ExceptionLedger {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionLedger.class);

  static final int MAX_MESSAGE_LENGTH = 512;
  static final int MAX_LOCATION_SIZE = 4;

  private final TechnologyRepository technologyRepository;
  private final AccountRepository accountRepository;
  private final ItemRepository itemRepository;
  private final ExceptionLogRepository exceptionLogRepository;
  private final ExceptionLedgerProperties properties;
  private final DatastoreMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate requiresNew;

  public ExceptionLedger(
      TechnologyRepository technologyRepository,
      AccountRepository accountRepository,
      ItemRepository itemRepository,
      ExceptionLogRepository exceptionLogRepository,
      ExceptionLedgerProperties properties,
      DatastoreMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.technologyRepository = technologyRepository;
    this.accountRepository = accountRepository;
    this.itemRepository = itemRepository;
    this.exceptionLogRepository = exceptionLogRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.requiresNew = new TransactionTemplate(transactionManager);
    // a rolled back store must not take its own failure record with it
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Records {@code error} against {@code location}, given as {@code [kind, account, region,
   * itemName]} or any prefix of it. A {@code null} ttl means now plus the configured default.
   * Never throws; a failed write is logged at ERROR and counted.
   */
  public void record(String source, List<String> location, Throwable error, Instant ttl) {
    try {
      requiresNew.executeWithoutResult(
          status -> exceptionLogRepository.insert(buildRecord(source, location, error, ttl)));
      metrics.recordException(DatastoreMetrics.RESULT_SUCCESS);
      logger.debug("exception recorded source={} location={}", source, location);
    } catch (RuntimeException ex) {
      // recording is best-effort; the caller keeps handling its original failure
      metrics.recordException(DatastoreMetrics.RESULT_FAILURE);
      logger.error(
          "exception ledger write failed source={} location={} originalType={}",
          source,
          location,
          error == null ? null : error.getClass().getSimpleName(),
          ex);
    }
  }

  /** Deletes every record whose ttl is at or before {@code now}. */
  public int purgeExpired(Instant now) {
    final int deleted = exceptionLogRepository.deleteExpired(now);
    logger.info("exception ledger purge deleted={} now={}", deleted, now);
    return deleted;
  }

  ExceptionLogRecord buildRecord(
      String source, List<String> location, Throwable error, Instant ttl) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(error, "error");
    final List<String> path = location == null ? List.of() : location;
    if (path.size() > MAX_LOCATION_SIZE) {
      throw new IllegalArgumentException("location has more than 4 elements: " + path);
    }

    final Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    final Instant expiresAt = ttl != null ? ttl : now.plus(properties.defaultTtl());

    Long technologyId = null;
    Long accountId = null;
    String region = null;
    Long itemId = null;
    if (!path.isEmpty()) {
      final TechnologyRecord technology =
          technologyRepository
              .findByName(path.get(0))
              .orElseThrow(() -> new IllegalStateException("unknown technology " + path.get(0)));
      technologyId = technology.id();
    }
    if (path.size() >= 2) {
      final AccountRecord account =
          accountRepository
              .findByName(path.get(1))
              .orElseThrow(() -> new AccountNotFoundException(path.get(1)));
      accountId = account.id();
    }
    if (path.size() >= 3) {
      region = path.get(2);
    }
    if (path.size() == MAX_LOCATION_SIZE) {
      itemId =
          itemRepository
              .findFirstByIdentityIds(technologyId, accountId, region, path.get(3))
              .map(ItemRecord::id)
              .orElse(null);
    }

    return new ExceptionLogRecord(
        null,
        source,
        now,
        expiresAt,
        error.getClass().getSimpleName(),
        truncate(String.valueOf(error.getMessage()), MAX_MESSAGE_LENGTH),
        stackTraceOf(error),
        region,
        technologyId,
        accountId,
        itemId);
  }

  private static String truncate(String value, int maxLength) {
    return value.length() <= maxLength ? value : value.substring(0, maxLength);
  }

  private static String stackTraceOf(Throwable error) {
    final StringWriter writer = new StringWriter();
    error.printStackTrace(new PrintWriter(writer));
    return writer.toString();
  }
}
