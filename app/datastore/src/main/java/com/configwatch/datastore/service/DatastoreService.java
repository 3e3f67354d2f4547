/*
 * Where: Datastore service layer
 * What: Entry point for watchers, auditors and readers of configuration history
 * Why: Keeps identity resolution, revision writes, issue sync and retry behind one API
 */
package com.configwatch.datastore.service;

import com.configwatch.datastore.model.IssueRecord;
import com.configwatch.datastore.model.ItemFilter;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.RevisionRecord;
import com.configwatch.datastore.model.StoreRequest;
import com.configwatch.datastore.model.StoredRevision;
import com.configwatch.datastore.repository.IssueRepository;
import com.configwatch.datastore.repository.ItemRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DatastoreService {

  private static final Logger logger = LoggerFactory.getLogger(DatastoreService.class);

  static final String OPERATION_GET_ALL_FILTERED = "getAllFiltered";

  private final ItemResolver itemResolver;
  private final RevisionStore revisionStore;
  private final ItemRepository itemRepository;
  private final IssueRepository issueRepository;
  private final ExceptionLedger exceptionLedger;
  private final RetryPolicy retryPolicy;
  private final DatastoreMetrics metrics;

  /**
   * Stores one snapshot. A normal store appends a revision; an ephemeral store overwrites the
   * newest revision in place. Item hashes and audit issues are updated in both cases.
   */
  public StoredRevision store(StoreRequest request) {
    validate(request);
    final String mode =
        request.ephemeral() ? DatastoreMetrics.MODE_EPHEMERAL : DatastoreMetrics.MODE_REVISION;
    try {
      final ItemRecord item =
          itemResolver.resolve(
              request.technology(), request.account(), request.region(), request.name());
      final StoredRevision stored =
          revisionStore.store(
              item,
              request.active(),
              request.config(),
              request.arn(),
              request.newIssues(),
              request.ephemeral());
      metrics.recordStore(mode, DatastoreMetrics.RESULT_SUCCESS);
      logger.info(
          "snapshot stored technology={} account={} region={} name={} mode={} itemId={}"
              + " revisionId={} issuesAdded={} issuesRemoved={}",
          request.technology(),
          request.account(),
          request.region(),
          request.name(),
          mode,
          stored.item().id(),
          stored.revision().id(),
          stored.issues().added().size(),
          stored.issues().removed().size());
      return stored;
    } catch (RuntimeException ex) {
      metrics.recordStore(mode, DatastoreMetrics.RESULT_FAILURE);
      throw ex;
    }
  }

  /** Full history of one item, newest first. Empty when the identity was never stored. */
  public List<RevisionRecord> get(String technology, String region, String account, String name) {
    return itemResolver
        .lookup(technology, account, region, name)
        .map(revisionStore::history)
        .orElse(List.of());
  }

  public Set<IssueRecord> getAuditIssues(
      String technology, String region, String account, String name) {
    return itemResolver
        .lookup(technology, account, region, name)
        .<Set<IssueRecord>>map(item -> Set.copyOf(issueRepository.findByItemId(item.id())))
        .orElse(Set.of());
  }

  /**
   * Latest revision per item matching {@code filter}. The item listing is retried on transient
   * storage failures; the revision lookup that follows is not.
   */
  public Map<ItemRecord, RevisionRecord> getAllFiltered(ItemFilter filter) {
    final ItemFilter criteria = filter == null ? ItemFilter.all() : filter;
    final List<ItemRecord> items;
    try {
      items =
          retryPolicy.call(OPERATION_GET_ALL_FILTERED, () -> itemRepository.findFiltered(criteria));
    } catch (RetryExhaustedException ex) {
      metrics.recordRetryExhausted(ex.getOperation());
      throw ex;
    }
    return revisionStore.latestRevisions(items, criteria.includeInactive());
  }

  public void recordException(String source, List<String> location, Throwable error, Instant ttl) {
    exceptionLedger.record(source, location, error, ttl);
  }

  public int purgeExpiredExceptions(Instant now) {
    return exceptionLedger.purgeExpired(now);
  }

  private void validate(StoreRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request is required");
    }
    requireText(request.technology(), "technology");
    requireText(request.account(), "account");
    requireText(request.name(), "name");
    if (request.config() == null) {
      throw new IllegalArgumentException("config is required");
    }
  }

  private void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
  }
}
