/*
 * Where: Datastore service layer
 * What: Writes revisions, item hashes and issues, then moves the latest pointer
 * Why: Owns the append-only history and the ephemeral overwrite of its newest row
 */
package com.configwatch.datastore.service;

import com.configwatch.datastore.change.ConfigHasher;
import com.configwatch.datastore.change.ConfigHashes;
import com.configwatch.datastore.model.AuditIssue;
import com.configwatch.datastore.model.IssueReconciliation;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.RevisionRecord;
import com.configwatch.datastore.model.StoredRevision;
import com.configwatch.datastore.repository.ItemRepository;
import com.configwatch.datastore.repository.RevisionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * A store runs as two commits. The first writes the item, the revision and the issues; the
 * second points {@code item.latest_revision_id} at the revision just written, whose id only
 * exists after the first insert. Between the two commits a reader can see a pointer that lags
 * by one revision, or no pointer at all for a brand new item; readers treat that as no data yet.
 */
@Service
@RequiredArgsConstructor
public class RevisionStore {

  private static final Logger logger = LoggerFactory.getLogger(RevisionStore.class);

  private final ItemRepository itemRepository;
  private final RevisionRepository revisionRepository;
  private final IssueReconciler issueReconciler;
  private final ConfigHasher configHasher;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public StoredRevision store(
      ItemRecord item,
      boolean active,
      JsonNode config,
      String arn,
      Collection<AuditIssue> newIssues,
      boolean ephemeral) {
    if (ephemeral && !item.persisted()) {
      throw new IllegalStateException(
          "ephemeral change requires an existing revision for item name=" + item.name());
    }
    // PostgreSQL keeps microseconds; truncate so returned records match what is stored
    final Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    final ConfigHashes hashes = configHasher.hash(item.technology(), config);
    final ItemRecord prepared =
        (hasText(arn) ? item.withArn(arn) : item).withHashes(hashes.complete(), hashes.durable());

    final StoredRevision written =
        transactionTemplate.execute(
            status -> write(prepared, active, config, newIssues, ephemeral, now));
    if (written == null) {
      throw new IllegalStateException("revision write returned nothing for item " + item.name());
    }

    final long itemId = written.item().id();
    final long revisionId = written.revision().id();
    transactionTemplate.executeWithoutResult(
        status -> itemRepository.updateLatestRevisionId(itemId, revisionId));
    logger.debug(
        "stored revision itemId={} revisionId={} ephemeral={} durableHash={}",
        itemId,
        revisionId,
        ephemeral,
        hashes.durable());
    return new StoredRevision(
        written.item().withLatestRevisionId(revisionId),
        written.revision(),
        written.newRevision(),
        written.issues());
  }

  /** History newest first, read lazily; the caller must close the stream. */
  public Stream<RevisionRecord> streamHistory(ItemRecord item) {
    if (!item.persisted()) {
      return Stream.empty();
    }
    return revisionRepository.streamByItemId(item.id());
  }

  public List<RevisionRecord> history(ItemRecord item) {
    try (Stream<RevisionRecord> revisions = streamHistory(item)) {
      return revisions.toList();
    }
  }

  /**
   * Pairs each item with the revision its latest pointer names. Items without a pointer, or
   * whose pointer does not resolve yet, are skipped. Inactive revisions are skipped unless
   * {@code includeInactive} is set.
   */
  public Map<ItemRecord, RevisionRecord> latestRevisions(
      Collection<ItemRecord> items, boolean includeInactive) {
    final List<Long> revisionIds =
        items.stream().map(ItemRecord::latestRevisionId).filter(Objects::nonNull).toList();
    final Map<Long, RevisionRecord> revisionsById =
        revisionRepository.findByIds(revisionIds).stream()
            .collect(Collectors.toMap(RevisionRecord::id, Function.identity()));

    final Map<ItemRecord, RevisionRecord> latest = new LinkedHashMap<>();
    for (ItemRecord item : items) {
      if (item.latestRevisionId() == null) {
        logger.debug("there are no revisions for this item itemId={}", item.id());
        continue;
      }
      final RevisionRecord revision = revisionsById.get(item.latestRevisionId());
      if (revision == null) {
        logger.debug(
            "latest revision not readable yet itemId={} revisionId={}",
            item.id(),
            item.latestRevisionId());
        continue;
      }
      if (!revision.active() && !includeInactive) {
        continue;
      }
      latest.put(item, revision);
    }
    return latest;
  }

  private StoredRevision write(
      ItemRecord prepared,
      boolean active,
      JsonNode config,
      Collection<AuditIssue> newIssues,
      boolean ephemeral,
      Instant now) {
    final ItemRecord saved = persistItem(prepared);
    final RevisionRecord revision =
        ephemeral
            ? overwriteLatest(saved.id(), config, now)
            : revisionRepository.insert(saved.id(), active, config, now);
    final IssueReconciliation issues = issueReconciler.reconcile(saved.id(), newIssues);
    return new StoredRevision(saved, revision, !ephemeral, issues);
  }

  private ItemRecord persistItem(ItemRecord item) {
    if (item.persisted()) {
      itemRepository.updateArnAndHashes(item);
      return item;
    }
    return item.withId(itemRepository.insert(item));
  }

  private RevisionRecord overwriteLatest(long itemId, JsonNode config, Instant now) {
    final RevisionRecord latest =
        revisionRepository
            .findLatestByItemId(itemId)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "ephemeral change requires an existing revision for itemId=" + itemId));
    return revisionRepository
        .updateEphemeral(latest.id(), config, now)
        .orElseThrow(
            () -> new IllegalStateException("revision vanished during update id=" + latest.id()));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
