/*
 * Where: Datastore domain model
 * What: One tracked cloud resource identified by (technology, account, region, name)
 * Why: Carries the hashes and latest pointer that drive change detection
 */
package com.configwatch.datastore.model;

/**
 * An item row, or an unsaved scaffold when {@code id} is {@code null}.
 *
 * <p>{@code latestRevisionId} may lag the newest revision by one while a store is between its
 * two commits.
 */
public record ItemRecord(
    Long id,
    long technologyId,
    String technology,
    long accountId,
    String account,
    String region,
    String name,
    String arn,
    String latestRevisionCompleteHash,
    String latestRevisionDurableHash,
    Long latestRevisionId) {

  public static ItemRecord scaffold(
      TechnologyRecord technology, AccountRecord account, String region, String name) {
    return new ItemRecord(
        null,
        technology.id(),
        technology.name(),
        account.id(),
        account.name(),
        region,
        name,
        null,
        null,
        null,
        null);
  }

  public boolean persisted() {
    return id != null;
  }

  public ItemRecord withId(long newId) {
    return new ItemRecord(
        newId,
        technologyId,
        technology,
        accountId,
        account,
        region,
        name,
        arn,
        latestRevisionCompleteHash,
        latestRevisionDurableHash,
        latestRevisionId);
  }

  public ItemRecord withArn(String newArn) {
    return new ItemRecord(
        id,
        technologyId,
        technology,
        accountId,
        account,
        region,
        name,
        newArn,
        latestRevisionCompleteHash,
        latestRevisionDurableHash,
        latestRevisionId);
  }

  public ItemRecord withHashes(String completeHash, String durableHash) {
    return new ItemRecord(
        id,
        technologyId,
        technology,
        accountId,
        account,
        region,
        name,
        arn,
        completeHash,
        durableHash,
        latestRevisionId);
  }

  public ItemRecord withLatestRevisionId(long revisionId) {
    return new ItemRecord(
        id,
        technologyId,
        technology,
        accountId,
        account,
        region,
        name,
        arn,
        latestRevisionCompleteHash,
        latestRevisionDurableHash,
        revisionId);
  }
}
