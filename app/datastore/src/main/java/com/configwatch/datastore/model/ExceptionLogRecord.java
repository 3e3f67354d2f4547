/*
 * Where: Datastore domain model
 * What: Diagnostic entry for a failure seen by the engine or a collaborator
 * Why: Kept until ttl so operators can trace failures back to a kind, account or item
 */
package com.configwatch.datastore.model;

import java.time.Instant;

public record ExceptionLogRecord(
    Long id,
    String source,
    Instant occurred,
    Instant ttl,
    String type,
    String message,
    String stacktrace,
    String region,
    Long technologyId,
    Long accountId,
    Long itemId) {}
