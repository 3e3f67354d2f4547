/*
 * Where: Datastore domain model
 * What: One recorded configuration snapshot of an item
 * Why: History rows are immutable except for ephemeral overwrites of the newest one
 */
package com.configwatch.datastore.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record RevisionRecord(
    long id,
    long itemId,
    boolean active,
    JsonNode config,
    Instant dateCreated,
    Instant dateLastEphemeralChange) {}
