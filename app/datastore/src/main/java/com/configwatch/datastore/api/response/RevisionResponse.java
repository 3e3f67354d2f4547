/*
 * Where: Datastore API response DTO
 * What: One stored revision of an item
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RevisionResponse(
    long revisionId,
    boolean active,
    Instant dateCreated,
    Instant dateLastEphemeralChange,
    JsonNode config) {}
