/*
 * Where: Datastore API response DTO
 * What: One item of the filtered listing with its latest revision
 * Why: The reporting UI shows current state and change hashes side by side
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemRevisionSummary(
    long itemId,
    String technology,
    String account,
    String region,
    String name,
    String arn,
    String completeHash,
    String durableHash,
    long revisionId,
    boolean active,
    Instant dateCreated,
    Instant dateLastEphemeralChange,
    JsonNode config) {}
