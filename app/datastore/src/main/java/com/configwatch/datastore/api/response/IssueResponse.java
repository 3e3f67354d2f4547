/*
 * Where: Datastore API response DTO
 * What: One audit issue with its justification state
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssueResponse(
    long issueId,
    int score,
    String issue,
    String notes,
    boolean justified,
    String justification,
    String justifiedBy,
    Instant justifiedDate) {}
