/*
 * Where: Datastore API response DTO
 * What: Revision history of one item, newest first
 * Why: Echoes the requested identity so an empty history is still attributable
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RevisionsResponse(
    String technology,
    String account,
    String region,
    String name,
    List<RevisionResponse> revisions) {
  public RevisionsResponse {
    revisions = revisions == null ? List.of() : List.copyOf(revisions);
  }
}
