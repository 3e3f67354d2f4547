/*
 * Where: Datastore API response DTO
 * What: Current audit issues of one item
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IssuesResponse(
    String technology, String account, String region, String name, List<IssueResponse> issues) {
  public IssuesResponse {
    issues = issues == null ? List.of() : List.copyOf(issues);
  }
}
