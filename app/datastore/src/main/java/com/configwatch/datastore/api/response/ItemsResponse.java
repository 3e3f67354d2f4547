/*
 * Where: Datastore API response DTO
 * What: Filtered item listing
 */
package com.configwatch.datastore.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemsResponse(List<ItemRevisionSummary> items) {
  public ItemsResponse {
    items = items == null ? List.of() : List.copyOf(items);
  }
}
