/*
 * Where: Datastore domain model
 * What: Criteria for the filtered item listing
 * Why: Null or blank criteria are ignored so callers can narrow incrementally
 */
package com.configwatch.datastore.model;

public record ItemFilter(
    String technology, String account, String region, String name, boolean includeInactive) {

  public static ItemFilter all() {
    return new ItemFilter(null, null, null, null, false);
  }
}
