/*
 * Where: Datastore service layer
 * What: More than one item matches a single identity tuple
 * Why: Signals duplicate rows left by the lookup-then-create race; never repaired automatically
 */
package com.configwatch.datastore.service;

public class ItemIntegrityViolationException extends RuntimeException {

  public ItemIntegrityViolationException(
      String technology, String region, String account, String name, int matches) {
    super(
        String.format(
            "Found %d items for technology: %s region: %s account: %s and name: %s",
            matches, technology, region, account, name));
  }
}
