/*
 * Where: Change detection
 * What: Complete and durable hash of one configuration
 */
package com.configwatch.datastore.change;

public record ConfigHashes(String complete, String durable) {}
