/*
 * Where: Datastore domain model
 * What: Reconciliation identity of an audit issue within one item
 */
package com.configwatch.datastore.model;

public record IssueKey(String issue, String notes) {}
