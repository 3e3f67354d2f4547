/*
 * Where: Datastore domain model
 * What: Snapshot of an account row
 * Why: Accounts are administered elsewhere; the engine only reads them
 */
package com.configwatch.datastore.model;

public record AccountRecord(
    long id,
    String name,
    String number,
    boolean active,
    boolean thirdParty,
    String notes,
    String roleName) {}
