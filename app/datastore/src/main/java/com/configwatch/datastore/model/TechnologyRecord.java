/*
 * Where: Datastore domain model
 * What: A resource kind such as securitygroup or iamuser
 */
package com.configwatch.datastore.model;

public record TechnologyRecord(long id, String name) {}
