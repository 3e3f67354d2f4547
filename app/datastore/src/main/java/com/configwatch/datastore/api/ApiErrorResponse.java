/*
 * Where: Datastore API
 * What: Standard error body
 * Why: Readers branch on a fixed code instead of parsing messages
 */
package com.configwatch.datastore.api;

public record ApiErrorResponse(String code, String message) {}
