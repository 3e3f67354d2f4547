/*
 * Where: Datastore service layer
 * What: A retried read kept failing until the attempt ceiling
 * Why: Callers get a typed failure carrying the last storage error as the cause
 */
package com.configwatch.datastore.service;

public class RetryExhaustedException extends RuntimeException {

  private final String operation;
  private final int attempts;

  public RetryExhaustedException(String operation, int attempts, Throwable cause) {
    super("Too many retries for " + operation + " after " + attempts + " attempts", cause);
    this.operation = operation;
    this.attempts = attempts;
  }

  public String getOperation() {
    return operation;
  }

  public int getAttempts() {
    return attempts;
  }
}
