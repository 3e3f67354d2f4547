/*
 * Where: Datastore service layer
 * What: The referenced account does not exist
 * Why: Accounts are administered elsewhere and are never created by a store
 */
package com.configwatch.datastore.service;

public class AccountNotFoundException extends RuntimeException {

  private final String accountName;

  public AccountNotFoundException(String accountName) {
    super("Account with name [" + accountName + "] not found.");
    this.accountName = accountName;
  }

  public String getAccountName() {
    return accountName;
  }
}
