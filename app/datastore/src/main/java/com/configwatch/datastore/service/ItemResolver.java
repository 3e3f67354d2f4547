/*
 * Where: Datastore service layer
 * What: Maps (technology, account, region, name) to an item row or an unsaved scaffold
 * Why: Watchers never pre-register items; the first store of an identity creates it
 */
package com.configwatch.datastore.service;

import com.configwatch.datastore.model.AccountRecord;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.TechnologyRecord;
import com.configwatch.datastore.repository.AccountRepository;
import com.configwatch.datastore.repository.ItemRepository;
import com.configwatch.datastore.repository.TechnologyRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Resolves items by lookup-before-create.
 *
 * <p>There is no row lock and no unique constraint on the identity tuple. Two concurrent first
 * stores of the same identity can both see no match and both insert; the next resolve of that
 * identity then fails with {@link ItemIntegrityViolationException}. This race is accepted and
 * left to operators to clean up.
 */
@Service
@RequiredArgsConstructor
public class ItemResolver {

  private static final Logger logger = LoggerFactory.getLogger(ItemResolver.class);

  private final AccountRepository accountRepository;
  private final TechnologyRepository technologyRepository;
  private final ItemRepository itemRepository;
  private final TransactionTemplate transactionTemplate;

  /**
   * Returns the stored item, or a scaffold with a {@code null} id that the caller persists
   * together with its first revision.
   *
   * @throws AccountNotFoundException when the account does not exist
   * @throws ItemIntegrityViolationException when more than one item matches
   */
  public ItemRecord resolve(String technology, String account, String region, String name) {
    final AccountRecord accountRecord = requireAccount(account);
    return findUnique(technology, account, region, name)
        .orElseGet(
            () ->
                ItemRecord.scaffold(resolveTechnology(technology), accountRecord, region, name));
  }

  /**
   * Read-only variant of {@link #resolve}: never creates a technology and returns empty when no
   * item has been stored under the identity.
   *
   * @throws AccountNotFoundException when the account does not exist
   * @throws ItemIntegrityViolationException when more than one item matches
   */
  public Optional<ItemRecord> lookup(
      String technology, String account, String region, String name) {
    requireAccount(account);
    return findUnique(technology, account, region, name);
  }

  private AccountRecord requireAccount(String account) {
    return accountRepository
        .findByName(account)
        .orElseThrow(() -> new AccountNotFoundException(account));
  }

  private Optional<ItemRecord> findUnique(
      String technology, String account, String region, String name) {
    final List<ItemRecord> matches =
        itemRepository.findByIdentity(technology, account, region, name);
    if (matches.size() > 1) {
      throw new ItemIntegrityViolationException(
          technology, region, account, name, matches.size());
    }
    return matches.stream().findFirst();
  }

  TechnologyRecord resolveTechnology(String technology) {
    final Optional<TechnologyRecord> existing = technologyRepository.findByName(technology);
    if (existing.isPresent()) {
      return existing.get();
    }
    // committed on its own so the kind exists even if the following store fails
    final TechnologyRecord created =
        transactionTemplate.execute(
            status -> {
              final int inserted = technologyRepository.insertIfAbsent(technology);
              final TechnologyRecord record =
                  technologyRepository
                      .findByName(technology)
                      .orElseThrow(
                          () -> new IllegalStateException("technology is missing: " + technology));
              if (inserted == 1) {
                logger.info("created technology name={} id={}", record.name(), record.id());
              }
              return record;
            });
    if (created == null) {
      throw new IllegalStateException("technology resolution returned nothing: " + technology);
    }
    return created;
  }
}
