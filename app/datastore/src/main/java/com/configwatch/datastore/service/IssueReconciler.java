/*
 * Where: Datastore service layer
 * What: Brings an item's stored audit issues in line with the issues of the latest snapshot
 * Why: Identity is (issue, notes) so justification on surviving rows is preserved
 */
package com.configwatch.datastore.service;

import com.configwatch.datastore.model.AuditIssue;
import com.configwatch.datastore.model.IssueKey;
import com.configwatch.datastore.model.IssueReconciliation;
import com.configwatch.datastore.model.IssueRecord;
import com.configwatch.datastore.repository.IssueRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class IssueReconciler {

  private final IssueRepository issueRepository;

  /**
   * Adds issues whose key is new, deletes stored issues whose key is gone and leaves the rest
   * untouched even when score or justification differ. Must run inside the caller's
   * transaction.
   */
  public IssueReconciliation reconcile(long itemId, Collection<AuditIssue> newIssues) {
    final List<AuditIssue> incoming = newIssues == null ? List.of() : List.copyOf(newIssues);
    final List<IssueRecord> current = issueRepository.findByItemId(itemId);

    final Set<IssueKey> currentKeys =
        current.stream().map(IssueRecord::key).collect(Collectors.toSet());
    final Set<IssueKey> incomingKeys =
        incoming.stream().map(AuditIssue::key).collect(Collectors.toSet());

    final List<AuditIssue> added = new ArrayList<>();
    final Set<IssueKey> addedKeys = new HashSet<>();
    for (AuditIssue issue : incoming) {
      final IssueKey key = issue.key();
      // repeated keys in one snapshot collapse into a single row
      if (!currentKeys.contains(key) && addedKeys.add(key)) {
        issueRepository.insert(itemId, issue);
        added.add(issue);
      }
    }

    final List<IssueRecord> removed =
        current.stream().filter(issue -> !incomingKeys.contains(issue.key())).toList();
    issueRepository.deleteByIds(removed.stream().map(IssueRecord::id).toList());

    return new IssueReconciliation(added, removed);
  }
}
