/*
 * Where: Datastore API
 * What: Read-only endpoints over items, revision history and audit issues
 * Why: The reporting UI reads stored state without touching the tables directly
 */
package com.configwatch.datastore.api;

import com.configwatch.datastore.api.response.IssueResponse;
import com.configwatch.datastore.api.response.IssuesResponse;
import com.configwatch.datastore.api.response.ItemRevisionSummary;
import com.configwatch.datastore.api.response.ItemsResponse;
import com.configwatch.datastore.api.response.RevisionResponse;
import com.configwatch.datastore.api.response.RevisionsResponse;
import com.configwatch.datastore.model.IssueRecord;
import com.configwatch.datastore.model.ItemFilter;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.RevisionRecord;
import com.configwatch.datastore.service.DatastoreService;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/items")
@RequiredArgsConstructor
public class DatastoreController {

  /** Path segment standing for an item without a region. */
  static final String NO_REGION = "-";

  private final DatastoreService datastoreService;

  @GetMapping
  public ResponseEntity<ItemsResponse> listItems(
      @RequestParam(name = "technology", required = false) String technology,
      @RequestParam(name = "account", required = false) String account,
      @RequestParam(name = "region", required = false) String region,
      @RequestParam(name = "name", required = false) String name,
      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
    final Map<ItemRecord, RevisionRecord> latest =
        datastoreService.getAllFiltered(
            new ItemFilter(technology, account, region, name, includeInactive));
    final List<ItemRevisionSummary> items =
        latest.entrySet().stream()
            .map(entry -> toSummary(entry.getKey(), entry.getValue()))
            .toList();
    return ResponseEntity.ok(new ItemsResponse(items));
  }

  @GetMapping("/{technology}/{account}/{region}/{name}/revisions")
  public ResponseEntity<RevisionsResponse> getRevisions(
      @PathVariable("technology") String technology,
      @PathVariable("account") String account,
      @PathVariable("region") String region,
      @PathVariable("name") String name) {
    final String resolvedRegion = regionOf(region);
    final List<RevisionResponse> revisions =
        datastoreService.get(technology, resolvedRegion, account, name).stream()
            .map(this::toRevision)
            .toList();
    return ResponseEntity.ok(
        new RevisionsResponse(technology, account, resolvedRegion, name, revisions));
  }

  @GetMapping("/{technology}/{account}/{region}/{name}/issues")
  public ResponseEntity<IssuesResponse> getIssues(
      @PathVariable("technology") String technology,
      @PathVariable("account") String account,
      @PathVariable("region") String region,
      @PathVariable("name") String name) {
    final String resolvedRegion = regionOf(region);
    final List<IssueResponse> issues =
        datastoreService.getAuditIssues(technology, resolvedRegion, account, name).stream()
            .sorted(Comparator.comparingLong(IssueRecord::id))
            .map(this::toIssue)
            .toList();
    return ResponseEntity.ok(new IssuesResponse(technology, account, resolvedRegion, name, issues));
  }

  private String regionOf(String region) {
    return NO_REGION.equals(region) ? null : region;
  }

  private ItemRevisionSummary toSummary(ItemRecord item, RevisionRecord revision) {
    return new ItemRevisionSummary(
        item.id(),
        item.technology(),
        item.account(),
        item.region(),
        item.name(),
        item.arn(),
        item.latestRevisionCompleteHash(),
        item.latestRevisionDurableHash(),
        revision.id(),
        revision.active(),
        revision.dateCreated(),
        revision.dateLastEphemeralChange(),
        revision.config());
  }

  private RevisionResponse toRevision(RevisionRecord revision) {
    return new RevisionResponse(
        revision.id(),
        revision.active(),
        revision.dateCreated(),
        revision.dateLastEphemeralChange(),
        revision.config());
  }

  private IssueResponse toIssue(IssueRecord issue) {
    return new IssueResponse(
        issue.id(),
        issue.score(),
        issue.issue(),
        issue.notes(),
        issue.justified(),
        issue.justification(),
        issue.justifiedBy(),
        issue.justifiedDate());
  }
}
