/*
 * Where: Datastore data access
 * What: Reads, inserts and deletes item_audit rows
 * Why: Issue rows are only ever added or removed by reconciliation, never edited here
 */
package com.configwatch.datastore.repository;

import static com.configwatch.common.JdbcTimestampUtils.toInstant;

import com.configwatch.datastore.model.AuditIssue;
import com.configwatch.datastore.model.IssueRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class IssueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<IssueRecord> findByItemId(long itemId) {
    final String sql =
        """
        SELECT id, item_id, score, issue, notes, justified, justification, justified_by, justified_date
        FROM item_audit
        WHERE item_id = :itemId
        ORDER BY id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("itemId", itemId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int insert(long itemId, AuditIssue issue) {
    final String sql =
        """
        INSERT INTO item_audit (item_id, score, issue, notes, justified)
        VALUES (:itemId, :score, :issue, :notes, FALSE)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("score", issue.score())
            .addValue("issue", issue.issue())
            .addValue("notes", issue.notes());
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByIds(Collection<Long> issueIds) {
    if (issueIds.isEmpty()) {
      return 0;
    }
    final String sql = "DELETE FROM item_audit WHERE id IN (:issueIds)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("issueIds", issueIds);
    return jdbcTemplate.update(sql, params);
  }

  private IssueRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new IssueRecord(
        rs.getLong("id"),
        rs.getLong("item_id"),
        rs.getInt("score"),
        rs.getString("issue"),
        rs.getString("notes"),
        rs.getBoolean("justified"),
        rs.getString("justification"),
        rs.getString("justified_by"),
        toInstant(rs, "justified_date"));
  }
}
