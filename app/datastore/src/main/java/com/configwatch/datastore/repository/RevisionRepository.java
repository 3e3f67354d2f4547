/*
 * Where: Datastore data access
 * What: Appends, overwrites and reads item_revision rows
 * Why: Revision history is append-only apart from ephemeral overwrites of the newest row
 */
package com.configwatch.datastore.repository;

import static com.configwatch.common.JdbcTimestampUtils.toInstant;
import static com.configwatch.common.JdbcTimestampUtils.toTimestamp;

import com.configwatch.datastore.model.RevisionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RevisionRepository {

  private static final String COLUMNS =
      "id, item_id, active, config::text AS config_text, date_created, date_last_ephemeral_change";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public RevisionRecord insert(long itemId, boolean active, JsonNode config, Instant createdAt) {
    final String sql =
        """
        INSERT INTO item_revision (item_id, active, config, date_created, date_last_ephemeral_change)
        VALUES (:itemId, :active, :config::jsonb, :createdAt, NULL)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("itemId", itemId)
            .addValue("active", active)
            .addValue("config", writeConfig(config))
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<RevisionRecord> updateEphemeral(long revisionId, JsonNode config, Instant changedAt) {
    final String sql =
        """
        UPDATE item_revision
        SET config = :config::jsonb,
            date_last_ephemeral_change = :changedAt
        WHERE id = :revisionId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("revisionId", revisionId)
            .addValue("config", writeConfig(config))
            .addValue("changedAt", toTimestamp(changedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<RevisionRecord> findById(long revisionId) {
    final String sql = "SELECT " + COLUMNS + " FROM item_revision WHERE id = :revisionId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("revisionId", revisionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<RevisionRecord> findByIds(Collection<Long> revisionIds) {
    if (revisionIds.isEmpty()) {
      return List.of();
    }
    // one int8[] bind instead of one placeholder per id
    final String sql = "SELECT " + COLUMNS + " FROM item_revision WHERE id = ANY(:revisionIds)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("revisionIds", revisionIds.toArray(new Long[0]));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Newest by creation time; this is the row an ephemeral store overwrites. */
  public Optional<RevisionRecord> findLatestByItemId(long itemId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM item_revision
            WHERE item_id = :itemId
            ORDER BY date_created DESC, id DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("itemId", itemId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Streams history newest first from a cursor; the caller must close the stream. */
  public Stream<RevisionRecord> streamByItemId(long itemId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM item_revision
            WHERE item_id = :itemId
            ORDER BY date_created DESC, id DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("itemId", itemId);
    return jdbcTemplate.queryForStream(sql, params, this::mapRow);
  }

  private String writeConfig(JsonNode config) {
    try {
      return objectMapper.writeValueAsString(config);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize revision config", ex);
    }
  }

  private RevisionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RevisionRecord(
        rs.getLong("id"),
        rs.getLong("item_id"),
        rs.getBoolean("active"),
        readConfig(rs.getString("config_text")),
        toInstant(rs, "date_created"),
        toInstant(rs, "date_last_ephemeral_change"));
  }

  private JsonNode readConfig(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse revision config", ex);
    }
  }
}
