/*
 * Where: Datastore data access
 * What: Reads and writes item rows joined with their technology and account names
 * Why: Items are resolved by (technology, account, region, name) without a unique constraint
 */
package com.configwatch.datastore.repository;

import com.configwatch.datastore.model.ItemFilter;
import com.configwatch.datastore.model.ItemRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ItemRepository {

  private static final String SELECT_ITEM =
      """
      SELECT i.id,
             i.tech_id,
             t.name AS technology_name,
             i.account_id,
             a.name AS account_name,
             i.region,
             i.name,
             i.arn,
             i.latest_revision_complete_hash,
             i.latest_revision_durable_hash,
             i.latest_revision_id
      FROM item i
      JOIN technology t ON t.id = i.tech_id
      JOIN account a ON a.id = i.account_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Every row matching the identity tuple; more than one means the table is corrupted. */
  public List<ItemRecord> findByIdentity(
      String technology, String account, String region, String name) {
    final String sql =
        SELECT_ITEM
            + """
            WHERE t.name = :technology
              AND a.name = :account
              AND i.region IS NOT DISTINCT FROM CAST(:region AS VARCHAR)
              AND i.name = :name
            ORDER BY i.id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("technology", technology)
            .addValue("account", account)
            .addValue("region", region)
            .addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ItemRecord> findFirstByIdentityIds(
      long technologyId, long accountId, String region, String name) {
    final String sql =
        SELECT_ITEM
            + """
            WHERE i.tech_id = :technologyId
              AND i.account_id = :accountId
              AND i.region IS NOT DISTINCT FROM CAST(:region AS VARCHAR)
              AND i.name = :name
            ORDER BY i.id
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("technologyId", technologyId)
            .addValue("accountId", accountId)
            .addValue("region", region)
            .addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ItemRecord> findFiltered(ItemFilter filter) {
    final List<String> conditions = new ArrayList<>();
    final MapSqlParameterSource params = new MapSqlParameterSource();
    addCondition(conditions, params, "t.name", "technology", filter.technology());
    addCondition(conditions, params, "a.name", "account", filter.account());
    addCondition(conditions, params, "i.region", "region", filter.region());
    addCondition(conditions, params, "i.name", "name", filter.name());
    final StringBuilder sql = new StringBuilder(SELECT_ITEM);
    if (!conditions.isEmpty()) {
      sql.append("WHERE ").append(String.join(" AND ", conditions)).append('\n');
    }
    sql.append("ORDER BY i.id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public long insert(ItemRecord item) {
    final String sql =
        """
        INSERT INTO item (
          tech_id,
          account_id,
          region,
          name,
          arn,
          latest_revision_complete_hash,
          latest_revision_durable_hash,
          latest_revision_id
        ) VALUES (
          :technologyId,
          :accountId,
          :region,
          :name,
          :arn,
          :completeHash,
          :durableHash,
          NULL
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("technologyId", item.technologyId())
            .addValue("accountId", item.accountId())
            .addValue("region", item.region())
            .addValue("name", item.name())
            .addValue("arn", item.arn())
            .addValue("completeHash", item.latestRevisionCompleteHash())
            .addValue("durableHash", item.latestRevisionDurableHash());
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("item insert returned no id");
    }
    return id;
  }

  public int updateArnAndHashes(ItemRecord item) {
    final String sql =
        """
        UPDATE item
        SET arn = :arn,
            latest_revision_complete_hash = :completeHash,
            latest_revision_durable_hash = :durableHash
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", item.id())
            .addValue("arn", item.arn())
            .addValue("completeHash", item.latestRevisionCompleteHash())
            .addValue("durableHash", item.latestRevisionDurableHash());
    return jdbcTemplate.update(sql, params);
  }

  public int updateLatestRevisionId(long itemId, long revisionId) {
    final String sql =
        """
        UPDATE item
        SET latest_revision_id = :revisionId
        WHERE id = :itemId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("itemId", itemId).addValue("revisionId", revisionId);
    return jdbcTemplate.update(sql, params);
  }

  private void addCondition(
      List<String> conditions,
      MapSqlParameterSource params,
      String column,
      String parameter,
      String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    conditions.add(column + " = :" + parameter);
    params.addValue(parameter, value);
  }

  private ItemRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ItemRecord(
        rs.getLong("id"),
        rs.getLong("tech_id"),
        rs.getString("technology_name"),
        rs.getLong("account_id"),
        rs.getString("account_name"),
        rs.getString("region"),
        rs.getString("name"),
        rs.getString("arn"),
        rs.getString("latest_revision_complete_hash"),
        rs.getString("latest_revision_durable_hash"),
        rs.getObject("latest_revision_id", Long.class));
  }
}
