/*
 * Where: Datastore data access
 * What: Reads and lazily creates technology rows
 * Why: A technology is created the first time a watcher stores an item of that kind
 */
package com.configwatch.datastore.repository;

import com.configwatch.datastore.model.TechnologyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TechnologyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<TechnologyRecord> findByName(String name) {
    final String sql =
        """
        SELECT id, name
        FROM technology
        WHERE name = :name
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insertIfAbsent(String name) {
    // 1 = created, 0 = another writer created it first
    final String sql =
        """
        INSERT INTO technology (name)
        VALUES (:name)
        ON CONFLICT (name) DO NOTHING
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.update(sql, params);
  }

  private TechnologyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TechnologyRecord(rs.getLong("id"), rs.getString("name"));
  }
}
