/*
 * Where: Datastore data access
 * What: Reads account rows by name
 * Why: Accounts are a hard dependency of every store and are never created here
 */
package com.configwatch.datastore.repository;

import com.configwatch.datastore.model.AccountRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class AccountRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<AccountRecord> findByName(String name) {
    final String sql =
        """
        SELECT id, name, number, active, third_party, notes, role_name
        FROM account
        WHERE name = :name
        ORDER BY id
        LIMIT 1
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("name", name);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private AccountRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AccountRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("number"),
        rs.getBoolean("active"),
        rs.getBoolean("third_party"),
        rs.getString("notes"),
        rs.getString("role_name"));
  }
}
