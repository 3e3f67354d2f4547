/*
 * Where: Datastore data access
 * What: Appends and purges exception_log rows
 * Why: Failures are kept for diagnosis until their ttl passes
 */
package com.configwatch.datastore.repository;

import static com.configwatch.common.JdbcTimestampUtils.toTimestamp;

import com.configwatch.datastore.model.ExceptionLogRecord;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ExceptionLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(ExceptionLogRecord record) {
    final String sql =
        """
        INSERT INTO exception_log (
          source,
          occurred,
          ttl,
          type,
          message,
          stacktrace,
          region,
          tech_id,
          account_id,
          item_id
        ) VALUES (
          :source,
          :occurred,
          :ttl,
          :type,
          :message,
          :stacktrace,
          :region,
          :technologyId,
          :accountId,
          :itemId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("source", record.source())
            .addValue("occurred", toTimestamp(record.occurred()))
            .addValue("ttl", toTimestamp(record.ttl()))
            .addValue("type", record.type())
            .addValue("message", record.message())
            .addValue("stacktrace", record.stacktrace())
            .addValue("region", record.region())
            .addValue("technologyId", record.technologyId())
            .addValue("accountId", record.accountId())
            .addValue("itemId", record.itemId());
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM exception_log
        WHERE ttl <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }
}
