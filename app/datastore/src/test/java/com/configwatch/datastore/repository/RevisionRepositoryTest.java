/*
 * Where: RevisionRepository integration tests
 * What: Verifies jsonb round trips, newest-first history and the ephemeral overwrite
 */
package com.configwatch.datastore.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.configwatch.datastore.AbstractPostgresContainerTest;
import com.configwatch.datastore.model.ItemRecord;
import com.configwatch.datastore.model.RevisionRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class RevisionRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME =
      Instant.parse("2026-01-17T00:00:00.123456Z").truncatedTo(ChronoUnit.MICROS);

  @Autowired private RevisionRepository revisionRepository;
  @Autowired private ItemRepository itemRepository;
  @Autowired private TechnologyRepository technologyRepository;
  @Autowired private AccountRepository accountRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private TransactionTemplate transactionTemplate;
  @Autowired private ObjectMapper objectMapper;

  private long itemId;

  @BeforeEach
  void setUp() {
    final MapSqlParameterSource none = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM exception_log", none);
    jdbcTemplate.update("DELETE FROM item", none);
    jdbcTemplate.update("DELETE FROM technology", none);
    jdbcTemplate.update("DELETE FROM account", none);
    jdbcTemplate.update("INSERT INTO account (name) VALUES ('prod')", none);
    technologyRepository.insertIfAbsent("redshift");
    itemId =
        itemRepository.insert(
            ItemRecord.scaffold(
                technologyRepository.findByName("redshift").orElseThrow(),
                accountRepository.findByName("prod").orElseThrow(),
                "us-west-2",
                "warehouse"));
  }

  @Test
  void historyIsNewestFirstAndConfigRoundTrips() throws Exception {
    final JsonNode first = objectMapper.readTree("{\"ClusterStatus\":\"available\",\"Nodes\":2}");
    final JsonNode second = objectMapper.readTree("{\"ClusterStatus\":\"resizing\",\"Nodes\":4}");
    final RevisionRecord older = revisionRepository.insert(itemId, true, first, BASE_TIME);
    final RevisionRecord newer =
        revisionRepository.insert(itemId, true, second, BASE_TIME.plusSeconds(60));

    final List<RevisionRecord> history =
        transactionTemplate.execute(
            status -> {
              try (Stream<RevisionRecord> revisions = revisionRepository.streamByItemId(itemId)) {
                return revisions.toList();
              }
            });

    assertThat(history).extracting(RevisionRecord::id).containsExactly(newer.id(), older.id());
    assertThat(history.get(1).config()).isEqualTo(first);
    assertThat(history.get(1).dateCreated()).isEqualTo(BASE_TIME);
    assertThat(revisionRepository.findLatestByItemId(itemId)).contains(newer);
  }

  @Test
  void ephemeralUpdateReplacesConfigAndStampsChangeTime() throws Exception {
    final RevisionRecord stored =
        revisionRepository.insert(itemId, true, objectMapper.readTree("{\"a\":1}"), BASE_TIME);
    final JsonNode churn = objectMapper.readTree("{\"a\":1,\"ClusterRevisionNumber\":\"7\"}");
    final Instant changedAt = BASE_TIME.plusSeconds(30);

    final RevisionRecord updated =
        revisionRepository.updateEphemeral(stored.id(), churn, changedAt).orElseThrow();

    assertThat(updated.id()).isEqualTo(stored.id());
    assertThat(updated.config()).isEqualTo(churn);
    assertThat(updated.dateCreated()).isEqualTo(BASE_TIME);
    assertThat(updated.dateLastEphemeralChange()).isEqualTo(changedAt);
    assertThat(revisionRepository.findByIds(List.of(stored.id()))).containsExactly(updated);
  }

  @Test
  void findByIdsAcceptsMoreIdsThanBindParameterLimit() throws Exception {
    final RevisionRecord stored =
        revisionRepository.insert(itemId, true, objectMapper.readTree("{\"a\":1}"), BASE_TIME);
    final List<Long> ids =
        LongStream.rangeClosed(1, 70_000)
            .map(offset -> stored.id() + offset)
            .boxed()
            .collect(Collectors.toCollection(ArrayList::new));
    ids.add(stored.id());

    assertThat(revisionRepository.findByIds(ids)).containsExactly(stored);
  }

  @Test
  void updatingMissingRevisionReturnsEmpty() throws Exception {
    assertThat(revisionRepository.updateEphemeral(-1L, objectMapper.readTree("{}"), BASE_TIME))
        .isEmpty();
  }
}
