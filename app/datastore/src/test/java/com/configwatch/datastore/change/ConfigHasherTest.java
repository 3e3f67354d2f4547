/*
 * Where: Change detection tests
 * What: Verifies complete and durable hashes across reorderings and ephemeral churn
 * Why: Hash stability is what separates real changes from polling noise
 */
package com.configwatch.datastore.change;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConfigHasherTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ConfigHasher hasher =
      new ConfigHasher(new ConfigCanonicalizer(objectMapper), new EphemeralPathFilter());

  @Test
  void completeHashIsLowercaseMd5Hex() throws Exception {
    // md5("{}")
    assertThat(hasher.completeHash(objectMapper.readTree("{}")))
        .isEqualTo("99914b932bd37a50b983c5e7c90ae93b");
  }

  @Test
  void keyOrderDoesNotChangeTheHash() throws Exception {
    final JsonNode first = objectMapper.readTree("{\"a\":1,\"b\":{\"c\":2,\"d\":3}}");
    final JsonNode second = objectMapper.readTree("{\"b\":{\"d\":3,\"c\":2},\"a\":1}");

    assertThat(hasher.completeHash(first)).isEqualTo(hasher.completeHash(second));
  }

  @Test
  void orderOfObjectListsDoesNotChangeTheHash() throws Exception {
    final JsonNode first = objectMapper.readTree("{\"rules\":[{\"port\":22},{\"port\":443}]}");
    final JsonNode second = objectMapper.readTree("{\"rules\":[{\"port\":443},{\"port\":22}]}");

    assertThat(hasher.completeHash(first)).isEqualTo(hasher.completeHash(second));
  }

  @Test
  void orderOfScalarListsChangesTheHash() throws Exception {
    final JsonNode first = objectMapper.readTree("{\"cidrs\":[\"10.0.0.0/8\",\"0.0.0.0/0\"]}");
    final JsonNode second = objectMapper.readTree("{\"cidrs\":[\"0.0.0.0/0\",\"10.0.0.0/8\"]}");

    assertThat(hasher.completeHash(first)).isNotEqualTo(hasher.completeHash(second));
  }

  @Test
  void ephemeralChangeKeepsDurableHashButMovesCompleteHash() throws Exception {
    final JsonNode before =
        objectMapper.readTree("{\"rules\":[{\"port\":22}],\"assigned_to\":[\"i-1\"]}");
    final JsonNode after =
        objectMapper.readTree("{\"rules\":[{\"port\":22}],\"assigned_to\":[\"i-1\",\"i-2\"]}");

    final ConfigHashes beforeHashes = hasher.hash("securitygroup", before);
    final ConfigHashes afterHashes = hasher.hash("securitygroup", after);

    assertThat(afterHashes.durable()).isEqualTo(beforeHashes.durable());
    assertThat(afterHashes.complete()).isNotEqualTo(beforeHashes.complete());
  }

  @Test
  void durableHashingDoesNotModifyTheInput() throws Exception {
    final JsonNode config = objectMapper.readTree("{\"user\":{\"password_last_used\":\"x\"}}");

    hasher.hash("iamuser", config);

    assertThat(config.get("user").has("password_last_used")).isTrue();
  }

  @Test
  void missingEphemeralPathsLeaveDurableEqualToComplete() throws Exception {
    final JsonNode config = objectMapper.readTree("{\"name\":\"web\"}");

    assertThat(hasher.durableHash(config, List.of(EphemeralPath.parse("absent.field"))))
        .isEqualTo(hasher.completeHash(config));
  }

  @Test
  void technologyWithoutPathsHasEqualHashes() throws Exception {
    final ConfigHashes hashes = hasher.hash("s3", objectMapper.readTree("{\"assigned_to\":1}"));

    assertThat(hashes.durable()).isEqualTo(hashes.complete());
  }
}
