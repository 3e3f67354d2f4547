/*
 * Where: Change detection tests
 * What: Verifies key ordering and list-of-object ordering of canonical configurations
 * Why: Any drift here turns equal configurations into phantom changes
 */
package com.configwatch.datastore.change;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ConfigCanonicalizerTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final ConfigCanonicalizer canonicalizer = new ConfigCanonicalizer(objectMapper);

  @Test
  void sortsObjectKeysAtEveryDepth() throws Exception {
    final JsonNode config = objectMapper.readTree("{\"b\":1,\"a\":{\"z\":true,\"y\":null}}");

    final String text = canonicalizer.toText(canonicalizer.canonicalize(config));

    assertThat(text).isEqualTo("{\"a\":{\"y\":null,\"z\":true},\"b\":1}");
  }

  @Test
  void sortsListsOfObjectsButKeepsScalarListOrder() throws Exception {
    final JsonNode config =
        objectMapper.readTree(
            "{\"rules\":[{\"port\":443},{\"port\":22}],\"tags\":[\"web\",\"api\"]}");

    final String text = canonicalizer.toText(canonicalizer.canonicalize(config));

    assertThat(text)
        .isEqualTo("{\"rules\":[{\"port\":22},{\"port\":443}],\"tags\":[\"web\",\"api\"]}");
  }

  @Test
  void keepsMixedListsInOrder() throws Exception {
    final JsonNode config = objectMapper.readTree("[{\"b\":1},\"x\",{\"a\":1}]");

    final String text = canonicalizer.toText(canonicalizer.canonicalize(config));

    assertThat(text).isEqualTo("[{\"b\":1},\"x\",{\"a\":1}]");
  }

  @Test
  void leavesInputUntouched() throws Exception {
    final JsonNode config = objectMapper.readTree("{\"b\":[{\"y\":1},{\"x\":1}],\"a\":2}");
    final String before = config.toString();

    canonicalizer.canonicalize(config);

    assertThat(config.toString()).isEqualTo(before);
  }

  @Test
  void treatsMissingConfigurationAsJsonNull() {
    assertThat(canonicalizer.toText(canonicalizer.canonicalize(null))).isEqualTo("null");
  }
}
