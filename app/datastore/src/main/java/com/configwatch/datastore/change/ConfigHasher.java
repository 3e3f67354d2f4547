/*
 * Where: Change detection
 * What: Computes the complete and durable content hash of a configuration
 * Why: Items store both so noise-only polls can be told apart from real changes
 */
package com.configwatch.datastore.change;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConfigHasher {

  // 128-bit digest stored as 32 hex chars in item.latest_revision_*_hash
  private static final String DIGEST_ALGORITHM = "MD5";

  private final ConfigCanonicalizer canonicalizer;
  private final EphemeralPathFilter ephemeralPathFilter;

  public ConfigHashes hash(String technology, JsonNode config) {
    return new ConfigHashes(
        completeHash(config), durableHash(config, ephemeralPathFilter.pathsFor(technology)));
  }

  public String completeHash(JsonNode config) {
    final String canonical = canonicalizer.toText(canonicalizer.canonicalize(config));
    return toHex(digest(canonical.getBytes(StandardCharsets.UTF_8)));
  }

  public String durableHash(JsonNode config, List<EphemeralPath> ephemeralPaths) {
    final JsonNode durable = config == null ? NullNode.getInstance() : config.deepCopy();
    for (EphemeralPath path : ephemeralPaths) {
      path.removeFrom(durable);
    }
    return completeHash(durable);
  }

  private byte[] digest(byte[] input) {
    try {
      return MessageDigest.getInstance(DIGEST_ALGORITHM).digest(input);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("MD5 algorithm not available", ex);
    }
  }

  private String toHex(byte[] bytes) {
    final StringBuilder builder = new StringBuilder(bytes.length * 2);
    for (byte value : bytes) {
      builder.append(String.format("%02x", value));
    }
    return builder.toString();
  }
}
