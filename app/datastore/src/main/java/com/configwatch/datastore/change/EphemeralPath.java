/*
 * Where: Change detection
 * What: A structural path pattern naming a field that changes on every poll
 * Why: Durable hashing strips these fields so noise does not look like a change
 */
package com.configwatch.datastore.change;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Dot separated field names; a {@code [*]} suffix adds a segment matching every array index.
 * {@code accesskeys[*].LastUsedDate} removes {@code LastUsedDate} from each element of the
 * {@code accesskeys} array.
 */
public record EphemeralPath(String expression, List<String> segments) {

  static final String WILDCARD = "*";
  private static final String ARRAY_WILDCARD_SUFFIX = "[*]";

  public EphemeralPath {
    segments = List.copyOf(segments);
    if (segments.isEmpty()) {
      throw new IllegalArgumentException("ephemeral path is empty: " + expression);
    }
  }

  public static EphemeralPath parse(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("ephemeral path is required");
    }
    final List<String> segments = new ArrayList<>();
    for (String part : expression.split("\\.", -1)) {
      String field = part;
      int wildcards = 0;
      while (field.endsWith(ARRAY_WILDCARD_SUFFIX)) {
        field = field.substring(0, field.length() - ARRAY_WILDCARD_SUFFIX.length());
        wildcards++;
      }
      if (field.isEmpty()) {
        throw new IllegalArgumentException("ephemeral path has an empty segment: " + expression);
      }
      segments.add(field);
      for (int i = 0; i < wildcards; i++) {
        segments.add(WILDCARD);
      }
    }
    return new EphemeralPath(expression, segments);
  }

  /** Deletes every match in place. Missing fields and type mismatches are ignored. */
  public void removeFrom(JsonNode root) {
    remove(root, 0);
  }

  private void remove(JsonNode node, int index) {
    if (node == null) {
      return;
    }
    final String segment = segments.get(index);
    final boolean last = index == segments.size() - 1;
    if (WILDCARD.equals(segment)) {
      if (!node.isArray()) {
        return;
      }
      final ArrayNode array = (ArrayNode) node;
      if (last) {
        array.removeAll();
        return;
      }
      for (JsonNode element : array) {
        remove(element, index + 1);
      }
      return;
    }
    if (!node.isObject()) {
      return;
    }
    final ObjectNode object = (ObjectNode) node;
    if (last) {
      object.remove(segment);
      return;
    }
    remove(object.get(segment), index + 1);
  }

  @Override
  public String toString() {
    return expression;
  }
}
