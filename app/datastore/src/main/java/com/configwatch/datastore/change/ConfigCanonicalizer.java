/*
 * Where: Change detection
 * What: Rewrites a configuration tree into a deterministic form
 * Why: Semantically equal configurations must serialize to identical text before hashing
 */
package com.configwatch.datastore.change;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Produces a canonical copy of a configuration tree.
 *
 * <ul>
 *   <li>object fields are re-inserted in ascending key order;
 *   <li>arrays whose elements are all objects are sorted by the canonical text of each element;
 *   <li>any other array keeps its element order.
 * </ul>
 *
 * <p>The input is never modified. Inputs are assumed to be acyclic JSON trees.
 */
@Component
@RequiredArgsConstructor
public class ConfigCanonicalizer {

  private final ObjectMapper objectMapper;

  public JsonNode canonicalize(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullNode.getInstance();
    }
    if (node.isObject()) {
      return canonicalizeObject(node);
    }
    if (node.isArray()) {
      return canonicalizeArray(node);
    }
    return node;
  }

  public String toText(JsonNode canonical) {
    try {
      return objectMapper.writeValueAsString(canonical);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize configuration", ex);
    }
  }

  private ObjectNode canonicalizeObject(JsonNode node) {
    final List<String> fieldNames = new ArrayList<>();
    node.fieldNames().forEachRemaining(fieldNames::add);
    fieldNames.sort(Comparator.naturalOrder());
    final ObjectNode sorted = objectMapper.createObjectNode();
    for (String fieldName : fieldNames) {
      sorted.set(fieldName, canonicalize(node.get(fieldName)));
    }
    return sorted;
  }

  private ArrayNode canonicalizeArray(JsonNode node) {
    final List<JsonNode> elements = new ArrayList<>(node.size());
    boolean allObjects = node.size() > 0;
    for (JsonNode element : node) {
      final JsonNode canonical = canonicalize(element);
      allObjects &= canonical.isObject();
      elements.add(canonical);
    }
    final ArrayNode result = objectMapper.createArrayNode();
    if (!allObjects) {
      result.addAll(elements);
      return result;
    }
    // scalar arrays keep their order; only lists of objects are treated as unordered sets
    final List<SortableElement> sortable = new ArrayList<>(elements.size());
    for (JsonNode element : elements) {
      sortable.add(new SortableElement(toText(element), element));
    }
    sortable.sort(Comparator.comparing(SortableElement::text));
    for (SortableElement element : sortable) {
      result.add(element.node());
    }
    return result;
  }

  private record SortableElement(String text, JsonNode node) {}
}
