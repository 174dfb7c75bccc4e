package com.example.aggregator.service;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Lenient accessors over upstream JSON trees.
 *
 * <p>Absent keys, explicit {@code null} and values of the wrong JSON type are all treated as
 * "missing" and fall back to the supplied default. Only the {@code required*} accessors fail,
 * with {@link SourceIntegrationException.Reason#INVALID_RESPONSE}.
 */
public final class JsonFields {

  private JsonFields() {}

  @Nullable
  public static String optionalText(@Nullable JsonNode node, String field) {
    return text(node, field, null);
  }

  public static String text(@Nullable JsonNode node, String field, @Nullable String fallback) {
    final JsonNode value = child(node, field);
    if (value == null || !value.isValueNode()) {
      return fallback;
    }
    return value.asText();
  }

  public static long longValue(@Nullable JsonNode node, String field, long fallback) {
    final JsonNode value = child(node, field);
    if (value == null || !value.isNumber()) {
      return fallback;
    }
    return value.asLong();
  }

  @Nullable
  public static Integer optionalInt(@Nullable JsonNode node, String field) {
    final JsonNode value = child(node, field);
    if (value == null || !value.isNumber()) {
      return null;
    }
    return value.asInt();
  }

  public static boolean bool(@Nullable JsonNode node, String field, boolean fallback) {
    final JsonNode value = child(node, field);
    if (value == null || !value.isBoolean()) {
      return fallback;
    }
    return value.asBoolean();
  }

  public static String requiredText(@Nullable JsonNode node, String field, String source) {
    final String value = optionalText(node, field);
    if (value == null) {
      throw SourceIntegrationException.invalidResponse(
          source, source + " response is missing '" + field + "'.");
    }
    return value;
  }

  public static long requiredLong(@Nullable JsonNode node, String field, String source) {
    final JsonNode value = child(node, field);
    if (value == null || !value.canConvertToLong()) {
      throw SourceIntegrationException.invalidResponse(
          source, source + " response is missing '" + field + "'.");
    }
    return value.asLong();
  }

  /** Returns the node itself when it is an array; anything else is a shape failure. */
  public static JsonNode requireArray(@Nullable JsonNode node, String source) {
    if (node == null || !node.isArray()) {
      throw SourceIntegrationException.invalidResponse(
          source, source + " response is not a JSON array.");
    }
    return node;
  }

  /** Returns {@code node[field]} when it is an array, otherwise an empty list. */
  public static List<JsonNode> arrayAt(@Nullable JsonNode node, String field) {
    final JsonNode value = child(node, field);
    return elements(value);
  }

  public static List<JsonNode> elements(@Nullable JsonNode array) {
    final List<JsonNode> result = new ArrayList<>();
    if (array == null || !array.isArray()) {
      return result;
    }
    array.forEach(result::add);
    return result;
  }

  public static List<String> textList(@Nullable JsonNode node, String field) {
    final List<String> result = new ArrayList<>();
    for (JsonNode element : arrayAt(node, field)) {
      if (element.isValueNode() && !element.isNull()) {
        result.add(element.asText());
      }
    }
    return result;
  }

  @Nullable
  private static JsonNode child(@Nullable JsonNode node, String field) {
    if (node == null || !node.isObject()) {
      return null;
    }
    final JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isMissingNode()) {
      return null;
    }
    return value;
  }
}
