package io.localnotification.reader;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Best-effort conversion of option values. Anything that cannot be read as the wanted type
 * becomes zero or false; nothing here throws. Infinite and NaN numbers count as unreadable.
 */
final class Coercion {
  private Coercion() {}

  /** Returns true when the node is missing or JSON null. */
  static boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }

  static double toDouble(JsonNode node) {
    if (isAbsent(node)) {
      return 0;
    }
    if (node.isNumber()) {
      double value = node.doubleValue();
      return Double.isFinite(value) ? value : 0;
    }
    if (node.isBoolean()) {
      return node.booleanValue() ? 1 : 0;
    }
    if (node.isTextual()) {
      return parseDouble(node.textValue()).orElse(0.0);
    }
    return 0;
  }

  static long toLong(JsonNode node) {
    return (long) toDouble(node);
  }

  static boolean toBoolean(JsonNode node) {
    if (isAbsent(node)) {
      return false;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isTextual()) {
      String text = node.textValue().trim();
      return text.equalsIgnoreCase("true") || parseDouble(text).orElse(0.0) != 0;
    }
    return toDouble(node) != 0;
  }

  /** Epoch milliseconds, a numeric string, or an ISO-8601 instant. */
  static Instant toInstant(JsonNode node) {
    if (node.isTextual()) {
      Optional<Double> millis = parseDouble(node.textValue());
      if (millis.isPresent()) {
        return Instant.ofEpochMilli(millis.get().longValue());
      }
      try {
        return Instant.parse(node.textValue().trim());
      } catch (DateTimeParseException e) {
        return Instant.EPOCH;
      }
    }
    return Instant.ofEpochMilli((long) toDouble(node));
  }

  private static Optional<Double> parseDouble(String text) {
    try {
      double value = Double.parseDouble(text.trim());
      return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
