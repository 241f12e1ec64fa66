package org.waabox.jobnotify;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes notification payloads into {@link RawMessage} instances.
 *
 * <p>A payload decodes only if it is a JSON object carrying a string
 * {@code message_type}. Anything else (plain text pings, JSON arrays,
 * objects without a type) is a decode failure: {@link #decode(String)}
 * returns empty and nothing is reported.
 *
 * <p>Field values become plain Java values: strings, booleans, integral
 * numbers as {@link Integer}, {@link Long} or
 * {@link java.math.BigInteger}, floating numbers as {@link Double}, and
 * nested arrays and objects as lists and maps.
 *
 * <p>This class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PayloadDecoder {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PayloadDecoder.class);

  /** Target type for field conversion. */
  private static final TypeReference<LinkedHashMap<String, Object>> FIELDS =
      new TypeReference<>() { };

  /** The mapper used for parsing, never null. */
  private final ObjectMapper mapper;

  /** Creates a decoder with a strict default {@link ObjectMapper}. */
  public PayloadDecoder() {
    this(new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
  }

  /**
   * Creates a decoder using the given mapper.
   *
   * @param theMapper the Jackson mapper, never null
   */
  public PayloadDecoder(final ObjectMapper theMapper) {
    mapper = Objects.requireNonNull(theMapper, "mapper must not be null");
  }

  /**
   * Decodes a payload.
   *
   * @param payload the notification payload, never null
   *
   * @return the decoded message, or empty if the payload is not a JSON
   *         object with a string {@code message_type}
   */
  public Optional<RawMessage> decode(final String payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final JsonNode node;
    try {
      node = mapper.readTree(payload);
    } catch (final JsonProcessingException e) {
      log.debug("Discarding notification that is not valid JSON: {}",
          e.getOriginalMessage());
      return Optional.empty();
    }

    if (node == null || !node.isObject()) {
      log.debug("Discarding notification that is not a JSON object");
      return Optional.empty();
    }

    final JsonNode type = node.get(RawMessage.MESSAGE_TYPE);
    if (type == null || !type.isTextual()) {
      log.debug("Discarding notification without a string {}",
          RawMessage.MESSAGE_TYPE);
      return Optional.empty();
    }

    final Map<String, Object> fields = mapper.convertValue(node, FIELDS);
    return Optional.of(new RawMessage(type.asText(), fields));
  }
}
