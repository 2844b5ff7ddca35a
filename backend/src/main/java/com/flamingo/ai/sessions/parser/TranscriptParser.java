package com.flamingo.ai.sessions.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.sessions.domain.enums.EntryType;
import com.flamingo.ai.sessions.domain.model.Message;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts one line of a transcript event log into a {@link Message}.
 *
 * <p>Stateless: every call depends only on its arguments. Failures are reported through the
 * returned {@link ParsedLine}, never thrown, so a bad line cannot abort a file scan.
 *
 * <ul>
 *   <li>invalid JSON, or an entry without a parseable {@code timestamp}: {@link
 *       LineStatus#MALFORMED}
 *   <li>a {@code type} other than user, assistant, tool_use or tool_result: {@link
 *       LineStatus#UNKNOWN_TYPE}
 *   <li>no {@code uuid}: the id defaults to {@code <sessionId>:<lineNumber>}
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptParser {

  private final ObjectMapper objectMapper;
  private final ContentExtractor contentExtractor;

  /**
   * Parses a single line.
   *
   * @param line raw line without its terminator
   * @param sessionId transcript the line belongs to
   * @param lineNumber 1-based position of the line in its file
   * @return the parse outcome
   */
  public ParsedLine parseLine(String line, String sessionId, int lineNumber) {
    if (line == null || line.isBlank()) {
      return ParsedLine.blank();
    }

    JsonNode entry;
    try {
      entry = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      log.debug("Invalid JSON at {}:{}: {}", sessionId, lineNumber, e.getOriginalMessage());
      return ParsedLine.malformed("invalid JSON");
    }
    if (entry == null || !entry.isObject()) {
      return ParsedLine.malformed("not a JSON object");
    }

    Optional<EntryType> type = EntryType.fromValue(entry.path("type").asText(null));
    if (type.isEmpty()) {
      log.debug(
          "Skipping entry type '{}' at {}:{}", entry.path("type").asText(), sessionId, lineNumber);
      return ParsedLine.unknownType();
    }

    Optional<Instant> timestamp = parseTimestamp(entry.path("timestamp").asText(null));
    if (timestamp.isEmpty()) {
      log.debug("Missing or invalid timestamp at {}:{}", sessionId, lineNumber);
      return ParsedLine.malformed("missing timestamp");
    }

    ExtractedContent content = contentExtractor.extract(entry, type.get());
    String uuid = entry.path("uuid").asText("");

    return ParsedLine.of(
        Message.builder()
            .id(uuid.isEmpty() ? sessionId + ":" + lineNumber : uuid)
            .sessionId(sessionId)
            .speaker(type.get().getSpeaker())
            .entryType(type.get())
            .timestamp(timestamp.get())
            .text(content.text())
            .nonTextBlocks(content.nonTextBlocks())
            .lineNumber(lineNumber)
            .raw(entry)
            .build());
  }

  /**
   * Parses an ISO-8601 timestamp. Accepts {@code Z}, explicit offsets, and offset-less local times
   * (read as UTC).
   *
   * @param value the raw value, may be null
   * @return the instant, or empty if the value is missing or unparseable
   */
  static Optional<Instant> parseTimestamp(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(value).toInstant());
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(LocalDateTime.parse(value).toInstant(ZoneOffset.UTC));
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
  }
}
