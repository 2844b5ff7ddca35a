package com.flamingo.ai.sessions.parser;

import com.flamingo.ai.sessions.domain.model.Message;
import java.util.Optional;

/**
 * Outcome of parsing one line.
 *
 * @param status what the line turned out to be
 * @param message the message when {@code status} is {@link LineStatus#MESSAGE}, otherwise null
 * @param reason why a malformed line was rejected, otherwise null
 */
public record ParsedLine(LineStatus status, Message message, String reason) {

  static ParsedLine of(Message message) {
    return new ParsedLine(LineStatus.MESSAGE, message, null);
  }

  static ParsedLine blank() {
    return new ParsedLine(LineStatus.BLANK, null, null);
  }

  static ParsedLine malformed(String reason) {
    return new ParsedLine(LineStatus.MALFORMED, null, reason);
  }

  static ParsedLine unknownType() {
    return new ParsedLine(LineStatus.UNKNOWN_TYPE, null, null);
  }

  public Optional<Message> asMessage() {
    return Optional.ofNullable(message);
  }
}
