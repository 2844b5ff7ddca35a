package com.flamingo.ai.sessions.parser;

/** What the parser made of one transcript line. */
public enum LineStatus {
  /** The line produced a message. */
  MESSAGE,

  /** Empty or whitespace-only line. */
  BLANK,

  /** Invalid JSON, or an entry missing a required field. */
  MALFORMED,

  /** Valid JSON with an entry type the parser does not handle. */
  UNKNOWN_TYPE
}
