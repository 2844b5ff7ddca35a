package com.flamingo.ai.sessions.parser;

import lombok.Getter;

/**
 * Counters collected while reading one transcript. Not thread-safe; each file scan owns one
 * instance and the totals are merged afterwards.
 */
@Getter
public class ParseStatistics {

  private int linesRead;
  private int messages;
  private long malformedEntries;
  private long unknownEntries;
  private long outOfOrderTimestamps;

  void record(LineStatus status) {
    linesRead++;
    switch (status) {
      case MESSAGE -> messages++;
      case MALFORMED -> malformedEntries++;
      case UNKNOWN_TYPE -> unknownEntries++;
      case BLANK -> {}
    }
  }

  void recordOutOfOrderTimestamp() {
    outOfOrderTimestamps++;
  }
}
