package com.flamingo.ai.sessions.parser;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.model.Message;
import com.flamingo.ai.sessions.exception.TranscriptReadException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Streams the messages of a transcript file line by line.
 *
 * <p>Each call to {@link #read} opens the file afresh, so the sequence can be restarted simply by
 * reading again. The file is opened read-only and never fully buffered. Invalid UTF-8 is replaced
 * rather than rejected so one bad byte only spoils its own line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptReader {

  private final TranscriptParser parser;
  private final SearchConfig searchConfig;

  /**
   * Opens a lazy stream of the file's messages in source order. The stream must be closed.
   *
   * @param file transcript to read
   * @param statistics receives line counters while the stream is consumed
   * @return messages in file order
   * @throws TranscriptReadException if the file cannot be opened, or later from the stream if a
   *     read fails
   */
  public Stream<Message> read(Path file, ParseStatistics statistics) {
    BufferedReader reader = open(file);
    String sessionId = sessionIdOf(file);
    MessageSpliterator spliterator = new MessageSpliterator(file, sessionId, reader, statistics);
    return StreamSupport.stream(spliterator, false).onClose(() -> closeReader(file, reader));
  }

  /** Returns the session id of a transcript: its file name without the configured suffix. */
  public String sessionIdOf(Path file) {
    return sessionIdOf(file, searchConfig.getCorpus().getFileSuffix());
  }

  static String sessionIdOf(Path file, String suffix) {
    String name = file.getFileName().toString();
    return !suffix.isEmpty() && name.endsWith(suffix) && name.length() > suffix.length()
        ? name.substring(0, name.length() - suffix.length())
        : name;
  }

  private BufferedReader open(Path file) {
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try {
      return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    } catch (IOException e) {
      throw new TranscriptReadException(file, e);
    }
  }

  private void closeReader(Path file, BufferedReader reader) {
    try {
      reader.close();
    } catch (IOException e) {
      log.warn("Failed to close transcript {}: {}", file, e.getMessage());
    }
  }

  private class MessageSpliterator extends Spliterators.AbstractSpliterator<Message> {

    private final Path file;
    private final String sessionId;
    private final BufferedReader reader;
    private final ParseStatistics statistics;
    private int lineNumber;
    private Instant previousTimestamp;

    MessageSpliterator(
        Path file, String sessionId, BufferedReader reader, ParseStatistics statistics) {
      super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
      this.file = file;
      this.sessionId = sessionId;
      this.reader = reader;
      this.statistics = statistics;
    }

    @Override
    public boolean tryAdvance(Consumer<? super Message> action) {
      String line;
      while ((line = nextLine()) != null) {
        lineNumber++;
        ParsedLine parsed = parser.parseLine(line, sessionId, lineNumber);
        statistics.record(parsed.status());
        if (parsed.status() == LineStatus.MESSAGE) {
          observeOrder(parsed.message());
          action.accept(parsed.message());
          return true;
        }
      }
      return false;
    }

    private String nextLine() {
      try {
        return reader.readLine();
      } catch (IOException e) {
        throw new TranscriptReadException(file, e);
      }
    }

    // Source order is trusted; a step back in time is only counted.
    private void observeOrder(Message message) {
      Instant timestamp = message.getTimestamp();
      if (previousTimestamp != null && timestamp.isBefore(previousTimestamp)) {
        statistics.recordOutOfOrderTimestamp();
        log.debug(
            "Out-of-order timestamp in {} line {}: {} precedes {}",
            sessionId,
            lineNumber,
            timestamp,
            previousTimestamp);
      }
      previousTimestamp = timestamp;
    }
  }
}
