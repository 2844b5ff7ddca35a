package com.flamingo.ai.sessions.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.sessions.domain.enums.EntryType;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Flattens the content of a transcript entry into plain text.
 *
 * <p>Plain-string content is used verbatim. Block-array content keeps every {@code text} block
 * (and bare string items) in order, joined with newlines; all other blocks are only counted.
 */
@Component
public class ContentExtractor {

  private static final String TEXT_BLOCK = "text";

  public ExtractedContent extract(JsonNode entry, EntryType type) {
    return switch (type) {
      case USER, ASSISTANT -> extractMessageContent(entry);
      case TOOL_RESULT -> extractToolResult(entry);
      case TOOL_USE -> new ExtractedContent("", 1);
    };
  }

  private ExtractedContent extractMessageContent(JsonNode entry) {
    // Legacy exports put a plain string directly on the entry
    JsonNode topLevel = entry.get("content");
    if (topLevel != null && topLevel.isTextual()) {
      return new ExtractedContent(topLevel.asText(), 0);
    }
    JsonNode message = entry.get("message");
    if (message == null || !message.isObject()) {
      return ExtractedContent.EMPTY;
    }
    return flatten(message.get("content"));
  }

  /**
   * Flattens a {@code content} value that is either a string or an array of content blocks.
   *
   * @param content the content node, may be null
   * @return the flattened content
   */
  public ExtractedContent flatten(JsonNode content) {
    if (content == null || content.isNull()) {
      return ExtractedContent.EMPTY;
    }
    if (content.isTextual()) {
      return new ExtractedContent(content.asText(), 0);
    }
    if (!content.isArray()) {
      return ExtractedContent.EMPTY;
    }

    List<String> parts = new ArrayList<>();
    int nonText = 0;
    for (JsonNode block : content) {
      if (block.isTextual()) {
        parts.add(block.asText());
      } else if (block.isObject() && TEXT_BLOCK.equals(block.path("type").asText())) {
        parts.add(block.path("text").asText(""));
      } else {
        nonText++;
      }
    }
    return new ExtractedContent(String.join("\n", parts), nonText);
  }

  private ExtractedContent extractToolResult(JsonNode entry) {
    JsonNode result = entry.path("result");
    String output = result.path("output").asText("");
    JsonNode error = result.get("error");
    if (error != null && !error.isNull() && !error.asText().isEmpty()) {
      output = output.isEmpty() ? error.asText() : output + "\n" + error.asText();
    }
    return new ExtractedContent(output, 0);
  }
}
