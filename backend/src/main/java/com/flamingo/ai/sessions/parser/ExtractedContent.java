package com.flamingo.ai.sessions.parser;

/**
 * Text flattened out of an entry's content, plus how many non-text blocks were left out.
 *
 * @param text plain text, never null
 * @param nonTextBlocks images, tool calls, thinking blocks and other omitted blocks
 */
public record ExtractedContent(String text, int nonTextBlocks) {

  public static final ExtractedContent EMPTY = new ExtractedContent("", 0);
}
