package com.flamingo.ai.sessions.domain.model;

/**
 * A project directory under the corpus root.
 *
 * @param name directory name
 * @param sessionCount number of transcript files directly inside it
 * @param totalSizeBytes combined transcript size
 */
public record ProjectSummary(String name, int sessionCount, long totalSizeBytes) {}
