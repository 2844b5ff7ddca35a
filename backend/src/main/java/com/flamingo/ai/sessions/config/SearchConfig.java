package com.flamingo.ai.sessions.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for transcript search. */
@Configuration
@ConfigurationProperties(prefix = "search")
@Getter
@Setter
public class SearchConfig {

  private Corpus corpus = new Corpus();
  private Scoring scoring = new Scoring();
  private Defaults defaults = new Defaults();
  private Execution execution = new Execution();
  private Semantic semantic = new Semantic();

  @Getter
  @Setter
  public static class Corpus {
    /** Directory holding one sub-directory per project. */
    private String root = System.getProperty("user.home") + "/.claude/projects";

    /** Directory names holding generated Markdown/HTML/JSON copies; never searched. */
    private List<String> excludedDirectories =
        new ArrayList<>(List.of("markdown", "html", "data"));

    private String fileSuffix = ".jsonl";

    /** Slack added when skipping files last modified before a query's lower date bound. */
    private Duration modifiedTimeSlack = Duration.ofDays(1);
  }

  @Getter
  @Setter
  public static class Scoring {
    /** Smart-mode messages scoring strictly below this are dropped. */
    private double relevanceThreshold = 0.5;

    private double exactPhraseBonus = 0.5;
    private double proximityBonus = 0.2;

    /** Matched tokens must fit in a window shorter than matched count times this. */
    private int proximityWindowMultiplier = 2;

    /** Extra score per additional exact/regex occurrence, for tie-breaking only. */
    private double occurrenceWeight = 0.01;

    private int maxCountedOccurrences = 10;

    /** Semantic-mode messages with a cosine similarity strictly below this are dropped. */
    private double semanticThreshold = 0.5;

    private boolean stopWordsEnabled = true;
  }

  @Getter
  @Setter
  public static class Defaults {
    private int contextSize = 150;
    private int maxResults = 20;
  }

  @Getter
  @Setter
  public static class Execution {
    /** Worker threads scanning files; 0 uses the number of available processors. */
    private int parallelism = 0;

    public int effectiveParallelism() {
      return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }
  }

  @Getter
  @Setter
  public static class Semantic {
    /** "none" leaves semantic search unavailable; "local" loads the in-process model. */
    private String provider = "none";

    /** Text is truncated to this many characters before embedding. */
    private int maxTextChars = 2000;
  }
}
