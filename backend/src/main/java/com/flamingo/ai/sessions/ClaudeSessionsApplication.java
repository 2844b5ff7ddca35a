package com.flamingo.ai.sessions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Transcript search service. */
@SpringBootApplication
public class ClaudeSessionsApplication {

  public static void main(String[] args) {
    SpringApplication.run(ClaudeSessionsApplication.class, args);
  }
}
