package com.flamingo.ai.sessions.config;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** Web MVC configuration. */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  /**
   * Binds request parameters such as {@code ?mode=regex&speaker=human} to the enums by their
   * lower-case values, the same way JSON bodies are read.
   */
  @Override
  public void addFormatters(FormatterRegistry registry) {
    registry.addConverter(String.class, SearchMode.class, new SearchModeConverter());
    registry.addConverter(String.class, Speaker.class, new SpeakerConverter());
  }

  static class SearchModeConverter implements Converter<String, SearchMode> {
    @Override
    public SearchMode convert(String source) {
      return SearchMode.fromValue(source.trim());
    }
  }

  static class SpeakerConverter implements Converter<String, Speaker> {
    @Override
    public Speaker convert(String source) {
      return Speaker.fromValue(source.trim());
    }
  }
}
