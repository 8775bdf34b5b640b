package io.scrapehive.supervisor.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Objects;

/**
 * Canonical JSON serializer for scrape status snapshots.
 */
public final class ScrapeStatusJson {

  private static final ObjectMapper MAPPER = JsonMapper.builder()
      .findAndAddModules()
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
      .build()
      .setSerializationInclusion(JsonInclude.Include.ALWAYS);

  private ScrapeStatusJson() {
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String write(ScraperStatus status) {
    Objects.requireNonNull(status, "status");
    try {
      return MAPPER.writeValueAsString(status);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize scrape status", e);
    }
  }
}
