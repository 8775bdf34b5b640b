package io.scrapehive.supervisor.engine;

import java.util.Map;
import java.util.Objects;

/**
 * A single sample produced by a scrape, as forwarded to receivers.
 */
public record ScrapedSample(Map<String, String> labels, long timestampMillis, double value) {

  public ScrapedSample {
    labels = Map.copyOf(Objects.requireNonNull(labels, "labels"));
  }

  public String metricName() {
    return labels.getOrDefault("__name__", "");
  }
}
