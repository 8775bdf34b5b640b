package io.scrapehive.supervisor.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.scrapehive.supervisor.ports.ActiveTarget;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Status of the latest scrape for a single target.
 */
public record TargetStatus(
    @JsonProperty("job") String jobName,
    @JsonProperty("url") String url,
    @JsonProperty("health") TargetHealth health,
    @JsonProperty("labels") Map<String, String> labels,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("last_scrape") Instant lastScrape,
    @JsonProperty("last_scrape_duration") Duration lastScrapeDuration
) {

  public TargetStatus {
    Objects.requireNonNull(jobName, "jobName");
    health = health == null ? TargetHealth.UNKNOWN : health;
    labels = labels == null ? Map.of() : Map.copyOf(labels);
    lastError = lastError == null ? "" : lastError;
    lastScrapeDuration = lastScrapeDuration == null ? Duration.ZERO : lastScrapeDuration;
  }

  static TargetStatus of(String jobName, ActiveTarget target) {
    return new TargetStatus(
        jobName,
        target.url(),
        target.health(),
        target.labels(),
        target.lastError(),
        target.lastScrape(),
        target.lastScrapeDuration());
  }
}
