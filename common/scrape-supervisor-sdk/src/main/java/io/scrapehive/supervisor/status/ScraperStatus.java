package io.scrapehive.supervisor.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Point-in-time snapshot of every target the engine is scraping.
 */
public record ScraperStatus(@JsonProperty("targets") List<TargetStatus> targetStatus) {

  public ScraperStatus {
    targetStatus = targetStatus == null ? List.of() : List.copyOf(targetStatus);
  }

  public static ScraperStatus empty() {
    return new ScraperStatus(List.of());
  }
}
