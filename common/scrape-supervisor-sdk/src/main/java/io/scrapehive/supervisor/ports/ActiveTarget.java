package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.status.TargetHealth;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Engine-side view of a single scraped target as of its most recent scrape attempt.
 */
public interface ActiveTarget {

  String url();

  TargetHealth health();

  Map<String, String> labels();

  /**
   * @return error message of the last scrape, or {@code null} when it succeeded or none ran yet
   */
  String lastError();

  /**
   * @return start of the last scrape, or {@code null} before the first one
   */
  Instant lastScrape();

  Duration lastScrapeDuration();
}
