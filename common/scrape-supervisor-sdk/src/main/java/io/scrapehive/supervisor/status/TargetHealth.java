package io.scrapehive.supervisor.status;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Outcome of the most recent scrape of a target.
 */
public enum TargetHealth {
  UNKNOWN,
  UP,
  DOWN;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
