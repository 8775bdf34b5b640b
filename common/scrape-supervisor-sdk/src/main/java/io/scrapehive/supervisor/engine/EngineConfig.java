package io.scrapehive.supervisor.engine;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Complete configuration handed to the engine on every apply.
 */
public record EngineConfig(List<ScrapeJobConfig> scrapeConfigs) {

  public EngineConfig {
    Objects.requireNonNull(scrapeConfigs, "scrapeConfigs");
    scrapeConfigs = List.copyOf(scrapeConfigs);
  }

  public static EngineConfig of(ScrapeJobConfig job) {
    return new EngineConfig(List.of(job));
  }

  /**
   * Validate every job. Engines call this from {@code applyConfig} before swapping configurations.
   *
   * @throws EngineConfigRejectedException when any job is invalid or job names collide
   */
  public void validate() throws EngineConfigRejectedException {
    Set<String> names = new HashSet<>();
    for (ScrapeJobConfig job : scrapeConfigs) {
      if (!names.add(job.jobName())) {
        throw new EngineConfigRejectedException("found multiple scrape configs with job name \"" + job.jobName() + "\"");
      }
      try {
        job.validate();
      } catch (IllegalArgumentException ex) {
        throw new EngineConfigRejectedException(ex.getMessage(), ex);
      }
    }
  }
}
