package io.scrapehive.supervisor.runtime;

import io.scrapehive.supervisor.config.ScrapeArguments;
import io.scrapehive.supervisor.status.ScraperStatus;

/**
 * Lifecycle contract for a supervisor keeping one scrape engine configured.
 */
public interface SupervisorLifecycle {

  void start();

  void stop();

  void update(ScrapeArguments args);

  SupervisorState getState();

  ScrapeArguments currentArguments();

  ScraperStatus status();

  boolean isScraping();
}
