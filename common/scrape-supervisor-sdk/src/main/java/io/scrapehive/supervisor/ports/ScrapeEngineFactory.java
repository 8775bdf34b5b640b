package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.engine.ScrapeEngineOptions;

/**
 * Creates the collection engine owned by a single supervisor instance.
 */
@FunctionalInterface
public interface ScrapeEngineFactory {

  /**
   * @param options engine-wide options derived from the initial arguments
   * @param fanout  sink receiving every scraped sample
   * @return a new, not yet running engine
   */
  ScrapeEngine create(ScrapeEngineOptions options, SampleFanout fanout);
}
