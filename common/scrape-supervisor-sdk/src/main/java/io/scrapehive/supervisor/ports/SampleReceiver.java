package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.engine.ScrapedSample;

/**
 * Downstream destination for scraped samples.
 */
@FunctionalInterface
public interface SampleReceiver {

  void receive(ScrapedSample sample) throws Exception;

  default String name() {
    return getClass().getSimpleName();
  }
}
