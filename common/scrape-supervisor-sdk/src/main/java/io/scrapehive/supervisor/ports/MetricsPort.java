package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.config.ScrapeConfigException;

/**
 * Abstraction for metrics updates emitted by the scrape supervisor.
 */
public interface MetricsPort {

  void configApplied();

  void configRejected(ScrapeConfigException.Stage stage);

  /**
   * @param coalesced {@code true} when a reload was already pending and the new one was dropped
   */
  void reloadSignal(boolean coalesced);

  /**
   * @param targetCount number of targets in the set handed to the engine
   */
  void targetsPropagated(int targetCount);

  void engineRunning(boolean running);

  default void close() {
  }

  static MetricsPort noop() {
    return new MetricsPort() {
      @Override
      public void configApplied() {
      }

      @Override
      public void configRejected(ScrapeConfigException.Stage stage) {
      }

      @Override
      public void reloadSignal(boolean coalesced) {
      }

      @Override
      public void targetsPropagated(int targetCount) {
      }

      @Override
      public void engineRunning(boolean running) {
      }
    };
  }
}
