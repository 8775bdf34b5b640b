package io.scrapehive.supervisor.ports;

import io.scrapehive.supervisor.engine.EngineConfig;
import io.scrapehive.supervisor.engine.EngineConfigRejectedException;
import java.util.List;
import java.util.Map;

/**
 * Port over the collection engine that performs the actual scraping.
 * <p>
 * The supervisor creates exactly one engine through a {@link ScrapeEngineFactory}
 * and owns it for its whole lifetime. Implementations must tolerate
 * {@link #applyConfig(EngineConfig)}, {@link #activeTargets()} and {@link #stop()}
 * being called concurrently with {@link #run(TargetSetChannel)}.
 */
public interface ScrapeEngine {

  /**
   * Apply a declarative job configuration. Either the whole configuration is
   * accepted or the engine keeps its previous one.
   *
   * @param config job configuration built by the supervisor
   * @throws EngineConfigRejectedException when the engine refuses the configuration
   */
  void applyConfig(EngineConfig config) throws EngineConfigRejectedException;

  /**
   * Consume target-set updates until {@link #stop()} is called.
   * <p>
   * Returning normally means the engine was stopped. Throwing means the
   * background scraping failed and will not resume on its own.
   *
   * @param targetSets hand-off channel fed by the supervisor run loop
   * @throws Exception when the engine terminates unexpectedly
   */
  void run(TargetSetChannel targetSets) throws Exception;

  /**
   * Live view of the targets currently being scraped, keyed by job name.
   * Lists may contain {@code null} entries for targets that are being torn down.
   *
   * @return active targets per job (never null)
   */
  Map<String, List<ActiveTarget>> activeTargets();

  /**
   * Halt all background scraping and release resources.
   */
  void stop();
}
