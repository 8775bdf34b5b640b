package io.scrapehive.supervisor.status;

import io.scrapehive.supervisor.ports.ActiveTarget;
import io.scrapehive.supervisor.ports.ScrapeEngine;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds status snapshots straight from the engine's live target registry.
 * Nothing is cached; every call reflects the engine at that moment.
 */
public final class StatusReporter {

  private final ScrapeEngine engine;

  public StatusReporter(ScrapeEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
  }

  public ScraperStatus status() {
    Map<String, List<ActiveTarget>> active = engine.activeTargets();
    if (active == null || active.isEmpty()) {
      return ScraperStatus.empty();
    }
    List<TargetStatus> result = new ArrayList<>();
    new TreeMap<>(active).forEach((job, targets) -> {
      if (targets == null) {
        return;
      }
      for (ActiveTarget target : targets) {
        if (target != null) {
          result.add(TargetStatus.of(job, target));
        }
      }
    });
    return new ScraperStatus(result);
  }
}
