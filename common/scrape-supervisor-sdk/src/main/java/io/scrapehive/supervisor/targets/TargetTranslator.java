package io.scrapehive.supervisor.targets;

import io.scrapehive.supervisor.config.DiscoveryTarget;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the supervisor's discovery targets into the engine's target-set shape:
 * one set keyed by the instance id holding exactly one group sourced from it.
 */
public final class TargetTranslator {

  private TargetTranslator() {
  }

  public static Map<String, List<TargetGroup>> translate(String instanceId, List<DiscoveryTarget> targets) {
    Objects.requireNonNull(instanceId, "instanceId");
    List<Map<String, String>> labelSets = new ArrayList<>(targets == null ? 0 : targets.size());
    if (targets != null) {
      for (DiscoveryTarget target : targets) {
        labelSets.add(target.labels());
      }
    }
    TargetGroup group = new TargetGroup(instanceId, labelSets);
    return Map.of(instanceId, List.of(group));
  }
}
