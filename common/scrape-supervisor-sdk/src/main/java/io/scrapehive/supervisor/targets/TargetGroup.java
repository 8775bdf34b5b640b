package io.scrapehive.supervisor.targets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named collection of label sets sharing one source identifier.
 * An empty {@code targets} list tells the engine to drop every target from this source.
 */
public record TargetGroup(String source, List<Map<String, String>> targets) {

  public TargetGroup {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(targets, "targets");
    List<Map<String, String>> copy = new ArrayList<>(targets.size());
    for (Map<String, String> labels : targets) {
      copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(labels, "labels"))));
    }
    targets = Collections.unmodifiableList(copy);
  }

  public int size() {
    return targets.size();
  }
}
