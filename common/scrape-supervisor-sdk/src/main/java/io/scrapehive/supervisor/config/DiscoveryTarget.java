package io.scrapehive.supervisor.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A discovered target: an ordered set of labels, at most one value per label name.
 */
public record DiscoveryTarget(Map<String, String> labels) {

  public static final String ADDRESS_LABEL = "__address__";

  public DiscoveryTarget {
    Objects.requireNonNull(labels, "labels");
    Map<String, String> copy = new LinkedHashMap<>();
    labels.forEach((name, value) -> {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("target label name must not be null or blank");
      }
      copy.put(name, value == null ? "" : value);
    });
    labels = Collections.unmodifiableMap(copy);
  }

  public static DiscoveryTarget of(Map<String, String> labels) {
    return new DiscoveryTarget(labels);
  }

  public static DiscoveryTarget ofAddress(String address) {
    return new DiscoveryTarget(Map.of(ADDRESS_LABEL, Objects.requireNonNull(address, "address")));
  }

  public Optional<String> address() {
    return Optional.ofNullable(labels.get(ADDRESS_LABEL));
  }
}
