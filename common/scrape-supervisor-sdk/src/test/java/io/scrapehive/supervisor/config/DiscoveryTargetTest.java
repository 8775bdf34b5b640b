package io.scrapehive.supervisor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DiscoveryTargetTest {

  @Test
  void addressIsReadFromTheAddressLabel() {
    assertThat(DiscoveryTarget.ofAddress("host:80").address()).contains("host:80");
    assertThat(DiscoveryTarget.of(Map.of("env", "prod")).address()).isEmpty();
  }

  @Test
  void nullValuesBecomeEmptyStrings() {
    Map<String, String> labels = new HashMap<>();
    labels.put("team", null);

    assertThat(DiscoveryTarget.of(labels).labels()).containsEntry("team", "");
  }

  @Test
  void blankLabelNamesAreRejected() {
    assertThatThrownBy(() -> DiscoveryTarget.of(Map.of(" ", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
