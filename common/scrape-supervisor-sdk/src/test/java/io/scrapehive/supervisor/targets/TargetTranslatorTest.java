package io.scrapehive.supervisor.targets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrapehive.supervisor.config.DiscoveryTarget;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TargetTranslatorTest {

  @Test
  void wrapsAllTargetsInOneGroupKeyedByInstance() {
    Map<String, List<TargetGroup>> sets = TargetTranslator.translate("scrape.a", List.of(
        DiscoveryTarget.of(Map.of("__address__", "10.0.0.1:9090", "env", "prod")),
        DiscoveryTarget.ofAddress("10.0.0.2:9090"),
        DiscoveryTarget.ofAddress("10.0.0.3:9090")));

    assertThat(sets).containsOnlyKeys("scrape.a");
    assertThat(sets.get("scrape.a")).hasSize(1);
    TargetGroup group = sets.get("scrape.a").get(0);
    assertThat(group.source()).isEqualTo("scrape.a");
    assertThat(group.size()).isEqualTo(3);
    assertThat(group.targets().get(0))
        .containsEntry("__address__", "10.0.0.1:9090")
        .containsEntry("env", "prod");
  }

  @Test
  void emptyInputStillProducesAGroupWithoutMembers() {
    Map<String, List<TargetGroup>> sets = TargetTranslator.translate("scrape.a", List.of());

    TargetGroup group = sets.get("scrape.a").get(0);
    assertThat(group.source()).isEqualTo("scrape.a");
    assertThat(group.targets()).isEmpty();
  }

  @Test
  void translatedLabelSetsAreDetachedFromTheInput() {
    Map<String, List<TargetGroup>> sets = TargetTranslator.translate("scrape.a",
        List.of(DiscoveryTarget.ofAddress("a:1")));

    assertThatThrownBy(() -> sets.get("scrape.a").get(0).targets().get(0).put("x", "y"))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
