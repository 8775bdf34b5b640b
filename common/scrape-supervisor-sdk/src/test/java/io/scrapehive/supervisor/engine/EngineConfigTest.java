package io.scrapehive.supervisor.engine;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.scrapehive.supervisor.config.ScrapeArguments;
import io.scrapehive.supervisor.config.ScrapeConfigBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void duplicateJobNamesAreRejected() {
    ScrapeJobConfig job = ScrapeConfigBuilder.build("scrape.a", ScrapeArguments.defaults());
    EngineConfig config = new EngineConfig(List.of(job, job));

    assertThatThrownBy(config::validate)
        .isInstanceOf(EngineConfigRejectedException.class)
        .hasMessageContaining("scrape.a");
  }

  @Test
  void invalidJobIsRejectedWithItsReason() {
    ScrapeJobConfig valid = ScrapeConfigBuilder.build("scrape.a", ScrapeArguments.defaults());
    ScrapeJobConfig invalid = new ScrapeJobConfig("scrape.a", false, true, null,
        valid.scrapeInterval(), valid.scrapeTimeout(), "/metrics", "gopher",
        0, 0, 0, 0, 0, 0, valid.httpClientConfig());

    assertThatThrownBy(() -> EngineConfig.of(invalid).validate())
        .isInstanceOf(EngineConfigRejectedException.class)
        .hasMessageContaining("invalid scheme \"gopher\"")
        .hasCauseInstanceOf(IllegalArgumentException.class);
  }
}
