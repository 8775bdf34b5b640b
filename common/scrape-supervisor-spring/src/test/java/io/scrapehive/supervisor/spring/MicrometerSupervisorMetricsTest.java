package io.scrapehive.supervisor.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.scrapehive.supervisor.config.ScrapeConfigException;
import org.junit.jupiter.api.Test;

class MicrometerSupervisorMetricsTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MicrometerSupervisorMetrics metrics =
        new MicrometerSupervisorMetrics(registry, Tags.of("instance", "scrape.a"));

    @Test
    void countsUpdatesByOutcomeAndStage() {
        metrics.configApplied();
        metrics.configApplied();
        metrics.configRejected(ScrapeConfigException.Stage.BUILD);
        metrics.configRejected(ScrapeConfigException.Stage.APPLY);
        metrics.configRejected(ScrapeConfigException.Stage.APPLY);

        assertThat(count("outcome", "applied", "stage", "none")).isEqualTo(2.0);
        assertThat(count("outcome", "rejected", "stage", "build")).isEqualTo(1.0);
        assertThat(count("outcome", "rejected", "stage", "apply")).isEqualTo(2.0);
    }

    @Test
    void separatesRaisedAndCoalescedSignals() {
        metrics.reloadSignal(false);
        metrics.reloadSignal(true);
        metrics.reloadSignal(true);

        assertThat(registry.get("sh_scrape_reload_signals").tag("outcome", "raised").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("sh_scrape_reload_signals").tag("outcome", "coalesced").counter().count()).isEqualTo(2.0);
    }

    @Test
    void tracksPropagatedTargetsAndEngineState() {
        metrics.targetsPropagated(3);
        metrics.targetsPropagated(1);
        metrics.engineRunning(true);

        assertThat(registry.get("sh_scrape_target_propagations").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("sh_scrape_targets").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("sh_scrape_engine_running").gauge().value()).isEqualTo(1.0);

        metrics.engineRunning(false);
        assertThat(registry.get("sh_scrape_engine_running").gauge().value()).isZero();
    }

    @Test
    void closeRemovesAllMeters() {
        metrics.close();

        assertThat(registry.getMeters()).isEmpty();
    }

    private double count(String... tags) {
        return registry.get("sh_scrape_config_updates").tags(tags).counter().count();
    }
}
