package io.scrapehive.supervisor.spring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.scrapehive.supervisor.config.ScrapeConfigException;
import io.scrapehive.supervisor.ports.MetricsPort;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

final class MicrometerSupervisorMetrics implements MetricsPort {

    private final MeterRegistry meterRegistry;
    private final Tags tags;

    private final AtomicInteger targetsValue = new AtomicInteger(0);
    private final AtomicInteger runningValue = new AtomicInteger(0);

    private final Counter applied;
    private final Map<ScrapeConfigException.Stage, Counter> rejected = new EnumMap<>(ScrapeConfigException.Stage.class);
    private final Counter signalsRaised;
    private final Counter signalsCoalesced;
    private final Counter propagations;
    private final List<Meter> meters = new ArrayList<>();

    MicrometerSupervisorMetrics(MeterRegistry meterRegistry, Tags tags) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
        this.tags = Objects.requireNonNull(tags, "tags");
        this.applied = updates("applied", "none");
        for (ScrapeConfigException.Stage stage : ScrapeConfigException.Stage.values()) {
            rejected.put(stage, updates("rejected", stage.name().toLowerCase(Locale.ROOT)));
        }
        this.signalsRaised = signals("raised");
        this.signalsCoalesced = signals("coalesced");
        this.propagations = track(Counter.builder("sh_scrape_target_propagations")
            .description("Target sets handed to the scrape engine")
            .tags(tags)
            .register(meterRegistry));
        track(Gauge.builder("sh_scrape_targets", targetsValue, AtomicInteger::doubleValue)
            .description("Number of targets in the last set handed to the scrape engine")
            .tags(tags)
            .register(meterRegistry));
        track(Gauge.builder("sh_scrape_engine_running", runningValue, AtomicInteger::doubleValue)
            .description("Whether the scrape engine background flow is alive (1) or not (0)")
            .tags(tags)
            .register(meterRegistry));
    }

    @Override
    public void configApplied() {
        applied.increment();
    }

    @Override
    public void configRejected(ScrapeConfigException.Stage stage) {
        rejected.get(stage).increment();
    }

    @Override
    public void reloadSignal(boolean coalesced) {
        (coalesced ? signalsCoalesced : signalsRaised).increment();
    }

    @Override
    public void targetsPropagated(int targetCount) {
        propagations.increment();
        targetsValue.set(targetCount);
    }

    @Override
    public void engineRunning(boolean running) {
        runningValue.set(running ? 1 : 0);
    }

    @Override
    public void close() {
        for (Meter meter : meters) {
            meterRegistry.remove(meter);
        }
        meters.clear();
    }

    private Counter updates(String outcome, String stage) {
        return track(Counter.builder("sh_scrape_config_updates")
            .description("Scrape configuration updates by outcome")
            .tags(tags)
            .tag("outcome", outcome)
            .tag("stage", stage)
            .register(meterRegistry));
    }

    private Counter signals(String outcome) {
        return track(Counter.builder("sh_scrape_reload_signals")
            .description("Target reload signals raised by configuration updates")
            .tags(tags)
            .tag("outcome", outcome)
            .register(meterRegistry));
    }

    private <M extends Meter> M track(M meter) {
        meters.add(meter);
        return meter;
    }
}
