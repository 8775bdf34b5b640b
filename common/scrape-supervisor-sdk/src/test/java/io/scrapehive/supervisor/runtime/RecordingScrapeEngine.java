package io.scrapehive.supervisor.runtime;

import io.scrapehive.supervisor.engine.EngineConfig;
import io.scrapehive.supervisor.engine.EngineConfigRejectedException;
import io.scrapehive.supervisor.engine.ScrapeEngineOptions;
import io.scrapehive.supervisor.engine.ScrapeJobConfig;
import io.scrapehive.supervisor.ports.ActiveTarget;
import io.scrapehive.supervisor.ports.SampleFanout;
import io.scrapehive.supervisor.ports.ScrapeEngine;
import io.scrapehive.supervisor.ports.ScrapeEngineFactory;
import io.scrapehive.supervisor.ports.TargetSetChannel;
import io.scrapehive.supervisor.status.TargetHealth;
import io.scrapehive.supervisor.targets.TargetGroup;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory engine that records everything the supervisor hands it and keeps a
 * registry of never-scraped targets built from the last received target set.
 */
final class RecordingScrapeEngine implements ScrapeEngine, ScrapeEngineFactory {

  final List<EngineConfig> applied = new CopyOnWriteArrayList<>();
  final BlockingQueue<Map<String, List<TargetGroup>>> received = new LinkedBlockingQueue<>();
  final AtomicInteger stopCalls = new AtomicInteger();
  final AtomicInteger appliedAfterStop = new AtomicInteger();
  final CountDownLatch runStarted = new CountDownLatch(1);

  volatile boolean consuming = true;
  volatile Exception runFailure;
  volatile EngineConfigRejectedException rejectNext;
  volatile TargetSetChannel channel;
  volatile ScrapeEngineOptions options;
  volatile SampleFanout fanout;

  private final CountDownLatch stopped = new CountDownLatch(1);
  private final Map<String, List<ActiveTarget>> active = new ConcurrentHashMap<>();
  private volatile ScrapeJobConfig job;

  @Override
  public ScrapeEngine create(ScrapeEngineOptions options, SampleFanout fanout) {
    this.options = options;
    this.fanout = fanout;
    return this;
  }

  @Override
  public void applyConfig(EngineConfig config) throws EngineConfigRejectedException {
    EngineConfigRejectedException rejection = rejectNext;
    if (rejection != null) {
      rejectNext = null;
      throw rejection;
    }
    config.validate();
    if (stopped.getCount() == 0) {
      appliedAfterStop.incrementAndGet();
    }
    applied.add(config);
    job = config.scrapeConfigs().get(0);
  }

  @Override
  public void run(TargetSetChannel targetSets) throws Exception {
    channel = targetSets;
    runStarted.countDown();
    if (runFailure != null) {
      throw runFailure;
    }
    while (!stopped.await(0, TimeUnit.MILLISECONDS)) {
      if (!consuming) {
        stopped.await(10, TimeUnit.MILLISECONDS);
        continue;
      }
      Map<String, List<TargetGroup>> sets = targetSets.poll(10, TimeUnit.MILLISECONDS);
      if (sets != null) {
        sync(sets);
        received.add(sets);
      }
    }
  }

  @Override
  public Map<String, List<ActiveTarget>> activeTargets() {
    return Map.copyOf(active);
  }

  @Override
  public void stop() {
    stopCalls.incrementAndGet();
    stopped.countDown();
  }

  Map<String, List<TargetGroup>> awaitTargetSet() throws InterruptedException {
    return received.poll(5, TimeUnit.SECONDS);
  }

  ScrapeJobConfig lastApplied() {
    return applied.get(applied.size() - 1).scrapeConfigs().get(0);
  }

  private void sync(Map<String, List<TargetGroup>> sets) {
    ScrapeJobConfig current = job;
    active.clear();
    sets.forEach((setName, groups) -> {
      List<ActiveTarget> targets = new ArrayList<>();
      for (TargetGroup group : groups) {
        for (Map<String, String> labels : group.targets()) {
          String url = current.scheme() + "://" + labels.get("__address__") + current.metricsPath();
          targets.add(new PendingTarget(url, labels));
        }
      }
      active.put(current.jobName(), targets);
    });
  }

  private record PendingTarget(String url, Map<String, String> labels) implements ActiveTarget {

    @Override
    public TargetHealth health() {
      return TargetHealth.UNKNOWN;
    }

    @Override
    public String lastError() {
      return null;
    }

    @Override
    public Instant lastScrape() {
      return null;
    }

    @Override
    public Duration lastScrapeDuration() {
      return null;
    }
  }
}
