package io.scrapehive.supervisor.runtime;

import io.scrapehive.supervisor.config.DiscoveryTarget;
import io.scrapehive.supervisor.config.ScrapeArguments;
import io.scrapehive.supervisor.config.ScrapeConfigBuilder;
import io.scrapehive.supervisor.config.ScrapeConfigException;
import io.scrapehive.supervisor.engine.EngineConfig;
import io.scrapehive.supervisor.engine.EngineConfigRejectedException;
import io.scrapehive.supervisor.engine.ScrapeEngineOptions;
import io.scrapehive.supervisor.engine.ScrapeJobConfig;
import io.scrapehive.supervisor.ports.MetricsPort;
import io.scrapehive.supervisor.ports.SampleFanout;
import io.scrapehive.supervisor.ports.ScrapeEngine;
import io.scrapehive.supervisor.ports.ScrapeEngineFactory;
import io.scrapehive.supervisor.ports.TargetSetChannel;
import io.scrapehive.supervisor.status.ScraperStatus;
import io.scrapehive.supervisor.status.StatusReporter;
import io.scrapehive.supervisor.targets.TargetGroup;
import io.scrapehive.supervisor.targets.TargetTranslator;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one scrape engine configured and fed with the current target list.
 * <p>
 * {@link #update(ScrapeArguments)} validates and applies a new configuration
 * synchronously under an exclusive lock, then raises a coalescing
 * {@link ReloadSignal}. The run loop wakes on that signal, translates the latest
 * target list and hands it to the engine. Updates arriving faster than the engine
 * consumes target sets collapse into one propagation of the most recent list.
 * <p>
 * The run loop is cancelled by interrupting the thread executing {@link #run()},
 * either directly or through {@link #stop()}, which reaches the loop whether it
 * was started with {@link #start()} or invoked on a caller's thread. The engine is
 * stopped before the loop returns, on every exit path, and by {@link #close()}.
 * <p>
 * A failure of the engine's own background flow is logged and leaves scraping
 * stopped; the supervisor keeps accepting updates but does not restart the engine.
 */
public final class ScrapeSupervisor implements SupervisorLifecycle, Runnable, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ScrapeSupervisor.class);

  private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(10);

  private final String instanceId;
  private final ScrapeEngine engine;
  private final SampleFanout fanout;
  private final MetricsPort metrics;
  private final StatusReporter statusReporter;

  private final ReloadSignal reloadTargets = new ReloadSignal();
  private final TargetSetChannel targetSets = new TargetSetChannel();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final AtomicBoolean runInvoked = new AtomicBoolean(false);
  private final AtomicBoolean engineStopped = new AtomicBoolean(false);
  private final AtomicBoolean scraping = new AtomicBoolean(false);
  private final AtomicReference<Thread> loopThread = new AtomicReference<>();
  private final CountDownLatch loopFinished = new CountDownLatch(1);

  private ScrapeArguments args;
  private volatile SupervisorState state = SupervisorState.INITIALIZING;

  private ExecutorService runExecutor;
  private Future<?> runFuture;

  /**
   * Create the engine and apply {@code args} once, so the supervisor is consistent
   * with its initial arguments before anyone can observe it.
   *
   * @throws ScrapeConfigException when the initial arguments are rejected; the engine is stopped
   */
  public ScrapeSupervisor(String instanceId,
                          ScrapeArguments args,
                          ScrapeEngineFactory engineFactory,
                          SampleFanout fanout,
                          MetricsPort metrics) {
    this.instanceId = requireText(instanceId, "instanceId");
    Objects.requireNonNull(args, "args");
    Objects.requireNonNull(engineFactory, "engineFactory");
    this.fanout = Objects.requireNonNull(fanout, "fanout");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.fanout.setReceivers(args.forwardTo());
    ScrapeEngineOptions options = new ScrapeEngineOptions(args.extraMetrics(), UserAgent.value());
    this.engine = Objects.requireNonNull(engineFactory.create(options, fanout), "engineFactory returned null");
    this.statusReporter = new StatusReporter(engine);
    try {
      update(args);
    } catch (ScrapeConfigException ex) {
      stopEngine();
      state = SupervisorState.STOPPED;
      throw ex;
    }
    state = SupervisorState.RUNNING;
  }

  public ScrapeSupervisor(String instanceId,
                          ScrapeArguments args,
                          ScrapeEngineFactory engineFactory,
                          SampleFanout fanout) {
    this(instanceId, args, engineFactory, fanout, MetricsPort.noop());
  }

  public String instanceId() {
    return instanceId;
  }

  /**
   * Replace the configuration. Either everything is applied or nothing is: on
   * failure the previous arguments and engine configuration stay in effect.
   * Never waits for the run loop.
   *
   * @throws ScrapeConfigException when the arguments cannot be built or the engine rejects them
   * @throws IllegalStateException when the supervisor is stopped
   */
  @Override
  public void update(ScrapeArguments newArgs) {
    Objects.requireNonNull(newArgs, "args");
    lock.writeLock().lock();
    try {
      if (state == SupervisorState.STOPPED) {
        throw new IllegalStateException("Scrape supervisor " + instanceId + " is stopped");
      }
      ScrapeJobConfig jobConfig;
      try {
        jobConfig = ScrapeConfigBuilder.build(instanceId, newArgs);
      } catch (ScrapeConfigException ex) {
        metrics.configRejected(ex.stage());
        throw ex;
      }
      try {
        engine.applyConfig(EngineConfig.of(jobConfig));
      } catch (EngineConfigRejectedException ex) {
        metrics.configRejected(ScrapeConfigException.Stage.APPLY);
        throw new ScrapeConfigException(ScrapeConfigException.Stage.APPLY,
            "error applying scrape configs: " + ex.getMessage(), ex);
      }
      fanout.setReceivers(newArgs.forwardTo());
      args = newArgs;
      metrics.configApplied();
      log.debug("scrape config was updated (instance={} job={} targets={})",
          instanceId, jobConfig.jobName(), newArgs.targets().size());
    } finally {
      lock.writeLock().unlock();
    }
    metrics.reloadSignal(!reloadTargets.raise());
  }

  /**
   * Run loop. Blocks until the calling thread is interrupted, then stops the
   * engine and returns. May be invoked at most once.
   */
  @Override
  public void run() {
    if (!runInvoked.compareAndSet(false, true)) {
      throw new IllegalStateException("Scrape supervisor " + instanceId + " run loop was already started");
    }
    loopThread.set(Thread.currentThread());
    try {
      if (state != SupervisorState.STOPPED) {
        runLoop();
      }
    } finally {
      loopThread.set(null);
      loopFinished.countDown();
    }
  }

  private void runLoop() {
    startEngine();
    log.info("Scrape supervisor {} started", instanceId);
    try {
      while (!Thread.currentThread().isInterrupted()) {
        reloadTargets.await();
        propagateTargets();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      markStopped();
      stopEngine();
      log.info("Scrape supervisor {} stopped", instanceId);
    }
  }

  @Override
  public synchronized void start() {
    if (runFuture != null) {
      return;
    }
    if (state == SupervisorState.STOPPED) {
      throw new IllegalStateException("Scrape supervisor " + instanceId + " is stopped");
    }
    runExecutor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "scrape-supervisor-" + instanceId);
      thread.setDaemon(true);
      return thread;
    });
    runFuture = runExecutor.submit(this);
  }

  @Override
  public void stop() {
    stop(DEFAULT_STOP_TIMEOUT);
  }

  /**
   * Cancel the run loop and wait for it to finish, then stop the engine. Works for
   * a loop started by {@link #start()} and for one running {@link #run()} on a
   * caller's thread. Stops the engine even if the loop never got to run.
   */
  public synchronized void stop(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    markStopped();
    if (runFuture != null) {
      runFuture.cancel(true);
      runExecutor.shutdownNow();
    }
    Thread loop = loopThread.get();
    if (loop != null && loop != Thread.currentThread()) {
      loop.interrupt();
    }
    if (runInvoked.get() && loop != Thread.currentThread()) {
      try {
        if (!loopFinished.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Scrape supervisor {} run loop did not stop within {}", instanceId, timeout);
          return;
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
    }
    stopEngine();
  }

  /**
   * Same as {@link #stop()}; lets containers release the engine even when the
   * supervisor was never started.
   */
  @Override
  public void close() {
    stop();
  }

  @Override
  public SupervisorState getState() {
    return state;
  }

  @Override
  public ScrapeArguments currentArguments() {
    lock.readLock().lock();
    try {
      return args;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public ScraperStatus status() {
    return statusReporter.status();
  }

  @Override
  public boolean isScraping() {
    return scraping.get();
  }

  private void propagateTargets() throws InterruptedException {
    List<DiscoveryTarget> targets;
    lock.readLock().lock();
    try {
      targets = args.targets();
    } finally {
      lock.readLock().unlock();
    }
    Map<String, List<TargetGroup>> targetGroups = TargetTranslator.translate(instanceId, targets);
    try {
      targetSets.send(targetGroups);
    } catch (InterruptedException ex) {
      log.debug("Scrape supervisor {} abandoned target hand-off on shutdown", instanceId);
      throw ex;
    }
    metrics.targetsPropagated(targets.size());
    log.debug("passed new targets to scrape manager (instance={} targets={})", instanceId, targets.size());
  }

  private void startEngine() {
    Thread thread = new Thread(this::runEngine, "scrape-engine-" + instanceId);
    thread.setDaemon(true);
    scraping.set(true);
    metrics.engineRunning(true);
    thread.start();
  }

  private void runEngine() {
    try {
      engine.run(targetSets);
      log.info("scrape manager stopped (instance={})", instanceId);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("scrape manager stopped (instance={})", instanceId);
    } catch (Exception ex) {
      log.info("scrape manager stopped (instance={})", instanceId);
      log.error("scrape manager failed (instance={})", instanceId, ex);
    } finally {
      metrics.engineRunning(false);
      scraping.set(false);
    }
  }

  private void markStopped() {
    lock.writeLock().lock();
    try {
      state = SupervisorState.STOPPED;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void stopEngine() {
    if (!engineStopped.compareAndSet(false, true)) {
      return;
    }
    try {
      engine.stop();
    } catch (RuntimeException ex) {
      log.warn("Scrape supervisor {} failed to stop engine cleanly", instanceId, ex);
    }
  }

  private static String requireText(String value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
    return trimmed;
  }
}
