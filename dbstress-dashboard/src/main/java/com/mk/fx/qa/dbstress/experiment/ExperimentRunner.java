package com.mk.fx.qa.dbstress.experiment;

import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.error.ExperimentAlreadyRunningException;
import com.mk.fx.qa.dbstress.model.Sample;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one A/B comparison at a time.
 *
 * <p>Phases are strictly sequential: warm-up A, measurement A, warm-up B, measurement B. The two
 * variants never load the database at the same time, so neither measurement is skewed by the
 * other's contention. The engine follows the same schedule after {@link
 * EngineGateway#runExperiment} and pushes one sample per second tagged with the variant it is
 * driving. Only samples for the current variant that arrive during its measurement phase are
 * kept; everything else counts as discarded.
 *
 * <p>Stopping is best-effort: the phase timer notices the request within one sleep chunk and the
 * run finishes with status {@link ExperimentPhase#STOPPED} and the samples gathered so far.
 */
@Slf4j
public class ExperimentRunner implements AutoCloseable {

  private final EngineGateway gateway;
  private final PhaseTimer timer;
  private final Clock clock;
  private final ExecutorService executor;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final AtomicReference<ExperimentResult> lastResult = new AtomicReference<>();

  // guarded by this
  private final Map<VariantId, List<Sample>> samples = new EnumMap<>(VariantId.class);
  private ExperimentPhase phase = ExperimentPhase.IDLE;
  private VariantId currentVariant;
  private long discarded;

  public ExperimentRunner(EngineGateway gateway, PhaseTimer timer, Clock clock) {
    this.gateway = gateway;
    this.timer = timer;
    this.clock = clock;
    this.executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("experiment-runner");
              t.setDaemon(true);
              return t;
            });
  }

  /**
   * Starts a run and returns a future completing with its result.
   *
   * @throws ExperimentAlreadyRunningException if a run is in progress
   * @throws IllegalStateException if the runner has been closed
   */
  public CompletableFuture<ExperimentResult> run(ExperimentConfig config) {
    if (!running.compareAndSet(false, true)) {
      throw new ExperimentAlreadyRunningException();
    }
    if (executor.isShutdown()) {
      running.set(false);
      throw new IllegalStateException("Experiment runner is closed");
    }
    stopRequested.set(false);
    synchronized (this) {
      samples.clear();
      for (var id : VariantId.values()) {
        samples.put(id, new ArrayList<>());
      }
      discarded = 0;
      phase = ExperimentPhase.IDLE;
      currentVariant = null;
    }

    var startedAt = clock.instant();
    try {
      gateway.runExperiment(config);
    } catch (RuntimeException ex) {
      running.set(false);
      throw ex;
    }
    log.info(
        "Experiment started: A={} B={} warmup={}s measurement={}s",
        config.variantA().label(),
        config.variantB().label(),
        config.warmupSeconds(),
        config.measurementSeconds());
    try {
      return CompletableFuture.supplyAsync(() -> execute(config, startedAt), executor);
    } catch (RejectedExecutionException ex) {
      running.set(false);
      log.warn("Experiment could not be scheduled, runner is closed");
      throw new IllegalStateException("Experiment runner is closed", ex);
    }
  }

  /**
   * Requests the running experiment to stop.
   *
   * @return false when no experiment was running
   */
  public boolean stop() {
    if (!running.get()) {
      return false;
    }
    stopRequested.set(true);
    log.info("Experiment stop requested");
    gateway.stopExperiment();
    return true;
  }

  /**
   * Offers a sample pushed by the engine.
   *
   * @return true when the sample was kept for the measurement
   */
  public synchronized boolean recordSample(VariantId variant, Sample sample) {
    if (phase != ExperimentPhase.MEASUREMENT || variant != currentVariant) {
      discarded++;
      log.debug("Experiment sample for {} discarded during {} of {}", variant, phase, currentVariant);
      return false;
    }
    samples.get(variant).add(sample);
    return true;
  }

  public Optional<ExperimentResult> experimentResult() {
    return Optional.ofNullable(lastResult.get());
  }

  public synchronized ExperimentStatus status() {
    return new ExperimentStatus(
        running.get(),
        phase,
        currentVariant,
        samples.getOrDefault(VariantId.A, List.of()).size(),
        samples.getOrDefault(VariantId.B, List.of()).size(),
        discarded);
  }

  public synchronized ExperimentPhase phase() {
    return phase;
  }

  public boolean isRunning() {
    return running.get();
  }

  private ExperimentResult execute(ExperimentConfig config, Instant startedAt) {
    var status = ExperimentPhase.COMPLETED;
    try {
      for (var variant : VariantId.values()) {
        enterPhase(variant, ExperimentPhase.WARMUP);
        timer.await(config.warmup(), stopRequested::get);
        enterPhase(variant, ExperimentPhase.MEASUREMENT);
        timer.await(config.measurement(), stopRequested::get);
      }
    } catch (InterruptedException interrupted) {
      status = ExperimentPhase.STOPPED;
      if (!stopRequested.get()) {
        Thread.currentThread().interrupt();
      }
    } catch (RuntimeException ex) {
      log.error("Experiment aborted: {}", ex.getMessage(), ex);
      status = ExperimentPhase.STOPPED;
    }

    List<Sample> a;
    List<Sample> b;
    synchronized (this) {
      phase = status;
      currentVariant = null;
      a = List.copyOf(samples.get(VariantId.A));
      b = List.copyOf(samples.get(VariantId.B));
    }

    var result = ExperimentReducer.reduce(config, a, b, status, startedAt, clock.instant());
    lastResult.set(result);
    running.set(false);
    log.info(
        "Experiment {}: meanTps A={} B={} throughputWinner={}",
        status,
        String.format("%.2f", result.variantA().meanThroughput()),
        String.format("%.2f", result.variantB().meanThroughput()),
        result.comparison().throughputWinner());
    return result;
  }

  private synchronized void enterPhase(VariantId variant, ExperimentPhase next) {
    currentVariant = variant;
    phase = next;
    log.info("Experiment variant {} entering {}", variant, next);
  }

  @Override
  public void close() {
    stopRequested.set(true);
    executor.shutdownNow();
    try {
      executor.awaitTermination(2, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }
}
