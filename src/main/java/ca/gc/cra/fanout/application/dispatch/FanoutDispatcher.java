package ca.gc.cra.fanout.application.dispatch;

import ca.gc.cra.fanout.application.port.ClockPort;
import ca.gc.cra.fanout.application.port.MetricsPort;
import ca.gc.cra.fanout.application.port.ResultReporter;
import ca.gc.cra.fanout.domain.job.DispatchSummary;
import ca.gc.cra.fanout.domain.job.ExecutionResult;
import ca.gc.cra.fanout.domain.job.FailureKind;
import ca.gc.cra.fanout.domain.job.Job;
import ca.gc.cra.fanout.domain.job.ScriptBody;
import ca.gc.cra.fanout.domain.job.WorkerPoolConfig;
import ca.gc.cra.fanout.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fans one script out to a host list over a bounded pool of workers.
 * <p><strong>Why:</strong> Replaces process-per-host fan-out with an explicit worker budget, a shared job queue,
 * and a single result sink, so every host is accounted for exactly once.</p>
 * <p><strong>Role:</strong> Application-layer use case driven by the CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Validate the worker budget before any job exists.</li>
 *   <li>Build one immutable {@link Job} per host, in host-list order, and queue them.</li>
 *   <li>Start {@code min(concurrency, hosts)} workers; each pulls a job, runs it, and reports the result.</li>
 *   <li>Block until every worker has exited, then summarise the run.</li>
 *   <li>On cancellation, stop handing out jobs, interrupt in-flight sessions, and return a partial summary.</li>
 * </ul>
 * <p><strong>Ordering:</strong> Jobs start in host-list order; results are reported in completion order.</p>
 * <p><strong>Thread-safety:</strong> {@link #dispatch} runs one batch at a time; {@link #cancel()} may be called
 * from any thread, including a JVM shutdown hook.</p>
 *
 * @since 0.1.0
 */
public final class FanoutDispatcher {
  private static final Logger log = LoggerFactory.getLogger(FanoutDispatcher.class);
  private static final String MDC_HOST = "host";
  private static final long CANCEL_GRACE_MILLIS = 5_000L;

  private final RemoteExecutor executor;
  private final ResultReporter reporter;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicReference<Thread> runThread = new AtomicReference<>();
  private final AtomicReference<ExecutorService> activePool = new AtomicReference<>();
  private volatile CountDownLatch finished = new CountDownLatch(0);

  /**
   * Creates a dispatcher.
   *
   * @param executor per-host executor; must not be {@code null}
   * @param reporter sink receiving each result; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   * @param clock clock for run duration; must not be {@code null}
   */
  public FanoutDispatcher(
      RemoteExecutor executor, ResultReporter reporter, MetricsPort metrics, ClockPort clock) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Dispatches with the default connect timeout and no command timeout.
   *
   * @param hosts ordered host list
   * @param script script snapshot
   * @param jumpbox optional jump host applied to every job
   * @param concurrency worker budget
   * @return run summary
   * @throws ca.gc.cra.fanout.domain.job.InvalidConcurrencyException if {@code concurrency < 1}; nothing is started
   */
  public DispatchSummary dispatch(
      List<String> hosts, ScriptBody script, Optional<String> jumpbox, int concurrency) {
    return dispatch(hosts, script, jumpbox,
        WorkerPoolConfig.of(concurrency, WorkerPoolConfig.DEFAULT_CONNECT_TIMEOUT_SECONDS));
  }

  /**
   * Runs {@code script} on every host and blocks until all workers have exited.
   *
   * @param hosts ordered host list; duplicates run as independent jobs
   * @param script script snapshot shared by every job
   * @param jumpbox optional jump host applied to every job
   * @param config worker budget and time bounds, already validated
   * @return run summary; {@link DispatchSummary#cancelled()} is set when the run was cut short
   * @throws IllegalStateException if another dispatch is in progress on this instance, or a worker died before
   *     every host was reported
   */
  public DispatchSummary dispatch(
      List<String> hosts, ScriptBody script, Optional<String> jumpbox, WorkerPoolConfig config) {
    Objects.requireNonNull(hosts, "hosts");
    Objects.requireNonNull(script, "script");
    Objects.requireNonNull(jumpbox, "jumpbox");
    Objects.requireNonNull(config, "config");
    if (!runThread.compareAndSet(null, Thread.currentThread())) {
      throw new IllegalStateException("dispatch already running");
    }
    CountDownLatch done = new CountDownLatch(1);
    finished = done;
    cancelled.set(false);
    try {
      return runBatch(hosts, script, jumpbox, config);
    } finally {
      activePool.set(null);
      runThread.set(null);
      done.countDown();
    }
  }

  /**
   * Requests cooperative cancellation of the running batch. Queued hosts are not started and in-flight sessions
   * are interrupted. Idempotent.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    metrics.increment("fanout.dispatch.cancelled");
    ExecutorService pool = activePool.get();
    if (pool != null) {
      log.warn("Cancellation requested; interrupting in-flight sessions");
      pool.shutdownNow();
    }
  }

  /**
   * Waits for a running batch to return.
   *
   * @param timeout maximum wait
   * @return {@code true} if no batch is running anymore
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitCompletion(Duration timeout) throws InterruptedException {
    return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  private DispatchSummary runBatch(
      List<String> hosts, ScriptBody script, Optional<String> jumpbox, WorkerPoolConfig config) {
    if (hosts.isEmpty()) {
      log.info("No hosts to dispatch");
      return DispatchSummary.empty();
    }
    List<Job> jobs = new ArrayList<>(hosts.size());
    for (String host : hosts) {
      jobs.add(new Job(host, script, jumpbox));
    }
    JobQueue queue = new JobQueue(jobs);
    int workers = Math.min(config.concurrency(), jobs.size());
    Tally tally = new Tally();
    AtomicReference<Throwable> workerFailure = new AtomicReference<>();

    long start = clock.nowMillis();
    metrics.increment("fanout.dispatch.started");
    log.info("Dispatching {} to {} hosts with {} workers{}",
        script, jobs.size(), workers, jumpbox.map(hop -> " via " + hop).orElse(""));

    ExecutorService pool = ExecutorFactories.newWorkerPool(workers, "fanout-worker",
        (thread, ex) -> log.error("Worker {} terminated unexpectedly", thread.getName(), ex));
    activePool.set(pool);
    if (cancelled.get()) {
      pool.shutdownNow();
    }
    try {
      for (int i = 0; i < workers && !pool.isShutdown(); i++) {
        pool.execute(new Worker(queue, config, tally, workerFailure));
      }
    } finally {
      pool.shutdown();
    }
    awaitWorkers(pool);

    List<Job> abandoned = queue.drainRemaining();
    boolean wasCancelled = cancelled.get();
    long elapsed = clock.nowMillis() - start;
    DispatchSummary summary = new DispatchSummary(
        jobs.size(), tally.succeeded(), tally.failuresByKind(), wasCancelled, elapsed);
    if (wasCancelled) {
      log.warn("Dispatch cancelled after {} ms: {} succeeded, {} failed, {} not attempted ({} never started)",
          elapsed, summary.succeeded(), summary.failed(), summary.notAttempted(), abandoned.size());
    } else {
      log.info("Dispatch finished in {} ms: {} hosts, {} succeeded, {} failed",
          elapsed, summary.dispatched(), summary.succeeded(), summary.failed());
    }
    Throwable failure = workerFailure.get();
    if (failure != null) {
      throw new IllegalStateException("worker failed before every host was reported", failure);
    }
    return summary;
  }

  private void awaitWorkers(ExecutorService pool) {
    try {
      while (!pool.awaitTermination(1, TimeUnit.SECONDS)) {
        log.debug("Waiting for workers to finish");
      }
    } catch (InterruptedException ex) {
      log.warn("Dispatch interrupted; cancelling remaining hosts");
      cancel();
      try {
        if (!pool.awaitTermination(CANCEL_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
          log.warn("Workers still active {} ms after cancellation; returning partial results",
              CANCEL_GRACE_MILLIS);
        }
      } catch (InterruptedException again) {
        log.debug("Interrupted again while waiting for cancelled workers", again);
      } finally {
        Thread.currentThread().interrupt();
      }
    }
  }

  private final class Worker implements Runnable {
    private final JobQueue queue;
    private final WorkerPoolConfig config;
    private final Tally tally;
    private final AtomicReference<Throwable> failure;

    private Worker(
        JobQueue queue,
        WorkerPoolConfig config,
        Tally tally,
        AtomicReference<Throwable> failure) {
      this.queue = queue;
      this.config = config;
      this.tally = tally;
      this.failure = failure;
    }

    @Override
    public void run() {
      while (!cancelled.get() && !Thread.currentThread().isInterrupted()) {
        Optional<Job> next = queue.poll();
        if (next.isEmpty()) {
          return;
        }
        Job job = next.get();
        String previousHost = MDC.get(MDC_HOST);
        try {
          MDC.put(MDC_HOST, job.host());
          ExecutionResult result = executor.execute(job, config.connectTimeout());
          reporter.report(result);
          tally.record(result);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          log.info("Worker interrupted; abandoning session to {}", job.host());
          return;
        } catch (Throwable ex) {
          failure.compareAndSet(null, ex);
          log.error("Worker failed on {}; cancelling run", job.host(), ex);
          cancel();
          return;
        } finally {
          if (previousHost == null) {
            MDC.remove(MDC_HOST);
          } else {
            MDC.put(MDC_HOST, previousHost);
          }
        }
      }
    }
  }

  private static final class Tally {
    private final AtomicInteger succeeded = new AtomicInteger();
    private final AtomicIntegerArray failures = new AtomicIntegerArray(FailureKind.values().length);

    void record(ExecutionResult result) {
      if (result.succeeded()) {
        succeeded.incrementAndGet();
      } else {
        failures.incrementAndGet(result.failureKind().ordinal());
      }
    }

    int succeeded() {
      return succeeded.get();
    }

    Map<FailureKind, Integer> failuresByKind() {
      Map<FailureKind, Integer> map = new EnumMap<>(FailureKind.class);
      for (FailureKind kind : FailureKind.values()) {
        int count = failures.get(kind.ordinal());
        if (count > 0) {
          map.put(kind, count);
        }
      }
      return map;
    }
  }
}
