package ca.gc.cra.fanout.application.dispatch;

import ca.gc.cra.fanout.domain.job.Job;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Shared, thread-safe source of pending jobs, drained by workers until empty.
 *
 * <p>The queue is filled once, in host-list order, before any worker starts; it never grows afterwards. Each job
 * is handed to exactly one caller of {@link #poll()}.</p>
 *
 * @since 0.1.0
 */
public final class JobQueue {
  private final BlockingQueue<Job> pending;
  private final int total;

  /**
   * Creates a queue holding {@code jobs} in iteration order.
   *
   * @param jobs jobs to hand out; must not contain {@code null}
   */
  public JobQueue(List<Job> jobs) {
    Objects.requireNonNull(jobs, "jobs");
    this.total = jobs.size();
    this.pending = new ArrayBlockingQueue<>(Math.max(1, total), true, jobs);
  }

  /**
   * Takes the next job without blocking.
   *
   * @return next job, or empty once the queue is drained
   */
  public Optional<Job> poll() {
    return Optional.ofNullable(pending.poll());
  }

  public int remaining() {
    return pending.size();
  }

  public int total() {
    return total;
  }

  /**
   * Removes every job not yet handed out; used when the run is cancelled.
   *
   * @return jobs that will never run
   */
  public List<Job> drainRemaining() {
    List<Job> abandoned = new ArrayList<>(pending.size());
    pending.drainTo(abandoned);
    return abandoned;
  }
}
