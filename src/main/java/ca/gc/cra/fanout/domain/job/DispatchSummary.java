package ca.gc.cra.fanout.domain.job;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Totals for a finished (or cancelled) run.
 *
 * @param dispatched hosts handed to the job queue
 * @param succeeded hosts that reported success
 * @param failuresByKind failed host counts keyed by failure class
 * @param cancelled {@code true} when the run was cut short by cancellation
 * @param elapsedMillis wall-clock duration of the dispatch
 * @since 0.1.0
 */
public record DispatchSummary(
    int dispatched,
    int succeeded,
    Map<FailureKind, Integer> failuresByKind,
    boolean cancelled,
    long elapsedMillis) {

  public DispatchSummary {
    Objects.requireNonNull(failuresByKind, "failuresByKind");
    EnumMap<FailureKind, Integer> copy = new EnumMap<>(FailureKind.class);
    copy.putAll(failuresByKind);
    failuresByKind = Map.copyOf(copy);
  }

  /**
   * Summary for a run that had no hosts to dispatch.
   *
   * @return empty summary
   */
  public static DispatchSummary empty() {
    return new DispatchSummary(0, 0, Map.of(), false, 0L);
  }

  public int failed() {
    int total = 0;
    for (int count : failuresByKind.values()) {
      total += count;
    }
    return total;
  }

  /**
   * Hosts that never produced a result; non-zero when the run was cancelled or a worker died.
   *
   * @return count of hosts left unattempted or abandoned
   */
  public int notAttempted() {
    return Math.max(0, dispatched - succeeded - failed());
  }

  /**
   * Indicates whether every dispatched host reported success.
   *
   * @return {@code true} when nothing failed and nothing was left behind
   */
  public boolean allSucceeded() {
    return !cancelled && succeeded == dispatched;
  }
}
