package ca.gc.cra.fanout.domain.job;

/** Terminal status of one host's execution. */
public enum ExecutionStatus {
  SUCCESS,
  FAILURE
}
