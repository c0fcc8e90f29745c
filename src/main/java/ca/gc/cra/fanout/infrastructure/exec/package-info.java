/**
 * Executor factories for the bounded worker pool.
 * <p><strong>Concurrency:</strong> Pools are fixed-size with non-daemon threads so shutdown waits for in-flight
 * hosts to report.</p>
 */
package ca.gc.cra.fanout.infrastructure.exec;
