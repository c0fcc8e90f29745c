/**
 * Jobs, script snapshots, and per-host execution results exchanged by the dispatcher, executor, and reporter.
 * <p><strong>Role:</strong> Domain layer value objects; free of infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Every type is immutable once built and may cross worker threads freely.</p>
 * <p><strong>Security:</strong> {@link ca.gc.cra.fanout.domain.job.ScriptBody} and captured output may carry
 * operational secrets; log them only through {@code Logs.truncate} at DEBUG.</p>
 */
package ca.gc.cra.fanout.domain.job;
