/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound captured output before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from worker threads.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; all log output goes to stderr so stdout stays
 * reserved for the report.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fanout.logging;
