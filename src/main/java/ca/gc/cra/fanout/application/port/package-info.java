/**
 * Ports connecting the fan-out use case to remote shells, report sinks, metrics, and time.
 * <p><strong>Role:</strong> Application-layer contracts implemented by infrastructure adapters.</p>
 * <p><strong>Concurrency:</strong> Every port is invoked from worker threads; implementations document their
 * thread-safety.</p>
 */
package ca.gc.cra.fanout.application.port;
