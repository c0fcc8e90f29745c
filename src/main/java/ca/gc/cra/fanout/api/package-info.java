/**
 * Command-line entry points for the fan-out executor.
 * <p><strong>Role:</strong> Driving adapters that parse {@code key=value} arguments, build a validated
 * configuration, run the dispatcher, and translate outcomes into {@link ca.gc.cra.fanout.api.ExitCode}s.</p>
 * <p><strong>Streams:</strong> Report lines, usage text, and plans go to stdout; logs go to stderr.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fanout.api;
