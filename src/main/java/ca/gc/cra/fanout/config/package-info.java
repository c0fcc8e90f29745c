/**
 * Configuration loading and wiring for the fan-out CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments, then the YAML file named by {@code config=}, then
 * the embedded defaults in {@link ca.gc.cra.fanout.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Runs once on the CLI thread before any worker starts.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fanout.config;
