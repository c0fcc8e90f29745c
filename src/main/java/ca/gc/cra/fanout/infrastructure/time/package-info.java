/**
 * Time adapters backing {@link ca.gc.cra.fanout.application.port.ClockPort}.
 */
package ca.gc.cra.fanout.infrastructure.time;
