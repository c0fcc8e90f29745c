/**
 * Host set expansion: brace-style patterns turned into ordered host lists.
 * <p><strong>Role:</strong> Domain layer; no network access and no concurrency.</p>
 * <p><strong>Concurrency:</strong> Parsed patterns are immutable and safe to share.</p>
 */
package ca.gc.cra.fanout.domain.host;
