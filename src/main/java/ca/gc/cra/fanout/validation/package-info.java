/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p><strong>Role:</strong> Rejects invalid hosts, timeouts, and paths before any ssh client is spawned.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.</p>
 * <p><strong>Security:</strong> Destinations that would be parsed as ssh options (leading {@code -}) are rejected.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fanout.validation;
