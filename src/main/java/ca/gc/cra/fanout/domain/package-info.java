/**
 * Core domain model for fanning one script out to many remote hosts.
 * <p><strong>Role:</strong> Domain layer aggregates describing host sets, jobs, and results without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across worker threads.</p>
 * <p><strong>Metrics:</strong> Result attributes feed tagging on {@code fanout.host.*} metrics.</p>
 */
package ca.gc.cra.fanout.domain;
