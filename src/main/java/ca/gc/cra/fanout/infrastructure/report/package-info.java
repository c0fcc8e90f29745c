/**
 * Report writers that put exactly one line per host on the report stream.
 * <p><strong>Concurrency:</strong> Writers serialize whole lines under a lock; output is flushed per line so a
 * cancelled run still shows every result reported so far.</p>
 */
package ca.gc.cra.fanout.infrastructure.report;
