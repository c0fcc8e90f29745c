package ca.gc.cra.fanout.infrastructure.report;

import ca.gc.cra.fanout.application.port.ResultReporter;
import ca.gc.cra.fanout.domain.job.ExecutionResult;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <strong>What:</strong> Writes one {@code host<separator>output} line per result.
 * <p><strong>Why:</strong> Keeps the familiar {@code host, output} report shape while guaranteeing that lines from
 * concurrent workers never interleave.</p>
 * <p><strong>Format:</strong> success lines carry the flattened output; failure lines carry
 * {@code Kind: detail}, followed by {@code (output: ...)} when the host printed anything before failing.</p>
 * <p><strong>Thread-safety:</strong> Each line, terminator included, is encoded up front and written with a single
 * call while holding the lock, then flushed.</p>
 *
 * @since 0.1.0
 */
public final class LineReportWriter implements ResultReporter {
  /** Separator used when none is configured. */
  public static final String DEFAULT_SEPARATOR = ", ";

  private final OutputStream out;
  private final String separator;
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Creates a writer.
   *
   * @param out destination stream; not closed by this writer
   * @param separator text between host and output; {@code null} selects {@link #DEFAULT_SEPARATOR}
   */
  public LineReportWriter(OutputStream out, String separator) {
    this.out = Objects.requireNonNull(out, "out");
    this.separator = separator == null ? DEFAULT_SEPARATOR : separator;
  }

  @Override
  public void report(ExecutionResult result) {
    byte[] line = (format(result, separator) + "\n").getBytes(StandardCharsets.UTF_8);
    lock.lock();
    try {
      out.write(line);
      out.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to write report line for " + result.host(), ex);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Renders one result without the line terminator.
   *
   * @param result result to render
   * @param separator text between host and output
   * @return single-line rendering
   */
  public static String format(ExecutionResult result, String separator) {
    StringBuilder line = new StringBuilder(result.host().length() + result.output().length() + 32);
    line.append(result.host()).append(separator);
    if (result.succeeded()) {
      return line.append(result.output()).toString();
    }
    line.append(result.failureKind().label());
    if (!result.detail().isEmpty()) {
      line.append(": ").append(result.detail());
    }
    if (!result.output().isEmpty()) {
      line.append(" (output: ").append(result.output()).append(')');
    }
    return line.toString();
  }
}
