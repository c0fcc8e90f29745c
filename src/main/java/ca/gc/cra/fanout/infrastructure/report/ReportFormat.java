package ca.gc.cra.fanout.infrastructure.report;

import ca.gc.cra.fanout.application.port.ResultReporter;
import java.io.OutputStream;
import java.util.Locale;

/**
 * Report line encodings selectable with {@code format=}.
 *
 * @since 0.1.0
 */
public enum ReportFormat {
  /** {@code host<separator>output} lines. */
  TEXT,
  /** One JSON object per line. */
  NDJSON;

  /**
   * Parses a case-insensitive format name.
   *
   * @param raw format name
   * @return matching format
   * @throws IllegalArgumentException if {@code raw} names no format
   */
  public static ReportFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("format must be 'text' or 'ndjson'");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> TEXT;
      case "ndjson", "json" -> NDJSON;
      default -> throw new IllegalArgumentException("format must be 'text' or 'ndjson' (was '" + raw + "')");
    };
  }

  /**
   * Creates a reporter writing this format to {@code out}.
   *
   * @param out report stream, usually stdout
   * @param separator text separator between host and output; ignored for NDJSON
   * @return thread-safe reporter
   */
  public ResultReporter open(OutputStream out, String separator) {
    return switch (this) {
      case TEXT -> new LineReportWriter(out, separator);
      case NDJSON -> new NdjsonReportWriter(out);
    };
  }
}
