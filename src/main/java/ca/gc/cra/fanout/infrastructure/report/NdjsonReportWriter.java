package ca.gc.cra.fanout.infrastructure.report;

import ca.gc.cra.fanout.application.port.ResultReporter;
import ca.gc.cra.fanout.domain.job.ExecutionResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes one JSON object per result, newline-delimited.
 *
 * <p>Fields: {@code host}, {@code status}, {@code kind} (failures only), {@code output}, {@code detail}
 * (failures only) and {@code elapsedMillis}. Jackson escapes any control character, so a record never spans lines.
 * Serialization happens outside the lock; only the write and flush are serialized.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonReportWriter implements ResultReporter {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final OutputStream out;
  private final ReentrantLock lock = new ReentrantLock();

  public NdjsonReportWriter(OutputStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void report(ExecutionResult result) {
    try {
      byte[] line = serialize(result);
      lock.lock();
      try {
        out.write(line);
        out.flush();
      } finally {
        lock.unlock();
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to write report record for " + result.host(), ex);
    }
  }

  private byte[] serialize(ExecutionResult result) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = jsonFactory.createGenerator(buffer)) {
      gen.writeStartObject();
      gen.writeStringField("host", result.host());
      gen.writeStringField("status", result.status().name());
      if (!result.succeeded()) {
        gen.writeStringField("kind", result.failureKind().label());
      }
      gen.writeStringField("output", result.output());
      if (!result.succeeded()) {
        gen.writeStringField("detail", result.detail());
      }
      gen.writeNumberField("elapsedMillis", result.elapsedMillis());
      gen.writeEndObject();
    }
    buffer.write('\n');
    return buffer.toByteArray();
  }
}
