package ca.gc.cra.fanout.domain.job;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class WorkerPoolConfigTest {

  @Test
  void zeroConcurrencyIsRejected() {
    InvalidConcurrencyException ex =
        assertThrows(InvalidConcurrencyException.class, () -> WorkerPoolConfig.of(0, 30));
    assertTrue(ex.getMessage().contains("was 0"), ex.getMessage());
  }

  @Test
  void timeoutsConvertToDurations() {
    WorkerPoolConfig config = new WorkerPoolConfig(8, 5, 120);

    assertEquals(Duration.ofSeconds(5), config.connectTimeout());
    assertEquals(Duration.ofMinutes(2), config.commandTimeout());
  }

  @Test
  void ofLeavesCommandUnbounded() {
    assertEquals(Duration.ZERO, WorkerPoolConfig.of(2, 10).commandTimeout());
  }

  @Test
  void rejectsNonPositiveConnectTimeout() {
    assertThrows(IllegalArgumentException.class, () -> WorkerPoolConfig.of(2, 0));
  }

  @Test
  void rejectsNegativeCommandTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPoolConfig(2, 10, -1));
  }

  @Test
  void parseAcceptsPositiveIntegers() {
    assertEquals(16, InvalidConcurrencyException.parse(" 16 "));
  }

  @Test
  void parseRejectsZeroNegativeAndGarbage() {
    assertThrows(InvalidConcurrencyException.class, () -> InvalidConcurrencyException.parse("0"));
    assertThrows(InvalidConcurrencyException.class, () -> InvalidConcurrencyException.parse("-3"));
    assertThrows(InvalidConcurrencyException.class, () -> InvalidConcurrencyException.parse("four"));
    assertThrows(InvalidConcurrencyException.class, () -> InvalidConcurrencyException.parse(""));
  }
}
