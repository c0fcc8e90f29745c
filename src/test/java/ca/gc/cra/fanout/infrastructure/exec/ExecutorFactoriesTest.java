package ca.gc.cra.fanout.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsAreNamedWithPrefix() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(2, "fanout-worker", null);
    Set<String> names = ConcurrentHashMap.newKeySet();
    CountDownLatch both = new CountDownLatch(2);
    try {
      for (int i = 0; i < 2; i++) {
        pool.execute(() -> {
          names.add(Thread.currentThread().getName());
          both.countDown();
          try {
            both.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        });
      }
      assertTrue(both.await(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
    assertEquals(Set.of("fanout-worker-0", "fanout-worker-1"), names);
  }

  @Test
  void workBeyondPoolSizeIsRejectedWhileBusy() throws Exception {
    ExecutorService pool = ExecutorFactories.newWorkerPool(1, "busy", null);
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch started = new CountDownLatch(1);
    try {
      pool.execute(() -> {
        started.countDown();
        try {
          release.await();
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      });
      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> {}));
    } finally {
      release.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void rejectsNonPositiveSize() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }

  @Test
  void streamPumpRunsOnDaemonThread() throws Exception {
    AtomicBoolean ran = new AtomicBoolean();

    Thread pump = ExecutorFactories.startStreamPump("pump-test", () -> ran.set(true));
    pump.join(5_000);

    assertTrue(pump.isDaemon());
    assertEquals("pump-test", pump.getName());
    assertTrue(ran.get());
  }
}
