package ca.gc.cra.fanout.infrastructure.ssh;

import java.io.IOException;
import java.util.List;

/**
 * Starts the local ssh client process; replaced in tests by a launcher that runs a local shell instead.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ProcessLauncher {
  /**
   * Starts {@code command} with standard error merged into standard output.
   *
   * @param command argument vector, executable first
   * @return running process
   * @throws IOException if the executable cannot be started
   */
  Process start(List<String> command) throws IOException;

  /** Launcher backed by {@link ProcessBuilder}. */
  ProcessLauncher SYSTEM = command -> new ProcessBuilder(command).redirectErrorStream(true).start();
}
