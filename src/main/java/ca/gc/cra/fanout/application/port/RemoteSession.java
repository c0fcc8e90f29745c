package ca.gc.cra.fanout.application.port;

import ca.gc.cra.fanout.domain.job.ScriptBody;

/**
 * An authenticated, non-interactive remote shell session bound to one host.
 *
 * <p>Sessions are used by exactly one worker and closed once the command has finished.</p>
 *
 * @since 0.1.0
 */
public interface RemoteSession extends AutoCloseable {
  /**
   * Runs a shell on the remote host with {@code script} as its standard input and waits for it to exit.
   *
   * @param script script to feed the remote shell
   * @return captured combined output and exit status
   * @throws RemoteShellException if the transport fails before the command completes
   * @throws InterruptedException if the run is cancelled while waiting
   */
  CommandOutcome runWithStdin(ScriptBody script) throws RemoteShellException, InterruptedException;

  /** Releases the session; in-flight remote work is abandoned. */
  @Override
  void close();
}
