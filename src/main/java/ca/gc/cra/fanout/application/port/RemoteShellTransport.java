package ca.gc.cra.fanout.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Port onto the secure remote-shell mechanism the environment already trusts.
 * <p><strong>Why:</strong> Keeps the dispatcher independent of how sessions are opened so tests can substitute a
 * fake and production can shell out to OpenSSH.</p>
 * <p><strong>Role:</strong> Driven port implemented by {@code OpenSshTransport}.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>Batch mode only: never block on an interactive prompt; password authentication is disabled.</li>
 *   <li>Give up on the connection once {@code connectTimeout} elapses.</li>
 *   <li>Route through {@link RemoteTarget#jumpbox()} when present.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent {@link #open} calls from every worker.</p>
 *
 * @since 0.1.0
 */
public interface RemoteShellTransport {
  /**
   * Opens a session to {@code target}.
   *
   * @param target host and optional jump host
   * @param connectTimeout bound on connection establishment
   * @return open session owned by the caller
   * @throws RemoteShellException if the host cannot be reached or authenticated
   * @throws InterruptedException if the run is cancelled while connecting
   */
  RemoteSession open(RemoteTarget target, Duration connectTimeout)
      throws RemoteShellException, InterruptedException;
}
