package ca.gc.cra.fanout.application.port;

import java.util.Objects;
import java.util.Optional;

/**
 * Where a session should land and how to route there.
 *
 * @param host final destination host
 * @param jumpbox optional intermediate hop
 * @since 0.1.0
 */
public record RemoteTarget(String host, Optional<String> jumpbox) {
  public RemoteTarget {
    Objects.requireNonNull(host, "host");
    jumpbox = Objects.requireNonNullElse(jumpbox, Optional.<String>empty());
  }

  /**
   * Renders the route for logs, e.g. {@code web1 via bastion}.
   *
   * @return display form
   */
  public String describe() {
    return jumpbox.map(hop -> host + " via " + hop).orElse(host);
  }
}
