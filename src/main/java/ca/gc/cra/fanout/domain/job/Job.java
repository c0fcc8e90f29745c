package ca.gc.cra.fanout.domain.job;

import java.util.Objects;
import java.util.Optional;

/**
 * One unit of work: run {@code script} on {@code host}, optionally through {@code jumpbox}.
 *
 * <p>The jump host travels with every job instead of living in shared state, so each worker sees exactly the
 * routing the run was started with.</p>
 *
 * @param host target host name; never blank
 * @param script script snapshot shared by every job of the run
 * @param jumpbox optional intermediate host
 * @since 0.1.0
 */
public record Job(String host, ScriptBody script, Optional<String> jumpbox) {
  public Job {
    Objects.requireNonNull(host, "host");
    if (host.isBlank()) {
      throw new IllegalArgumentException("host must not be blank");
    }
    Objects.requireNonNull(script, "script");
    jumpbox = Objects.requireNonNullElse(jumpbox, Optional.<String>empty()).filter(value -> !value.isBlank());
  }
}
