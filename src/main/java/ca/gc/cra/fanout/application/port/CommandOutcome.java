package ca.gc.cra.fanout.application.port;

import java.util.Objects;

/**
 * Raw result of a remote command that ran to completion.
 *
 * @param output combined stdout and stderr as captured, line breaks intact
 * @param exitStatus remote exit status
 * @since 0.1.0
 */
public record CommandOutcome(String output, int exitStatus) {
  public CommandOutcome {
    output = Objects.requireNonNullElse(output, "");
  }

  public boolean succeeded() {
    return exitStatus == 0;
  }
}
