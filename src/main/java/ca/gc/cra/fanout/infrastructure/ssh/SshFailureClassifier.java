package ca.gc.cra.fanout.infrastructure.ssh;

import ca.gc.cra.fanout.domain.job.FailureKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps the log of an ssh client that exited with status 255 onto a {@link FailureKind}.
 *
 * <p>Status 255 is reserved by OpenSSH for its own errors, but a remote script can also exit with 255. The input is
 * the client's {@code -E} log, which never contains remote output; when no line in it is recognised the exit is
 * treated as the script's own.</p>
 *
 * @since 0.1.0
 */
final class SshFailureClassifier {
  /** Exit status OpenSSH uses for client-side errors. */
  static final int SSH_ERROR_STATUS = 255;

  private static final String[] TIMEOUT_MARKERS = {
      "connection timed out", "operation timed out", "timed out"
  };
  private static final String[] AUTH_MARKERS = {
      "permission denied",
      "host key verification failed",
      "too many authentication failures",
      "no supported authentication methods"
  };
  private static final String[] UNREACHABLE_MARKERS = {
      "could not resolve hostname",
      "name or service not known",
      "no route to host",
      "connection refused",
      "network is unreachable",
      "connection closed by",
      "connection reset by",
      "kex_exchange_identification",
      "stdio forwarding failed",
      "ssh: "
  };

  private SshFailureClassifier() {}

  /**
   * Classifies an ssh client log.
   *
   * @param output lines the client wrote to its {@code -E} log
   * @return classification, or {@code null} when no line is an ssh diagnostic
   */
  static Classification classify(String output) {
    String[] lines = output == null ? new String[0] : output.split("\\R");
    FailureKind best = null;
    int bestIndex = -1;
    for (int i = 0; i < lines.length; i++) {
      FailureKind kind = kindOf(lines[i]);
      if (kind != null && (best == null || rank(kind) < rank(best))) {
        best = kind;
        bestIndex = i;
      }
    }
    if (best == null) {
      return null;
    }
    List<String> rest = new ArrayList<>(lines.length);
    for (int i = 0; i < lines.length; i++) {
      if (i != bestIndex) {
        rest.add(lines[i]);
      }
    }
    return new Classification(best, lines[bestIndex].trim(), String.join("\n", rest));
  }

  private static FailureKind kindOf(String line) {
    String lower = line.toLowerCase(Locale.ROOT);
    if (containsAny(lower, AUTH_MARKERS)) {
      return FailureKind.AUTHENTICATION_FAILURE;
    }
    if (containsAny(lower, TIMEOUT_MARKERS)) {
      return FailureKind.CONNECTION_TIMEOUT;
    }
    if (containsAny(lower, UNREACHABLE_MARKERS)) {
      return FailureKind.HOST_UNREACHABLE;
    }
    return null;
  }

  // Auth beats timeout beats unreachable; ssh often follows the real cause with "Connection closed by".
  private static int rank(FailureKind kind) {
    return switch (kind) {
      case AUTHENTICATION_FAILURE -> 0;
      case CONNECTION_TIMEOUT -> 1;
      case HOST_UNREACHABLE -> 2;
      case SCRIPT_EXECUTION_ERROR -> 3;
    };
  }

  private static boolean containsAny(String haystack, String[] needles) {
    for (String needle : needles) {
      if (haystack.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Result of classifying ssh output.
   *
   * @param kind failure class
   * @param diagnostic the ssh diagnostic line that decided the class
   * @param remainingOutput every other line of the client log
   */
  record Classification(FailureKind kind, String diagnostic, String remainingOutput) {}
}
