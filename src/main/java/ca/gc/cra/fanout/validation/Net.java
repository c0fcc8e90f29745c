package ca.gc.cra.fanout.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * ssh destination validation.
 *
 * <p>Destinations are handed to the OpenSSH client as arguments, so they may also be aliases from
 * {@code ~/.ssh/config}. Validation is therefore structural: no whitespace or control characters, no leading
 * {@code -}, and a numeric port in range when one is given.</p>
 */
public final class Net {
  private static final int MAX_DESTINATION_LENGTH = 255;

  private Net() {
    // Utility
  }

  /**
   * Validates a single {@code [user@]host} destination.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate destination
   * @return trimmed destination
   * @throws IllegalArgumentException if the destination could be mistaken for an option or is malformed
   */
  public static String requireDestination(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    checkDestination(name, sanitized, false);
    return sanitized;
  }

  /**
   * Validates a jump host list as accepted by {@code ssh -J}: one or more comma-separated
   * {@code [user@]host[:port]} hops.
   *
   * @param value candidate jump host
   * @return trimmed jump host list
   * @throws IllegalArgumentException if any hop is malformed
   */
  public static String requireJumpHost(String value) {
    String sanitized = Strings.requireNonBlank("jumpbox", value);
    List<String> hops = new ArrayList<>();
    for (String hop : sanitized.split(",", -1)) {
      if (hop.isEmpty()) {
        throw new IllegalArgumentException("jumpbox must not contain empty hops (was '" + sanitized + "')");
      }
      checkDestination("jumpbox", hop, true);
      hops.add(hop);
    }
    return String.join(",", hops);
  }

  private static void checkDestination(String name, String destination, boolean allowPort) {
    if (destination.length() > MAX_DESTINATION_LENGTH) {
      throw new IllegalArgumentException(
          Strings.message(name, "length must be <= " + MAX_DESTINATION_LENGTH));
    }
    for (int i = 0; i < destination.length(); i++) {
      char c = destination.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c)) {
        throw new IllegalArgumentException(
            Strings.message(name, "must not contain whitespace (was '" + destination + "')"));
      }
    }
    if (destination.startsWith("-")) {
      throw new IllegalArgumentException(
          Strings.message(name, "must not start with '-' (was '" + destination + "')"));
    }
    int at = destination.lastIndexOf('@');
    if (at == 0 || at == destination.length() - 1) {
      throw new IllegalArgumentException(
          Strings.message(name, "must use [user@]host format (was '" + destination + "')"));
    }
    if (at > 0) {
      Strings.requireLoginName(name + " user", destination.substring(0, at));
    }
    String hostPart = destination.substring(at + 1);
    if (hostPart.startsWith("[")) {
      int close = hostPart.indexOf(']');
      if (close < 0) {
        throw new IllegalArgumentException(Strings.message(name, "must close IPv6 literal with ']'"));
      }
      String rest = hostPart.substring(close + 1);
      if (!rest.isEmpty()) {
        if (!allowPort || !rest.startsWith(":")) {
          throw new IllegalArgumentException(
              Strings.message(name, "has unexpected text after IPv6 literal (was '" + destination + "')"));
        }
        checkPort(name, rest.substring(1));
      }
      return;
    }
    int colon = hostPart.indexOf(':');
    if (colon >= 0 && colon == hostPart.lastIndexOf(':')) {
      if (!allowPort) {
        throw new IllegalArgumentException(
            Strings.message(name, "must not include a port (was '" + destination + "')"));
      }
      if (colon == 0) {
        throw new IllegalArgumentException(Strings.message(name, "is missing a host before ':'"));
      }
      checkPort(name, hostPart.substring(colon + 1));
    }
  }

  private static void checkPort(String name, String raw) {
    Numbers.parseInt(name + " port", raw, 1, 65_535);
  }
}
