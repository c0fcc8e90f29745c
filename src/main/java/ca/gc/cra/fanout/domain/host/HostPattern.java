package ca.gc.cra.fanout.domain.host;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Parsed brace-style host pattern such as {@code {web,app}serv{01..12}}.
 * <p><strong>Why:</strong> Lets operators describe large host sets compactly while the dispatcher still works on a
 * plain, ordered list of host names.</p>
 * <p><strong>Role:</strong> Domain value object; the only producer of host lists.</p>
 * <p><strong>Grammar:</strong>
 * <ul>
 *   <li>Literal text is copied as-is.</li>
 *   <li>{@code {a,b,c}} alternates; each alternative may itself contain groups.</li>
 *   <li>{@code {m..n}} and {@code {m..n..step}} count upwards over non-negative integers. A bound written with a
 *   leading zero pads every value to the width of the widest bound.</li>
 *   <li>Adjacent parts compose as a cross product, leftmost part varying slowest.</li>
 *   <li>A group with neither a comma nor a range is kept literally, braces included.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class HostPattern {
  /** Upper bound applied by {@link #expand()} to protect against runaway patterns. */
  public static final int DEFAULT_MAX_HOSTS = 100_000;

  private static final Pattern RANGE = Pattern.compile("^(\\d+)\\.\\.(\\d+)(?:\\.\\.(\\d+))?$");

  private final String source;
  private final Sequence root;

  private HostPattern(String source, Sequence root) {
    this.source = source;
    this.root = root;
  }

  /**
   * Parses a host pattern.
   *
   * @param pattern pattern text; must not be blank or contain whitespace
   * @return parsed pattern
   * @throws InvalidHostPatternException if braces are unbalanced, a range is non-numeric or inverted, or the text is
   *     blank
   */
  public static HostPattern parse(String pattern) {
    if (pattern == null) {
      throw new InvalidHostPatternException(null, "pattern is required");
    }
    if (pattern.isBlank()) {
      throw new InvalidHostPatternException(pattern, "pattern must not be blank");
    }
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (Character.isWhitespace(c) || Character.isISOControl(c)) {
        throw new InvalidHostPatternException(
            pattern, "whitespace or control character at position " + i);
      }
    }
    return new HostPattern(pattern, new Parser(pattern).parse());
  }

  /**
   * Parses and expands {@code pattern} with the default host cap.
   *
   * @param pattern pattern text
   * @return ordered host names
   */
  public static List<String> expandAll(String pattern) {
    return parse(pattern).expand();
  }

  /**
   * Returns the number of host names this pattern yields, saturating at {@link Long#MAX_VALUE}.
   *
   * @return host count without materializing the list
   */
  public long size() {
    return root.count();
  }

  /**
   * Expands the pattern using {@link #DEFAULT_MAX_HOSTS} as the cap.
   *
   * @return ordered, immutable host list
   */
  public List<String> expand() {
    return expand(DEFAULT_MAX_HOSTS);
  }

  /**
   * Expands the pattern into an ordered host list.
   *
   * @param maxHosts largest acceptable expansion; must be positive
   * @return ordered, immutable host list; duplicates are kept
   * @throws InvalidHostPatternException if the expansion exceeds {@code maxHosts} or yields an empty host name
   */
  public List<String> expand(int maxHosts) {
    if (maxHosts < 1) {
      throw new IllegalArgumentException("maxHosts must be positive (was " + maxHosts + ")");
    }
    long count = size();
    if (count > maxHosts) {
      throw new InvalidHostPatternException(
          source, "expands to " + count + " hosts, above the limit of " + maxHosts);
    }
    List<String> hosts = root.expand();
    for (String host : hosts) {
      if (host.isEmpty()) {
        throw new InvalidHostPatternException(source, "expands to an empty host name");
      }
    }
    return List.copyOf(hosts);
  }

  /**
   * Returns the pattern text this instance was parsed from.
   *
   * @return original pattern
   */
  public String source() {
    return source;
  }

  @Override
  public String toString() {
    return source;
  }

  private interface Part {
    List<String> expand();

    long count();
  }

  private record Literal(String text) implements Part {
    @Override
    public List<String> expand() {
      return List.of(text);
    }

    @Override
    public long count() {
      return 1;
    }
  }

  private record Sequence(List<Part> parts) implements Part {
    @Override
    public List<String> expand() {
      List<String> result = List.of("");
      for (Part part : parts) {
        List<String> suffixes = part.expand();
        List<String> next = new ArrayList<>(result.size() * suffixes.size());
        for (String prefix : result) {
          for (String suffix : suffixes) {
            next.add(prefix + suffix);
          }
        }
        result = next;
      }
      return result;
    }

    @Override
    public long count() {
      long total = 1;
      for (Part part : parts) {
        total = saturatingMultiply(total, part.count());
      }
      return total;
    }
  }

  private record Alternation(List<Sequence> options) implements Part {
    @Override
    public List<String> expand() {
      List<String> result = new ArrayList<>();
      for (Sequence option : options) {
        result.addAll(option.expand());
      }
      return result;
    }

    @Override
    public long count() {
      long total = 0;
      for (Sequence option : options) {
        total = saturatingAdd(total, option.count());
      }
      return total;
    }
  }

  private record NumericRange(long start, long end, long step, int width) implements Part {
    @Override
    public List<String> expand() {
      List<String> values = new ArrayList<>((int) Math.min(count(), DEFAULT_MAX_HOSTS));
      for (long value = start; value <= end; value += step) {
        values.add(pad(value));
        if (end - value < step) {
          break;
        }
      }
      return values;
    }

    @Override
    public long count() {
      return (end - start) / step + 1;
    }

    private String pad(long value) {
      String digits = Long.toString(value);
      if (digits.length() >= width) {
        return digits;
      }
      return "0".repeat(width - digits.length()) + digits;
    }
  }

  private static long saturatingMultiply(long a, long b) {
    try {
      return Math.multiplyExact(a, b);
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }

  private static long saturatingAdd(long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }

  /** Recursive-descent parser; one instance per parse call. */
  private static final class Parser {
    private final String text;
    private int pos;

    private Parser(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    Sequence parse() {
      Sequence sequence = parseSequence(false);
      if (pos < text.length()) {
        throw error("unexpected '" + text.charAt(pos) + "' at position " + pos);
      }
      return sequence;
    }

    private Sequence parseSequence(boolean nested) {
      List<Part> parts = new ArrayList<>();
      StringBuilder literal = new StringBuilder();
      while (pos < text.length()) {
        char c = text.charAt(pos);
        if (c == '{') {
          flush(literal, parts);
          parts.add(parseGroup());
          continue;
        }
        if (c == '}') {
          if (nested) {
            break;
          }
          throw error("unmatched '}' at position " + pos);
        }
        if (c == ',' && nested) {
          break;
        }
        literal.append(c);
        pos++;
      }
      flush(literal, parts);
      return new Sequence(List.copyOf(parts));
    }

    private Part parseGroup() {
      int open = pos;
      int close = matchingClose(open);
      if (close < 0) {
        throw error("unmatched '{' at position " + open);
      }
      String content = text.substring(open + 1, close);
      if (content.indexOf('{') < 0 && content.indexOf(',') < 0 && content.contains("..")) {
        pos = close + 1;
        return parseRange(content);
      }

      pos = open + 1;
      List<Sequence> options = new ArrayList<>();
      options.add(parseSequence(true));
      while (pos < text.length() && text.charAt(pos) == ',') {
        pos++;
        options.add(parseSequence(true));
      }
      if (pos >= text.length() || text.charAt(pos) != '}') {
        throw error("unmatched '{' at position " + open);
      }
      pos++;
      if (options.size() == 1) {
        return new Sequence(List.of(new Literal("{"), options.get(0), new Literal("}")));
      }
      return new Alternation(List.copyOf(options));
    }

    private NumericRange parseRange(String content) {
      Matcher matcher = RANGE.matcher(content);
      if (!matcher.matches()) {
        throw error("range {" + content + "} must use non-negative integer bounds");
      }
      String startText = matcher.group(1);
      String endText = matcher.group(2);
      String stepText = matcher.group(3);
      long start = parseBound(startText);
      long end = parseBound(endText);
      long step = stepText == null ? 1 : parseBound(stepText);
      if (start > end) {
        throw error("range {" + content + "} is inverted (start " + start + " > end " + end + ")");
      }
      if (step < 1) {
        throw error("range {" + content + "} must use a positive step");
      }
      int width = 0;
      if (isPadded(startText) || isPadded(endText)) {
        width = Math.max(startText.length(), endText.length());
      }
      return new NumericRange(start, end, step, width);
    }

    private long parseBound(String digits) {
      try {
        return Long.parseLong(digits);
      } catch (NumberFormatException ex) {
        throw error("range bound " + digits + " is too large");
      }
    }

    private static boolean isPadded(String digits) {
      return digits.length() > 1 && digits.charAt(0) == '0';
    }

    private int matchingClose(int open) {
      int depth = 0;
      for (int i = open; i < text.length(); i++) {
        char c = text.charAt(i);
        if (c == '{') {
          depth++;
        } else if (c == '}') {
          depth--;
          if (depth == 0) {
            return i;
          }
        }
      }
      return -1;
    }

    private static void flush(StringBuilder literal, List<Part> parts) {
      if (literal.length() > 0) {
        parts.add(new Literal(literal.toString()));
        literal.setLength(0);
      }
    }

    private InvalidHostPatternException error(String reason) {
      return new InvalidHostPatternException(text, reason);
    }
  }
}
