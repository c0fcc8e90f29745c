package ca.gc.cra.fanout.domain.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class HostPatternTest {

  @Test
  void crossProductVariesLeftmostGroupSlowest() {
    assertEquals(
        List.of("aserv1", "aserv2", "bserv1", "bserv2"),
        HostPattern.expandAll("{a,b}serv{1,2}"));
  }

  @Test
  void plainNameExpandsToItself() {
    assertEquals(List.of("db01.example.org"), HostPattern.expandAll("db01.example.org"));
  }

  @Test
  void numericRangeIsInclusive() {
    assertEquals(List.of("web1", "web2", "web3"), HostPattern.expandAll("web{1..3}"));
  }

  @Test
  void leadingZeroPadsToWidestBound() {
    List<String> hosts = HostPattern.expandAll("node{08..11}");

    assertEquals(List.of("node08", "node09", "node10", "node11"), hosts);
  }

  @Test
  void stepSkipsValues() {
    assertEquals(List.of("h0", "h5", "h10"), HostPattern.expandAll("h{0..10..5}"));
  }

  @Test
  void alternativesMayNestGroups() {
    assertEquals(
        List.of("web1", "web2", "db"),
        HostPattern.expandAll("{web{1..2},db}"));
  }

  @Test
  void emptyAlternativeIsKept() {
    assertEquals(List.of("app", "app-dr"), HostPattern.expandAll("app{,-dr}"));
  }

  @Test
  void singleOptionGroupStaysLiteral() {
    assertEquals(List.of("host{x}"), HostPattern.expandAll("host{x}"));
  }

  @Test
  void duplicatesArePreserved() {
    assertEquals(List.of("a", "a"), HostPattern.expandAll("{a,a}"));
  }

  @Test
  void sizeCountsWithoutExpanding() {
    HostPattern pattern = HostPattern.parse("rack{1..40}-node{001..250}");

    assertEquals(10_000L, pattern.size());
    assertEquals("rack{1..40}-node{001..250}", pattern.source());
  }

  @Test
  void rejectsExpansionAboveCap() {
    HostPattern pattern = HostPattern.parse("n{1..20}");

    InvalidHostPatternException ex =
        assertThrows(InvalidHostPatternException.class, () -> pattern.expand(10));
    assertTrue(ex.getMessage().contains("above the limit of 10"), ex.getMessage());
    assertEquals("n{1..20}", ex.pattern());
  }

  @Test
  void rejectsUnbalancedBraces() {
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("web{1..3"));
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("web1..3}"));
  }

  @Test
  void rejectsInvertedOrNonNumericRanges() {
    InvalidHostPatternException inverted =
        assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("h{5..1}"));
    assertTrue(inverted.getMessage().contains("inverted"), inverted.getMessage());

    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("h{a..c}"));
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("h{1..9..0}"));
  }

  @Test
  void rejectsBlankAndWhitespace() {
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse(null));
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("  "));
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.parse("web 1"));
  }

  @Test
  void rejectsEmptyHostName() {
    assertThrows(InvalidHostPatternException.class, () -> HostPattern.expandAll("{,a}"));
  }

  @Test
  void expandRequiresPositiveCap() {
    HostPattern pattern = HostPattern.parse("a");

    assertThrows(IllegalArgumentException.class, () -> pattern.expand(0));
  }
}
