package ca.gc.cra.fanout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("script", "   "));
    assertEquals("script must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("script", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("script", null));
  }

  @Test
  void loginNamesFollowPosixShape() {
    assertEquals("deploy_user.1", Strings.requireLoginName("sshUser", "deploy_user.1"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLoginName("sshUser", "-oops"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLoginName("sshUser", "a;b"));
  }

  @Test
  void printableAsciiEnforcesLengthAndRange() {
    assertEquals("team=ops", Strings.requirePrintableAscii("attrs", "team=ops", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 16));
  }

  @Test
  void messageFallsBackToValueLabel() {
    assertEquals("value must not be blank", Strings.message(null, "must not be blank"));
  }
}
