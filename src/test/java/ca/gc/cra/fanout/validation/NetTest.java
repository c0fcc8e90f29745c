package ca.gc.cra.fanout.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostsAndUserQualifiedHosts() {
    assertEquals("web1.example.org", Net.requireDestination("host", "web1.example.org"));
    assertEquals("deploy@10.0.0.5", Net.requireDestination("host", "deploy@10.0.0.5"));
    assertEquals("[2001:db8::1]", Net.requireDestination("host", "[2001:db8::1]"));
  }

  @Test
  void rejectsOptionInjectionAndWhitespace() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireDestination("host", "-oProxyCommand=sh"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireDestination("host", "web 1"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireDestination("host", "@web1"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireDestination("host", "web1@"));
  }

  @Test
  void destinationsMayNotCarryPorts() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireDestination("host", "web1:22"));
  }

  @Test
  void jumpHostAcceptsPortsAndChains() {
    assertEquals("ops@bastion:2222", Net.requireJumpHost("ops@bastion:2222"));
    assertEquals("edge,ops@inner:22", Net.requireJumpHost("edge,ops@inner:22"));
    assertEquals("[2001:db8::1]:22", Net.requireJumpHost("[2001:db8::1]:22"));
  }

  @Test
  void jumpHostRejectsBadPortsAndEmptyHops() {
    assertThrows(IllegalArgumentException.class, () -> Net.requireJumpHost("bastion:0"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireJumpHost("bastion:99999"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireJumpHost("edge,,inner"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireJumpHost(":22"));
  }
}
