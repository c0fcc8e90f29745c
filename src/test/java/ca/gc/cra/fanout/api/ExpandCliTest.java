package ca.gc.cra.fanout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpandCliTest {
  private ByteArrayOutputStream stdout;

  @BeforeEach
  void setUp() {
    stdout = new ByteArrayOutputStream();
    CliPrinter.setStreamForTesting(stdout);
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestStream();
  }

  @Test
  void printsHostsInExpansionOrder() {
    ExitCode code = ExpandCli.run(new String[] {"hosts={a,b}serv{1,2}"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(String.join(System.lineSeparator(), "aserv1", "aserv2", "bserv1", "bserv2")
        + System.lineSeparator(), output());
  }

  @Test
  void countFlagPrintsSizeOnly() {
    ExitCode code = ExpandCli.run(new String[] {"hosts=rack{1..4}-n{01..25}", "--count"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals("100", output().trim());
  }

  @Test
  void capIsEnforced() {
    ExitCode code = ExpandCli.run(new String[] {"hosts=n{1..50}", "maxHosts=10"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(output().startsWith("usage: fanout expand"));
  }

  @Test
  void missingPatternIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ExpandCli.run(new String[0]));
  }

  private String output() {
    return stdout.toString(StandardCharsets.UTF_8);
  }
}
