package ca.gc.cra.fanout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
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
  void noCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output().contains("usage: fanout <run|single|expand>"));
  }

  @Test
  void helpFlagWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output().contains("Commands:"));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"deploy"}));
  }

  @Test
  void dispatchesToExpand() {
    ExitCode code = Main.run(new String[] {"expand", "hosts=web{1..2}"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output().contains("web2"));
  }

  @Test
  void exitCodesAreStable() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(1, ExitCode.HOST_FAILURES.code());
    assertEquals(2, ExitCode.INVALID_ARGS.code());
    assertEquals(130, ExitCode.INTERRUPTED.code());
  }

  private String output() {
    return stdout.toString(StandardCharsets.UTF_8);
  }
}
