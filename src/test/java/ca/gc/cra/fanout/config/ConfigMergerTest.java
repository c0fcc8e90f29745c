package ca.gc.cra.fanout.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("run");
    Map<String, String> yaml = Map.of("processes", "8", "jumpbox", "bastion");
    Map<String, String> cli = Map.of("processes", "16", "hosts", "web{1..3}");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("16", merged.get("processes"));
    assertEquals("bastion", merged.get("jumpbox"));
    assertEquals("30", merged.get("connectTimeout"));
    assertEquals(List.of("CLI overrides YAML for key: processes"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run",
        Optional.of(Map.of("connectTimeout", "5")),
        Map.of(),
        DefaultsForMode.asFlatMap("run"),
        warnings::add);

    assertEquals("5", merged.get("connectTimeout"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void singleDropsProcessesWithWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "single",
        Optional.empty(),
        Map.of("host", "web1", "processes", "8"),
        DefaultsForMode.asFlatMap("single"),
        warnings::add);

    assertFalse(merged.containsKey("processes"));
    assertEquals(List.of("single always uses one worker; ignoring processes"), warnings);
  }

  @Test
  void singleRejectsHostPattern() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "single",
            Optional.empty(),
            Map.of("hosts", "web{1..3}"),
            DefaultsForMode.asFlatMap("single"),
            msg -> {}));
  }

  @Test
  void runRejectsSingleHostKey() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("host", "web1"),
            DefaultsForMode.asFlatMap("run"),
            msg -> {}));
  }

  @Test
  void ndjsonRejectsCustomSeparator() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "run",
            Optional.empty(),
            Map.of("format", "ndjson", "separator", "|"),
            DefaultsForMode.asFlatMap("run"),
            msg -> {}));
    assertEquals("separator applies to format=text only", ex.getMessage());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("deploy", Optional.empty(), Map.of(), Map.of(), msg -> {}));
  }
}
