package ca.gc.cra.kestrel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void loadsEngineSettingsAndModuleSections() throws Exception {
    KestrelConfig config = YamlConfigLoader.load(Path.of("src/test/resources/config/kestrel.yaml")).orElseThrow();

    assertEquals(Path.of("/var/lib/kestrel"), config.storageRoot());
    assertEquals("2.0.4", config.engineVersion());
    assertEquals(16, config.maxCascadeDepth());
    assertEquals(4, config.processingParallelism());
    assertEquals(Set.of("analysisinfo", "behavior", "memory"), config.processing().names());
    assertTrue(config.auxiliary().section("sniffer").orElseThrow().enabled());
    assertFalse(config.processing().section("memory").orElseThrow().enabled());
    assertEquals(2, config.reporting().section("logreport").orElseThrow().integer("minSeverity", 0));
    assertEquals(Path.of("/var/lib/kestrel", "analyses", "9"), config.analysisPath(9));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml")).isEmpty());
  }

  @Test
  void emptyDocumentFallsBackToDefaults() throws Exception {
    Path file = tempDir.resolve("kestrel.yaml");
    Files.writeString(file, "");

    KestrelConfig config = YamlConfigLoader.load(file).orElseThrow();

    assertEquals(KestrelConfig.defaults(), config);
    assertEquals(KestrelVersion.CURRENT, config.engineVersion());
  }

  @Test
  void sectionLookupIgnoresCase() throws Exception {
    Path file = tempDir.resolve("kestrel.yaml");
    Files.writeString(file, "Processing:\n  Strings:\n    enabled: true\n");

    KestrelConfig config = YamlConfigLoader.load(file).orElseThrow();

    assertTrue(config.processing().section("strings").orElseThrow().enabled());
  }

  @Test
  void malformedYamlIsAConfigurationError() throws Exception {
    Path file = tempDir.resolve("kestrel.yaml");
    Files.writeString(file, "processing: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file));
  }

  @Test
  void invalidNumbersAndSectionsAreRejected() throws Exception {
    Path depth = tempDir.resolve("depth.yaml");
    Files.writeString(depth, "engine:\n  maxCascadeDepth: deep\n");
    Path zero = tempDir.resolve("zero.yaml");
    Files.writeString(zero, "engine:\n  processingParallelism: 0\n");
    Path scalar = tempDir.resolve("scalar.yaml");
    Files.writeString(scalar, "processing:\n  strings: on\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(depth));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(zero));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(scalar));
  }
}
