package com.errlens.core.plugin;

import com.errlens.core.config.EngineConfig.PluginConfig;
import com.errlens.core.extractor.ExtractorPlugin;
import com.errlens.core.extractor.StubExtractor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import java.util.jar.Manifest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PluginLoader}.
 */
class PluginLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void register_sandboxTrust_wrapsPlugins() {
        StubExtractor plugin = new StubExtractor("rspec", 70, 80);

        PluginLoadResult result = PluginLoader.register(List.of(plugin), "rspec.jar",
            PluginConfig.defaults(), new HashSet<>());

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.plugins()).singleElement()
            .isInstanceOfSatisfying(SandboxedExtractor.class, s -> assertThat(s.getDelegate()).isSameAs(plugin));
    }

    @Test
    void register_fullTrust_keepsPluginAsIs() {
        StubExtractor plugin = new StubExtractor("rspec", 70, 80);
        PluginConfig config = new PluginConfig(null, TrustLevel.FULL, null, null);

        PluginLoadResult result = PluginLoader.register(List.of(plugin), "rspec.jar", config, new HashSet<>());

        assertThat(result.plugins()).containsExactly(plugin);
    }

    @Test
    void register_collectsRejectionsAndContinues() {
        // Given: a built-in name, a bad priority, a valid plugin, and a duplicate of it
        Set<String> taken = new HashSet<>(Set.of("jest"));
        List<ExtractorPlugin> candidates = List.of(
            new StubExtractor("jest", 50, 70),
            new StubExtractor("bad-priority", 500, 70),
            new StubExtractor("rspec", 70, 80),
            new StubExtractor("rspec", 60, 80)
        );

        // When
        PluginLoadResult result = PluginLoader.register(candidates, "bundle.jar", PluginConfig.defaults(), taken);

        // Then
        assertThat(result.plugins()).extracting(p -> p.getMetadata().name()).containsExactly("rspec");
        assertThat(result.errors()).extracting(PluginLoadError::message).containsExactly(
            "Plugin name 'jest' is already registered",
            "Priority must be between 0 and 100, was 500",
            "Plugin name 'rspec' is already registered");
        assertThat(result.errors()).extracting(PluginLoadError::source).containsOnly("bundle.jar");
        assertThat(taken).contains("rspec");
    }

    @Test
    void load_withoutDirectory_returnsEmpty() {
        PluginLoadResult result = PluginLoader.load(PluginConfig.defaults(), Set.of());

        assertThat(result).isEqualTo(PluginLoadResult.empty());
    }

    @Test
    void load_missingDirectory_returnsEmpty() {
        PluginConfig config = new PluginConfig(tempDir.resolve("absent").toString(), null, null, null);

        PluginLoadResult result = PluginLoader.load(config, Set.of());

        assertThat(result.plugins()).isEmpty();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void load_ignoresNonJarFiles() throws IOException {
        Files.writeString(tempDir.resolve("README.md"), "plugins go here");
        PluginConfig config = new PluginConfig(tempDir.toString(), null, null, null);

        PluginLoadResult result = PluginLoader.load(config, Set.of());

        assertThat(result.plugins()).isEmpty();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void load_jarWithoutServices_isReported() throws IOException {
        writeJar(tempDir.resolve("empty.jar"), null);
        PluginConfig config = new PluginConfig(tempDir.toString(), null, null, null);

        PluginLoadResult result = PluginLoader.load(config, Set.of());

        assertThat(result.plugins()).isEmpty();
        assertThat(result.errors()).containsExactly(
            new PluginLoadError("empty.jar", "No ExtractorPlugin services declared"));
    }

    @Test
    void load_jarRedeclaringBuiltIn_doesNotRegisterIt() throws IOException {
        // Given: a jar whose service file names a class that only exists in the engine
        writeJar(tempDir.resolve("copycat.jar"), "com.errlens.core.extractor.impl.report.TapExtractor\n");
        PluginConfig config = new PluginConfig(tempDir.toString(), null, null, null);

        // When
        PluginLoadResult result = PluginLoader.load(config, Set.of("tap"));

        // Then
        assertThat(result.plugins()).isEmpty();
        assertThat(result.errors()).extracting(PluginLoadError::source).containsOnly("copycat.jar");
    }

    @Test
    void load_jarNamingMissingClass_isReported() throws IOException {
        writeJar(tempDir.resolve("broken.jar"), "com.example.DoesNotExist\n");
        PluginConfig config = new PluginConfig(tempDir.toString(), null, null, null);

        PluginLoadResult result = PluginLoader.load(config, Set.of());

        assertThat(result.plugins()).isEmpty();
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.errors()).extracting(PluginLoadError::source).containsOnly("broken.jar");
    }

    private static void writeJar(Path jar, String serviceFile) throws IOException {
        Manifest manifest = new Manifest();
        manifest.getMainAttributes().putValue("Manifest-Version", "1.0");
        try (OutputStream out = Files.newOutputStream(jar);
             JarOutputStream jarOut = new JarOutputStream(out, manifest)) {
            if (serviceFile != null) {
                jarOut.putNextEntry(new JarEntry("META-INF/services/com.errlens.core.extractor.ExtractorPlugin"));
                jarOut.write(serviceFile.getBytes(StandardCharsets.UTF_8));
                jarOut.closeEntry();
            }
        }
    }
}
