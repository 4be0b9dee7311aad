package dev.nishisan.watcher.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigProviderTest {

    @TempDir
    Path tempDir;

    @Test
    void reloadSwapsSnapshot() throws IOException {
        Path file = tempDir.resolve("alerts.yml");
        Files.writeString(file, WatcherConfigLoaderTest.VALID_YAML);
        ConfigProvider provider = ConfigProvider.fromFile(file, name -> "pw");
        WatcherConfig before = provider.current();

        Files.writeString(file, WatcherConfigLoaderTest.VALID_YAML.replace("cpu_percent: 80", "cpu_percent: 60"));
        WatcherConfig after = provider.reload();

        assertEquals(80.0, before.cpuThreshold("web"));
        assertEquals(60.0, after.cpuThreshold("web"));
        assertSame(after, provider.get());
    }

    @Test
    void failedReloadKeepsPreviousSnapshot() throws IOException {
        Path file = tempDir.resolve("alerts.yml");
        Files.writeString(file, WatcherConfigLoaderTest.VALID_YAML);
        ConfigProvider provider = ConfigProvider.fromFile(file, name -> "pw");
        WatcherConfig before = provider.current();

        Files.writeString(file, WatcherConfigLoaderTest.VALID_YAML.replace("cpu_percent: 80", "cpu_percent: 800"));

        assertThrows(WatcherConfigException.class, provider::reload);
        assertSame(before, provider.current());
    }

    @Test
    void invalidFileFailsAtStartup() throws IOException {
        Path file = tempDir.resolve("alerts.yml");
        Files.writeString(file, "app: {}\n");

        assertThrows(WatcherConfigException.class, () -> ConfigProvider.fromFile(file, name -> null));
    }

    @Test
    void fixedProviderCannotReload() {
        ConfigProvider provider = ConfigProvider.of(WatcherConfig.builder().build());
        assertThrows(IllegalStateException.class, provider::reload);
    }
}
