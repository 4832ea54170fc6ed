package work.lcod.inventory.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LaunchSettingsTest {
    @TempDir
    Path tempDir;

    @Test
    void flagBeatsEnvironmentVariable() {
        var settings = new LaunchSettings(
            Map.of("INVENTORY_ENV", "dev", "INVENTORY_URI", "/srv/config.yml", "INVENTORY_FORMAT", "json"),
            Optional.empty(),
            List.of(),
            tempDir
        );
        assertEquals(Optional.of("prod"), settings.environment("prod"));
        assertEquals(Optional.of("dev"), settings.environment(null));
        assertEquals(Optional.of("/srv/config.yml"), settings.rootUri(null));
        assertEquals("yaml", settings.outputFormat("yaml"));
        assertEquals("json", settings.outputFormat(null));
    }

    @Test
    void environmentFallsBackToSymlinkName() throws IOException {
        var launcher = Files.createFile(tempDir.resolve("inventory"));
        var link = Files.createSymbolicLink(tempDir.resolve("staging"), launcher.getFileName());

        var viaLink = new LaunchSettings(Map.of(), Optional.of(link), List.of(), tempDir);
        var direct = new LaunchSettings(Map.of(), Optional.of(launcher), List.of(), tempDir);

        assertEquals(Optional.of("staging"), viaLink.environment(null));
        assertTrue(direct.environment(null).isEmpty());
    }

    @Test
    void rootUriFallsBackToConfigNextToLauncherThenSystemPaths() throws IOException {
        var bin = Files.createDirectories(tempDir.resolve("bin"));
        var launcher = Files.createFile(bin.resolve("inventory"));
        var system = Files.createFile(tempDir.resolve("system.yaml"));

        var settings = new LaunchSettings(Map.of(), Optional.of(launcher), List.of(tempDir.resolve("absent.yaml"), system), tempDir);
        assertEquals(Optional.of(system.toString()), settings.rootUri(null));

        var local = Files.createFile(Files.createDirectories(tempDir.resolve("etc")).resolve("config.yaml"));
        assertEquals(Optional.of(local.toString()), settings.rootUri(null));
        assertFalse(new LaunchSettings(Map.of(), Optional.empty(), List.of(), tempDir).rootUri(" ").isPresent());
    }

    @Test
    void vaultPasswordFileDefaultsToHome() {
        var defaults = new LaunchSettings(Map.of(), Optional.empty(), List.of(), tempDir);
        assertEquals(new LaunchSettings.VaultPasswordSource(tempDir.resolve(".vault_pass.txt"), false), defaults.vaultPasswordFile(null));

        var fromEnv = new LaunchSettings(Map.of("VAULT_PASSWORD_FILE", "~/secrets/pass"), Optional.empty(), List.of(), tempDir);
        assertEquals(new LaunchSettings.VaultPasswordSource(tempDir.resolve("secrets/pass"), true), fromEnv.vaultPasswordFile(null));
        assertEquals(Path.of("/dev/null"), fromEnv.vaultPasswordFile("/dev/null").path());
    }

    @Test
    void appliesDefaults() {
        var settings = new LaunchSettings(Map.of(), Optional.empty(), List.of(), tempDir);
        assertEquals("yaml", settings.outputFormat(null));
        assertEquals("30s", settings.timeout(null));
        assertEquals("warn", settings.logLevel(null));
        assertEquals("debug", new LaunchSettings(Map.of("INVENTORY_LOG_LEVEL", "debug"), Optional.empty(), List.of(), tempDir).logLevel(null));
    }
}
