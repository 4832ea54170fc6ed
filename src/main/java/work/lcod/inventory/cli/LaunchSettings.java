package work.lcod.inventory.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves launch defaults once, from the process environment and the launcher path. Precedence for
 * every setting: explicit flag, then environment variable, then derived default.
 */
final class LaunchSettings {
    static final String ENV_ENVIRONMENT = "INVENTORY_ENV";
    static final String ENV_URI = "INVENTORY_URI";
    static final String ENV_FORMAT = "INVENTORY_FORMAT";
    static final String ENV_TIMEOUT = "INVENTORY_TIMEOUT";
    static final String ENV_LOG_LEVEL = "INVENTORY_LOG_LEVEL";
    static final String ENV_VAULT_PASSWORD_FILE = "VAULT_PASSWORD_FILE";
    /** Set by the launcher script to {@code $0}, the path the tool was invoked through. */
    static final String LAUNCHER_PROPERTY = "inventory.launcher";
    static final List<Path> SYSTEM_CONFIG_PATHS = List.of(
        Path.of("/etc/inventory-aggregator/config.yaml"),
        Path.of("/usr/local/etc/inventory-aggregator/config.yaml")
    );

    record VaultPasswordSource(Path path, boolean explicit) {}

    private final Map<String, String> env;
    private final Optional<Path> launcher;
    private final List<Path> systemConfigPaths;
    private final Path home;

    LaunchSettings(Map<String, String> env, Optional<Path> launcher, List<Path> systemConfigPaths, Path home) {
        this.env = Map.copyOf(Objects.requireNonNull(env, "env"));
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.systemConfigPaths = List.copyOf(systemConfigPaths);
        this.home = Objects.requireNonNull(home, "home");
    }

    static LaunchSettings fromSystem() {
        Optional<Path> launcher = Optional.ofNullable(System.getProperty(LAUNCHER_PROPERTY))
            .filter(value -> !value.isBlank())
            .map(Path::of);
        return new LaunchSettings(System.getenv(), launcher, SYSTEM_CONFIG_PATHS, Path.of(System.getProperty("user.home")));
    }

    Optional<Path> launcher() {
        return launcher;
    }

    /**
     * {@code --env}, then {@code INVENTORY_ENV}, then the name of the symlink the tool was launched through.
     */
    Optional<String> environment(String flag) {
        Optional<String> explicit = firstNonBlank(flag, env.get(ENV_ENVIRONMENT));
        if (explicit.isPresent()) {
            return explicit;
        }
        return launcher
            .filter(Files::isSymbolicLink)
            .map(Path::getFileName)
            .map(Path::toString);
    }

    /**
     * {@code --uri}, then {@code INVENTORY_URI}, then the first existing well-known config file.
     */
    Optional<String> rootUri(String flag) {
        Optional<String> explicit = firstNonBlank(flag, env.get(ENV_URI));
        if (explicit.isPresent()) {
            return explicit;
        }
        var candidates = new ArrayList<Path>();
        launcher.map(path -> path.toAbsolutePath().getParent())
            .ifPresent(dir -> candidates.add(dir.resolve("..").resolve("etc").resolve("config.yaml").normalize()));
        candidates.addAll(systemConfigPaths);
        return candidates.stream()
            .filter(Files::isRegularFile)
            .map(Path::toString)
            .findFirst();
    }

    VaultPasswordSource vaultPasswordFile(String flag) {
        Optional<String> explicit = firstNonBlank(flag, env.get(ENV_VAULT_PASSWORD_FILE));
        if (explicit.isPresent()) {
            return new VaultPasswordSource(expandHome(explicit.get()), true);
        }
        return new VaultPasswordSource(home.resolve(".vault_pass.txt"), false);
    }

    String outputFormat(String flag) {
        return firstNonBlank(flag, env.get(ENV_FORMAT)).orElse("yaml");
    }

    String timeout(String flag) {
        return firstNonBlank(flag, env.get(ENV_TIMEOUT)).orElse("30s");
    }

    String logLevel(String flag) {
        return firstNonBlank(flag, env.get(ENV_LOG_LEVEL)).orElse("warn");
    }

    private Path expandHome(String raw) {
        if (raw.equals("~") || raw.startsWith("~/")) {
            return home.resolve(raw.length() > 2 ? raw.substring(2) : "");
        }
        return Path.of(raw);
    }

    private static Optional<String> firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }
}
