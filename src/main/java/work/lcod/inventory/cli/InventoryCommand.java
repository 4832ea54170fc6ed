package work.lcod.inventory.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.inventory.api.InventoryConfiguration;
import work.lcod.inventory.api.InventoryService;
import work.lcod.inventory.error.InventoryException;
import work.lcod.inventory.fetch.FragmentFormat;
import work.lcod.inventory.fetch.UriResolver;
import work.lcod.inventory.shared.DurationParser;
import work.lcod.inventory.vault.VaultPasswords;

@CommandLine.Command(
    name = "inventory",
    description = "Ansible dynamic inventory aggregating YAML/JSON fragments listed in a root config file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class InventoryCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = "--env",
        description = "Platform name to pull inventory for (default: $INVENTORY_ENV, or the name of the symlink used to run the tool).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String env;

    @CommandLine.Option(
        names = "--uri",
        description = "Root config file, as a path or a file://, http:// or https:// URI (default: $INVENTORY_URI, "
            + "then ../etc/config.yaml next to the launcher, /etc/inventory-aggregator/config.yaml, "
            + "/usr/local/etc/inventory-aggregator/config.yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String uri;

    @CommandLine.Option(
        names = "--vault-password-file",
        paramLabel = "FILE",
        description = "Vault password file; /dev/null disables secret decryption (default: $VAULT_PASSWORD_FILE, then ~/.vault_pass.txt).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String vaultPasswordFile;

    @CommandLine.Option(
        names = "--output-format",
        paramLabel = "yaml|json",
        description = "Output format (default: $INVENTORY_FORMAT, then yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String outputFormat;

    @CommandLine.Option(
        names = "--timeout",
        description = "Timeout for each remote fetch, e.g. 1500ms, 30s, 2m (default: $INVENTORY_TIMEOUT, then 30s).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold on stderr: trace|debug|info|warn|error (default: $INVENTORY_LOG_LEVEL, then warn).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.ArgGroup(exclusive = true, multiplicity = "0..1")
    private Action action;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final LaunchSettings settings;

    static final class Action {
        @CommandLine.Option(names = "--list", description = "Print the inventory of the environment.")
        private boolean list;

        @CommandLine.Option(names = "--host", paramLabel = "HOST", description = "Host variables (always empty, use _meta.hostvars from --list).")
        private String host;

        @CommandLine.Option(
            names = "--createlinks",
            paramLabel = "DIRECTORY",
            description = "Create a symlink to the launcher in DIRECTORY for each upstream environment."
        )
        private Path linkDirectory;

        @CommandLine.Option(names = "--show", description = "List upstream environments, or the groups of the selected environment.")
        private boolean show;

        @CommandLine.Option(names = "--tree", description = "Print the fragment lists declared for all environments (or the selected one).")
        private boolean tree;
    }

    InventoryCommand() {
        this(LaunchSettings.fromSystem());
    }

    InventoryCommand(LaunchSettings settings) {
        this.settings = settings;
    }

    @Override
    public Integer call() {
        applyLogLevel();
        Action selected = action != null ? action : new Action();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Optional<String> environment = settings.environment(env);

        if (selected.linkDirectory != null) {
            Path launcher = settings.launcher().orElseThrow(() -> new CommandLine.ParameterException(
                spec.commandLine(),
                "--createlinks needs the launcher path (system property " + LaunchSettings.LAUNCHER_PROPERTY + ")"
            ));
            return new LinkCreator().create(service(false).environments(), selected.linkDirectory, launcher);
        }

        if (selected.tree) {
            InventoryService service = service(false);
            out.println(service.render(service.tree(environment)));
            return 0;
        }

        if (environment.isEmpty()) {
            if (selected.show) {
                out.println("Upstream environments:");
                service(false).environments().forEach(out::println);
                return 0;
            }
            err.println("Error: Missing environment, use --env or `export " + LaunchSettings.ENV_ENVIRONMENT + "`");
            return 1;
        }

        if (selected.show) {
            service(true).groups(environment.get()).forEach(out::println);
            return 0;
        }
        if (selected.list) {
            InventoryService service = service(true);
            out.println(service.render(service.generate(environment.get()).tree()));
            return 0;
        }
        if (selected.host != null) {
            out.println(service(false).render(new LinkedHashMap<String, Object>()));
            return 0;
        }
        err.println("Error: Missing parameter (--list or --host)?");
        return 1;
    }

    private InventoryService service(boolean withVault) {
        String rootUri = settings.rootUri(uri).orElseThrow(() -> new CommandLine.ParameterException(
            spec.commandLine(),
            "Missing root configuration, use --uri or `export " + LaunchSettings.ENV_URI + "`"
        ));
        var builder = InventoryConfiguration.builder()
            .rootUri(UriResolver.rootUri(rootUri))
            .environment(settings.environment(env))
            .outputFormat(resolveOutputFormat())
            .timeout(resolveTimeout());
        if (withVault) {
            var source = settings.vaultPasswordFile(vaultPasswordFile);
            builder.vaultPassword(VaultPasswords.load(source.path(), source.explicit()));
        }
        return new InventoryService(builder.build());
    }

    private FragmentFormat resolveOutputFormat() {
        String raw = settings.outputFormat(outputFormat);
        try {
            return FragmentFormat.fromName(raw);
        } catch (InventoryException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Unsupported output format: " + raw);
        }
    }

    private Duration resolveTimeout() {
        try {
            return DurationParser.parse(settings.timeout(timeoutRaw));
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private void applyLogLevel() {
        try {
            LogLevel.from(settings.logLevel(logLevelRaw)).apply();
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }
}
