package work.lcod.inventory.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.inventory.fetch.FragmentLoader;
import work.lcod.inventory.fetch.HttpTransport;
import work.lcod.inventory.runtime.InventoryBuilder;
import work.lcod.inventory.runtime.InventoryDocument;
import work.lcod.inventory.vault.Vault;

/**
 * Public entry point for embedding the aggregator. One instance serves one invocation: the root
 * configuration is fetched on first use and reused by every operation.
 */
public final class InventoryService {
    private final InventoryConfiguration configuration;
    private final InventoryBuilder builder;

    public InventoryService(InventoryConfiguration configuration) {
        this(configuration, FragmentLoader.standard(
            new HttpTransport(configuration.timeout()),
            configuration.vaultPassword().map(Vault::new)
        ));
    }

    public InventoryService(InventoryConfiguration configuration, FragmentLoader loader) {
        this.configuration = configuration;
        this.builder = new InventoryBuilder(configuration.rootUri(), loader);
    }

    public InventoryConfiguration configuration() {
        return configuration;
    }

    /**
     * Environment names declared upstream, sorted.
     */
    public List<String> environments() {
        return builder.rootConfiguration().environmentNames();
    }

    public InventoryDocument generate(String environment) {
        return builder.build(environment);
    }

    /**
     * Sorted top-level groups of the generated inventory, without {@code _meta}.
     */
    public List<String> groups(String environment) {
        return generate(environment).groups();
    }

    /**
     * The declared fragment lists, unmerged and unfetched.
     */
    public Map<String, Object> tree(Optional<String> environment) {
        return builder.rootConfiguration().rawTree(environment);
    }

    public String render(Object tree) {
        return configuration.outputFormat().write(tree);
    }
}
