package work.lcod.inventory.runtime;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.fetch.FragmentLoader;
import work.lcod.inventory.tree.TreeKind;
import work.lcod.inventory.tree.Trees;
import work.lcod.inventory.tree.TypeGuard;

/**
 * The root configuration document: an {@code environments} mapping of named fragment lists.
 * Immutable once loaded.
 */
public final class RootConfiguration {
    private static final Logger log = LoggerFactory.getLogger(RootConfiguration.class);
    static final String ENVIRONMENTS = "environments";

    private final URI source;
    private final Map<String, Object> environments;

    public RootConfiguration(URI source, Object document) {
        this.source = Objects.requireNonNull(source, "source");
        Map<String, Object> root = TypeGuard.requireMapping(document, "/");
        Object raw = root.get(ENVIRONMENTS);
        if (raw == null) {
            this.environments = Map.of();
        } else {
            TypeGuard.assertType(raw, EnumSet.of(TreeKind.MAPPING), ENVIRONMENTS);
            this.environments = Trees.freeze(Trees.copyMapping((Map<?, ?>) raw));
        }
    }

    public static RootConfiguration load(FragmentLoader loader, URI source) {
        var config = new RootConfiguration(source, loader.load(source));
        log.info("Loaded root configuration from {} ({} environments)", source, config.environments.size());
        return config;
    }

    public URI source() {
        return source;
    }

    /**
     * Environment names, sorted.
     */
    public List<String> environmentNames() {
        var names = new ArrayList<>(environments.keySet());
        names.sort(null);
        return names;
    }

    public boolean hasEnvironment(String name) {
        return environments.containsKey(name);
    }

    public Optional<EnvironmentDefinition> environment(String name) {
        if (!environments.containsKey(name)) {
            return Optional.empty();
        }
        return Optional.of(EnvironmentDefinition.parse(name, environments.get(name)));
    }

    /**
     * The unprocessed {@code environments} subtree, or just one environment's entry when a name is given.
     */
    public Map<String, Object> rawTree(Optional<String> environment) {
        if (environment.isEmpty()) {
            return environments;
        }
        var selected = new LinkedHashMap<String, Object>();
        selected.put(environment.get(), environments.get(environment.get()));
        return selected;
    }
}
