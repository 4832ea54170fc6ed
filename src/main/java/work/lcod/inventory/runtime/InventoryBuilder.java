package work.lcod.inventory.runtime;

import static work.lcod.inventory.runtime.InventoryDocument.ALL;
import static work.lcod.inventory.runtime.InventoryDocument.HOSTS;
import static work.lcod.inventory.runtime.InventoryDocument.HOSTVARS;
import static work.lcod.inventory.runtime.InventoryDocument.META;
import static work.lcod.inventory.runtime.InventoryDocument.PLATFORM_NAME;
import static work.lcod.inventory.runtime.InventoryDocument.VARS;

import java.net.URI;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;
import work.lcod.inventory.fetch.FragmentLoader;
import work.lcod.inventory.fetch.UriResolver;
import work.lcod.inventory.tree.MergePolicy;
import work.lcod.inventory.tree.TreeKind;
import work.lcod.inventory.tree.TreeMerger;
import work.lcod.inventory.tree.Trees;
import work.lcod.inventory.tree.TypeGuard;

/**
 * Builds the inventory of one environment: fetches every referenced fragment in declared order,
 * accumulates one working tree per {@link FragmentCategory} and combines them into an
 * {@link InventoryDocument}.
 *
 * <p>The root configuration is loaded at most once per builder; every relative fragment reference is
 * resolved against its URI. Builds are sequential and not thread-safe.
 */
public final class InventoryBuilder {
    private static final Logger log = LoggerFactory.getLogger(InventoryBuilder.class);

    private final URI rootUri;
    private final FragmentLoader loader;
    private final UriResolver resolver;
    private RootConfiguration root;
    private BuildState state = BuildState.INIT;

    public InventoryBuilder(URI rootUri, FragmentLoader loader) {
        this.rootUri = Objects.requireNonNull(rootUri, "rootUri");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.resolver = new UriResolver(rootUri);
    }

    public RootConfiguration rootConfiguration() {
        if (root == null) {
            root = RootConfiguration.load(loader, rootUri);
        }
        return root;
    }

    public BuildState state() {
        return state;
    }

    public InventoryDocument build(String environment) {
        Objects.requireNonNull(environment, "environment");
        transition(BuildState.INIT);
        try {
            transition(BuildState.LOAD_ROOT);
            var config = rootConfiguration();

            transition(BuildState.RESOLVE_ENVIRONMENT);
            var definition = config.environment(environment).orElseGet(() -> {
                log.info("Environment '{}' is not defined in {}, returning an empty inventory", environment, config.source());
                return EnvironmentDefinition.empty(environment);
            });

            transition(BuildState.MERGE_HOSTS);
            var hosts = accumulate(definition, FragmentCategory.HOSTS);
            transition(BuildState.MERGE_GROUP_VARS);
            var groupVars = accumulate(definition, FragmentCategory.GROUP_VARS);
            transition(BuildState.MERGE_HOST_VARS);
            var hostVars = accumulate(definition, FragmentCategory.HOST_VARS);

            transition(BuildState.NORMALIZE);
            var document = new InventoryDocument(environment, normalize(environment, hosts, groupVars, hostVars));
            transition(BuildState.DONE);
            return document;
        } catch (InventoryException ex) {
            BuildState failedIn = state;
            transition(BuildState.FAILED);
            throw ex.withContext(contextOf("environment", environment, "stage", failedIn));
        } catch (RuntimeException ex) {
            transition(BuildState.FAILED);
            throw ex;
        }
    }

    private Map<String, Object> accumulate(EnvironmentDefinition definition, FragmentCategory category) {
        Map<String, Object> working = new LinkedHashMap<>();
        int index = 0;
        for (var ref : definition.references(category)) {
            String section = definition.name() + ":" + category.configKey() + "[" + index + "]";
            URI uri = null;
            try {
                uri = resolver.resolve(ref.path());
                log.debug("{} -> {}", section, uri);
                Object fragment = loader.load(uri, ref.format());
                working = merge(working, ref, fragment, category, section);
                checkShape(working, category, section);
            } catch (InventoryException ex) {
                throw ex.withContext(contextOf(
                    "category", category.configKey(),
                    "fragment", index,
                    "path", ref.path(),
                    "uri", uri,
                    "key", ref.key().map(Object::toString).orElse(null)
                ));
            }
            index++;
        }
        return working;
    }

    private Map<String, Object> merge(
        Map<String, Object> working,
        FragmentRef ref,
        Object fragment,
        FragmentCategory category,
        String section
    ) {
        MergePolicy policy = category.policy();
        if (category == FragmentCategory.HOSTS) {
            working = normalizeGroups(working, section);
        }
        if (ref.key().isPresent()) {
            return TreeMerger.mergeAt(working, ref.key().get(), fragment, policy, section);
        }
        Map<String, Object> incoming = TypeGuard.requireMapping(fragment, section);
        if (category == FragmentCategory.HOSTS) {
            return TreeMerger.unionMappings(working, normalizeGroups(incoming, section), section);
        }
        return TreeMerger.overlayMappings(working, incoming);
    }

    /**
     * Applies the per-category shape rules to the working tree right after a fragment was merged, so a
     * violation is reported against that fragment. {@link #normalize} repeats them on the final trees.
     */
    private static void checkShape(Map<String, Object> working, FragmentCategory category, String section) {
        switch (category) {
            case HOSTS:
                working.forEach((name, value) -> {
                    String path = section + "/" + name;
                    if (META.equals(name)) {
                        checkHostvars(TypeGuard.requireMapping(value, path).get(HOSTVARS), path + "/" + HOSTVARS);
                    } else {
                        normalizeGroup(path, TypeGuard.convertSequenceToMapping(value, path));
                    }
                });
                break;
            case GROUP_VARS:
                working.forEach((name, vars) -> {
                    if (META.equals(name)) {
                        throw new InventoryException(ErrorKind.TYPE_MISMATCH, "'" + META + "' is not a group in section '" + section + "'");
                    }
                    TypeGuard.requireMapping(vars, section + "/" + name);
                });
                break;
            case HOST_VARS:
                checkHostvars(working, section);
                break;
            default:
                throw new IllegalStateException("Unhandled category " + category);
        }
    }

    private static void checkHostvars(Object hostvars, String section) {
        if (hostvars == null) {
            return;
        }
        TypeGuard.requireMapping(hostvars, section).forEach((host, vars) ->
            TypeGuard.requireMapping(vars, section + "/" + host)
        );
    }

    private static Map<String, Object> normalizeGroups(Map<String, Object> tree, String section) {
        var result = new LinkedHashMap<String, Object>();
        tree.forEach((name, value) -> {
            if (META.equals(name)) {
                result.put(name, Trees.copy(value));
            } else {
                result.put(name, TypeGuard.convertSequenceToMapping(value, section + "/" + name));
            }
        });
        return result;
    }

    private static Map<String, Object> normalize(
        String environment,
        Map<String, Object> hosts,
        Map<String, Object> groupVars,
        Map<String, Object> hostVars
    ) {
        var inventory = new LinkedHashMap<String, Object>();

        Map<String, Object> meta = new LinkedHashMap<>();
        if (hosts.get(META) != null) {
            meta = Trees.copyMapping(TypeGuard.requireMapping(hosts.get(META), META));
        }
        Map<String, Object> hostvars = meta.get(HOSTVARS) == null
            ? new LinkedHashMap<>()
            : Trees.copyMapping(TypeGuard.requireMapping(meta.get(HOSTVARS), META + "/" + HOSTVARS));
        for (var entry : hostvars.entrySet()) {
            TypeGuard.requireMapping(entry.getValue(), META + "/" + HOSTVARS + "/" + entry.getKey());
        }
        meta.put(HOSTVARS, hostvars);
        inventory.put(META, meta);
        inventory.put(ALL, new LinkedHashMap<String, Object>());

        hosts.forEach((name, value) -> {
            if (!META.equals(name)) {
                inventory.put(name, normalizeGroup(name, TypeGuard.convertSequenceToMapping(value, name)));
            }
        });
        inventory.put(ALL, normalizeGroup(ALL, inventory.get(ALL)));

        groupVars.forEach((name, vars) -> {
            String section = FragmentCategory.GROUP_VARS.configKey() + "/" + name;
            if (META.equals(name)) {
                throw new InventoryException(ErrorKind.TYPE_MISMATCH, "'" + META + "' is not a group in section '" + section + "'");
            }
            Map<String, Object> incoming = TypeGuard.requireMapping(vars, section);
            var group = Trees.copyMapping(TypeGuard.requireMapping(
                inventory.getOrDefault(name, normalizeGroup(name, new LinkedHashMap<String, Object>())),
                name
            ));
            group.put(VARS, TreeMerger.overlayMappings(TypeGuard.requireMapping(group.get(VARS), name + "/" + VARS), incoming));
            inventory.put(name, group);
        });

        Map<String, Object> allVars = TypeGuard.requireMapping(
            TypeGuard.requireMapping(inventory.get(ALL), ALL).get(VARS),
            ALL + "/" + VARS
        );
        allVars.putIfAbsent(PLATFORM_NAME, environment);

        hostVars.forEach((host, vars) -> {
            String section = FragmentCategory.HOST_VARS.configKey() + "/" + host;
            Map<String, Object> incoming = TypeGuard.requireMapping(vars, section);
            Map<String, Object> existing = hostvars.containsKey(host)
                ? TypeGuard.requireMapping(hostvars.get(host), META + "/" + HOSTVARS + "/" + host)
                : Map.of();
            hostvars.put(host, TreeMerger.overlayMappings(existing, incoming));
        });
        return inventory;
    }

    private static Map<String, Object> normalizeGroup(String name, Object value) {
        var group = Trees.copyMapping(TypeGuard.requireMapping(value, name));
        if (group.containsKey(HOSTS) && group.get(HOSTS) != null) {
            TypeGuard.assertType(group.get(HOSTS), EnumSet.of(TreeKind.SEQUENCE), name + "/" + HOSTS);
        } else {
            group.remove(HOSTS);
        }
        if (group.get(VARS) == null) {
            group.put(VARS, new LinkedHashMap<String, Object>());
        } else {
            TypeGuard.requireMapping(group.get(VARS), name + "/" + VARS);
        }
        return group;
    }

    private void transition(BuildState next) {
        log.debug("Inventory build {} -> {}", state, next);
        state = next;
    }

    private static Map<String, Object> contextOf(Object... pairs) {
        var context = new LinkedHashMap<String, Object>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            if (pairs[i + 1] != null) {
                context.put(String.valueOf(pairs[i]), pairs[i + 1]);
            }
        }
        return context;
    }
}
