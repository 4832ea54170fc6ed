package work.lcod.inventory.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.inventory.tree.Trees;

/**
 * Final, immutable inventory for one environment.
 */
public record InventoryDocument(String environment, Map<String, Object> tree) {
    public static final String META = "_meta";
    public static final String HOSTVARS = "hostvars";
    public static final String ALL = "all";
    public static final String HOSTS = "hosts";
    public static final String VARS = "vars";
    public static final String PLATFORM_NAME = "platform_name";

    public InventoryDocument {
        Objects.requireNonNull(environment, "environment");
        tree = Trees.freeze(tree);
    }

    /**
     * Top-level group names (everything except {@code _meta}), sorted.
     */
    public List<String> groups() {
        var names = new ArrayList<String>();
        for (var key : tree.keySet()) {
            if (!META.equals(key)) {
                names.add(key);
            }
        }
        names.sort(null);
        return names;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> hostvars() {
        return (Map<String, Object>) ((Map<String, Object>) tree.get(META)).get(HOSTVARS);
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> group(String name) {
        return (Map<String, Object>) tree.get(name);
    }
}
