package work.lcod.inventory.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.inventory.tree.TreeKind;
import work.lcod.inventory.tree.TypeGuard;

/**
 * Ordered fragment references of one environment, decoded from the root configuration.
 */
public record EnvironmentDefinition(String name, Map<FragmentCategory, List<FragmentRef>> references) {
    public EnvironmentDefinition {
        Objects.requireNonNull(name, "name");
        var copy = new EnumMap<FragmentCategory, List<FragmentRef>>(FragmentCategory.class);
        for (var category : FragmentCategory.values()) {
            copy.put(category, List.copyOf(references.getOrDefault(category, List.of())));
        }
        references = Collections.unmodifiableMap(copy);
    }

    public static EnvironmentDefinition empty(String name) {
        return new EnvironmentDefinition(name, Map.of());
    }

    /**
     * Decodes an {@code environments.<name>} entry. A null entry is an environment with no fragments.
     */
    public static EnvironmentDefinition parse(String name, Object raw) {
        if (raw == null) {
            return empty(name);
        }
        Map<String, Object> entry = TypeGuard.requireMapping(raw, name);
        var references = new EnumMap<FragmentCategory, List<FragmentRef>>(FragmentCategory.class);
        var hosts = new ArrayList<FragmentRef>();
        hosts.addAll(parseList(name, FragmentCategory.LEGACY_INCLUDE, entry.get(FragmentCategory.LEGACY_INCLUDE)));
        hosts.addAll(parseList(name, FragmentCategory.HOSTS.configKey(), entry.get(FragmentCategory.HOSTS.configKey())));
        references.put(FragmentCategory.HOSTS, hosts);
        for (var category : EnumSet.of(FragmentCategory.GROUP_VARS, FragmentCategory.HOST_VARS)) {
            references.put(category, parseList(name, category.configKey(), entry.get(category.configKey())));
        }
        return new EnvironmentDefinition(name, references);
    }

    public List<FragmentRef> references(FragmentCategory category) {
        return references.get(category);
    }

    private static List<FragmentRef> parseList(String environment, String key, Object raw) {
        if (raw == null) {
            return List.of();
        }
        String context = environment + ":" + key;
        TypeGuard.assertType(raw, EnumSet.of(TreeKind.SEQUENCE), context);
        var refs = new ArrayList<FragmentRef>();
        int index = 0;
        for (var item : (List<?>) raw) {
            refs.add(FragmentRef.parse(item, context + "[" + index + "]"));
            index++;
        }
        return refs;
    }
}
