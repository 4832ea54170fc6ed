package work.lcod.inventory.tree;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Pure merge functions over plain trees. Inputs are never modified; every result is a fresh copy.
 *
 * <p>{@link #union} is used for host fragments: mappings merge recursively, sequences merge as an
 * order-preserving set union, and any other collision must agree or fails with
 * {@link ErrorKind#TYPE_MISMATCH}. {@link #overlay} is used for variables: mappings merge
 * recursively and anything else is replaced by the incoming value.
 */
public final class TreeMerger {
    private TreeMerger() {}

    public static Object union(Object base, Object incoming, String context) {
        TreeKind baseKind = TreeKind.of(base);
        TreeKind incomingKind = TreeKind.of(incoming);
        if (baseKind == TreeKind.MAPPING && incomingKind == TreeKind.MAPPING) {
            var result = Trees.copyMapping(Trees.asMapping(base));
            Trees.asMapping(incoming).forEach((key, value) -> {
                if (result.containsKey(key)) {
                    result.put(key, union(result.get(key), value, child(context, key)));
                } else {
                    result.put(key, Trees.copy(value));
                }
            });
            return result;
        }
        if (baseKind == TreeKind.SEQUENCE && incomingKind == TreeKind.SEQUENCE) {
            return unionSequences(Trees.asSequence(base), Trees.asSequence(incoming));
        }
        if (baseKind == TreeKind.SCALAR && incomingKind == TreeKind.SCALAR && Objects.equals(base, incoming)) {
            return incoming;
        }
        throw new InventoryException(
            ErrorKind.TYPE_MISMATCH,
            "cannot merge " + incomingKind.label() + " into " + baseKind.label() + " at '" + context + "'"
                + (baseKind == TreeKind.SCALAR && incomingKind == TreeKind.SCALAR
                    ? " (conflicting values '" + base + "' and '" + incoming + "')"
                    : "")
        );
    }

    public static Object overlay(Object base, Object incoming) {
        if (TreeKind.of(base) == TreeKind.MAPPING && TreeKind.of(incoming) == TreeKind.MAPPING) {
            var result = Trees.copyMapping(Trees.asMapping(base));
            Trees.asMapping(incoming).forEach((key, value) ->
                result.put(key, result.containsKey(key) ? overlay(result.get(key), value) : Trees.copy(value))
            );
            return result;
        }
        return Trees.copy(incoming);
    }

    /**
     * Merges {@code incoming} into the subtree of {@code root} addressed by {@code key}. An absent target
     * is created verbatim from {@code incoming}.
     */
    public static Map<String, Object> mergeAt(
        Map<String, Object> root,
        KeyPath key,
        Object incoming,
        MergePolicy policy,
        String context
    ) {
        var existing = key.get(root);
        if (existing.isEmpty()) {
            return key.with(root, incoming);
        }
        return key.with(root, policy.merge(existing.get(), incoming, child(context, key.display())));
    }

    private static List<Object> unionSequences(List<Object> base, List<Object> incoming) {
        var seen = new LinkedHashSet<Object>(base.size() + incoming.size());
        seen.addAll(base);
        seen.addAll(incoming);
        var result = new ArrayList<Object>(seen.size());
        for (var item : seen) {
            result.add(Trees.copy(item));
        }
        return result;
    }

    static String child(String context, String key) {
        if (context == null || context.isEmpty()) {
            return key;
        }
        return context + "/" + key;
    }

    /**
     * Root-level merge used when both sides must be mappings.
     */
    public static Map<String, Object> unionMappings(Map<String, Object> base, Map<String, Object> incoming, String context) {
        return Trees.asMapping(union(base, incoming, context));
    }

    public static Map<String, Object> overlayMappings(Map<String, Object> base, Map<String, Object> incoming) {
        return Trees.asMapping(overlay(base, incoming));
    }
}
