package work.lcod.inventory.tree;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Structural checks applied to fragments before and during merging.
 */
public final class TypeGuard {
    private TypeGuard() {}

    public static TreeKind assertType(Object value, Set<TreeKind> allowed, String context) {
        TreeKind actual = TreeKind.of(value);
        if (!allowed.contains(actual)) {
            throw mismatch(actual, allowed, context);
        }
        return actual;
    }

    public static Map<String, Object> requireMapping(Object value, String context) {
        assertType(value, EnumSet.of(TreeKind.MAPPING), context);
        return Trees.asMapping(value);
    }

    /**
     * Normalizes a group value: a sequence becomes {@code {hosts: value}}, a mapping passes through.
     * The returned value is a fresh copy.
     */
    public static Map<String, Object> convertSequenceToMapping(Object value, String context) {
        TreeKind kind = assertType(value, EnumSet.of(TreeKind.MAPPING, TreeKind.SEQUENCE), context);
        if (kind == TreeKind.SEQUENCE) {
            var group = new LinkedHashMap<String, Object>();
            group.put("hosts", Trees.copy(value));
            return group;
        }
        return Trees.copyMapping(Trees.asMapping(value));
    }

    static InventoryException mismatch(TreeKind actual, Set<TreeKind> allowed, String context) {
        String names = allowed.stream().map(TreeKind::label).collect(Collectors.joining(" or "));
        return new InventoryException(
            ErrorKind.TYPE_MISMATCH,
            "invalid type '" + actual.label() + "' in section '" + context + "', must be: " + names
        );
    }
}
