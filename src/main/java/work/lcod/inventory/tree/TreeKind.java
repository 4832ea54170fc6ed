package work.lcod.inventory.tree;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shape of a tree value: mapping, sequence or anything else (scalar, including null).
 */
public enum TreeKind {
    MAPPING,
    SEQUENCE,
    SCALAR;

    public static TreeKind of(Object value) {
        if (value instanceof Map<?, ?>) {
            return MAPPING;
        }
        if (value instanceof List<?>) {
            return SEQUENCE;
        }
        return SCALAR;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
