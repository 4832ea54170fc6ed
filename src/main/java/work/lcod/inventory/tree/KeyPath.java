package work.lcod.inventory.tree;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Address of a subtree inside a mapping tree.
 *
 * <p>Parsed from either a string or a sequence of strings. A string containing {@code /} is split on
 * {@code /} (so {@code /web01.example.com} addresses a single dotted key), any other string is split
 * on {@code .}. Empty segments are dropped.
 */
public record KeyPath(List<String> segments) {
    public KeyPath {
        Objects.requireNonNull(segments, "segments");
        segments = List.copyOf(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("key path must have at least one segment");
        }
    }

    public static KeyPath parse(Object raw, String context) {
        var parts = new ArrayList<String>();
        if (raw instanceof List<?> list) {
            for (var item : list) {
                TypeGuard.assertType(item, EnumSet.of(TreeKind.SCALAR), context);
                if (item != null && !String.valueOf(item).isEmpty()) {
                    parts.add(String.valueOf(item));
                }
            }
        } else if (raw instanceof String str) {
            String separator = str.indexOf('/') >= 0 ? "/" : "\\.";
            for (var segment : str.split(separator)) {
                if (!segment.isEmpty()) {
                    parts.add(segment);
                }
            }
        } else {
            TypeGuard.assertType(raw, EnumSet.of(TreeKind.SCALAR, TreeKind.SEQUENCE), context);
            if (raw != null) {
                parts.add(String.valueOf(raw));
            }
        }
        if (parts.isEmpty()) {
            throw new InventoryException(ErrorKind.TYPE_MISMATCH, "empty key path in section '" + context + "'");
        }
        return new KeyPath(parts);
    }

    /**
     * Looks up the addressed value. Missing segments and nulls yield empty; a non-mapping on the way is a mismatch.
     */
    public Optional<Object> get(Map<String, Object> root) {
        Object current = root;
        for (int i = 0; i < segments.size(); i++) {
            if (current == null) {
                return Optional.empty();
            }
            var mapping = TypeGuard.requireMapping(current, display(i));
            String segment = segments.get(i);
            if (!mapping.containsKey(segment)) {
                return Optional.empty();
            }
            current = mapping.get(segment);
        }
        return Optional.ofNullable(current);
    }

    /**
     * Returns a copy of {@code root} with {@code value} stored at this path, creating intermediate
     * mappings as needed.
     */
    public Map<String, Object> with(Map<String, Object> root, Object value) {
        var result = Trees.copyMapping(root);
        Map<String, Object> current = result;
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            Object next = current.get(segment);
            if (next == null) {
                next = new LinkedHashMap<String, Object>();
                current.put(segment, next);
            }
            current = TypeGuard.requireMapping(next, display(i + 1));
        }
        current.put(segments.get(segments.size() - 1), Trees.copy(value));
        return result;
    }

    public String display() {
        return String.join("/", segments);
    }

    private String display(int depth) {
        return depth == 0 ? "/" : String.join("/", segments.subList(0, depth));
    }

    @Override
    public String toString() {
        return display();
    }
}
