package work.lcod.inventory.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy and freeze helpers for plain {@code Map}/{@code List}/scalar trees.
 */
public final class Trees {
    private Trees() {}

    /**
     * Deep copy into mutable {@link LinkedHashMap}/{@link ArrayList} containers. Scalars are shared.
     */
    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMapping(map);
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(copy(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, Object> copyMapping(Map<?, ?> map) {
        var copy = new LinkedHashMap<String, Object>();
        map.forEach((key, item) -> copy.put(String.valueOf(key), copy(item)));
        return copy;
    }

    /**
     * Deep copy into unmodifiable containers.
     */
    @SuppressWarnings("unchecked")
    public static <T> T freeze(T value) {
        if (value instanceof Map<?, ?> map) {
            var frozen = new LinkedHashMap<String, Object>();
            map.forEach((key, item) -> frozen.put(String.valueOf(key), freeze(item)));
            return (T) Collections.unmodifiableMap(frozen);
        }
        if (value instanceof List<?> list) {
            var frozen = new ArrayList<Object>(list.size());
            for (var item : list) {
                frozen.add(freeze(item));
            }
            return (T) Collections.unmodifiableList(frozen);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMapping(Object value) {
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Object> asSequence(Object value) {
        return (List<Object>) value;
    }
}
