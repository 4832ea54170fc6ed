package work.lcod.inventory.runtime;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;
import work.lcod.inventory.fetch.FragmentFormat;
import work.lcod.inventory.tree.KeyPath;
import work.lcod.inventory.tree.TreeKind;
import work.lcod.inventory.tree.TypeGuard;

/**
 * One entry of an environment's include list: a bare URI or a {@code {path, key?, format?}} mapping.
 */
public interface FragmentRef {
    String path();

    Optional<KeyPath> key();

    Optional<FragmentFormat> format();

    /**
     * Decodes a raw list entry. {@code context} names the entry for error messages, e.g.
     * {@code prod:include_hosts[2]}.
     */
    static FragmentRef parse(Object raw, String context) {
        if (raw instanceof String uri) {
            return new Bare(uri);
        }
        Map<String, Object> entry = TypeGuard.requireMapping(raw, context);
        Object path = entry.get("path");
        if (!(path instanceof String) || ((String) path).isBlank()) {
            throw new InventoryException(ErrorKind.TYPE_MISMATCH, "missing 'path' in section '" + context + "'");
        }
        Optional<KeyPath> key = entry.containsKey("key") && entry.get("key") != null
            ? Optional.of(KeyPath.parse(entry.get("key"), context + ".key"))
            : Optional.empty();
        Object rawFormat = entry.get("format");
        if (rawFormat != null) {
            TypeGuard.assertType(rawFormat, EnumSet.of(TreeKind.SCALAR), context + ".format");
        }
        Optional<FragmentFormat> format = rawFormat == null
            ? Optional.empty()
            : Optional.of(FragmentFormat.fromName(String.valueOf(rawFormat)));
        return new Keyed((String) path, key, format);
    }

    /**
     * A plain URI merged at the root of the working tree.
     */
    record Bare(String path) implements FragmentRef {
        public Bare {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public Optional<KeyPath> key() {
            return Optional.empty();
        }

        @Override
        public Optional<FragmentFormat> format() {
            return Optional.empty();
        }
    }

    /**
     * A structured reference; without a key it merges at the root like {@link Bare}.
     */
    record Keyed(String path, Optional<KeyPath> key, Optional<FragmentFormat> format) implements FragmentRef {
        public Keyed {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(format, "format");
        }
    }
}
