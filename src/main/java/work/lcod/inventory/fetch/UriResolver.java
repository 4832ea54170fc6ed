package work.lcod.inventory.fetch;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Turns fragment references into absolute URIs relative to the root configuration URI.
 */
public final class UriResolver {
    static final Set<String> SUPPORTED_SCHEMES = Set.of("file", "http", "https");
    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*:");

    private final URI base;

    public UriResolver(URI base) {
        this.base = Objects.requireNonNull(base, "base");
    }

    public URI base() {
        return base;
    }

    /**
     * Normalizes the root configuration location. Plain paths (optionally starting with {@code ~/}) are
     * made absolute against the working directory and turned into {@code file:} URIs.
     */
    public static URI rootUri(String raw) {
        Objects.requireNonNull(raw, "raw");
        String trimmed = raw.trim();
        if (hasScheme(trimmed)) {
            URI uri = parse(trimmed);
            requireSupported(uri);
            if ("file".equals(scheme(uri)) && uri.isOpaque()) {
                return Path.of(uri.getSchemeSpecificPart()).toAbsolutePath().normalize().toUri();
            }
            return uri;
        }
        if (trimmed.equals("~") || trimmed.startsWith("~/")) {
            trimmed = System.getProperty("user.home") + trimmed.substring(1);
        }
        return Path.of(trimmed).toAbsolutePath().normalize().toUri();
    }

    public URI resolve(String ref) {
        Objects.requireNonNull(ref, "ref");
        String trimmed = ref.trim();
        if (!hasScheme(trimmed)) {
            return base.resolve(relative(trimmed));
        }
        URI uri = parse(trimmed);
        requireSupported(uri);
        String path = uri.isOpaque() ? uri.getSchemeSpecificPart() : uri.getRawPath();
        if (path != null && path.startsWith("/")) {
            return uri;
        }
        return base.resolve(relative(path == null ? "" : path));
    }

    static String scheme(URI uri) {
        return uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    }

    private static boolean hasScheme(String value) {
        return SCHEME.matcher(value).find();
    }

    private static void requireSupported(URI uri) {
        if (!SUPPORTED_SCHEMES.contains(scheme(uri))) {
            throw new InventoryException(ErrorKind.UNSUPPORTED_SCHEME, "unsupported URI scheme '" + uri.getScheme() + "' in " + uri);
        }
    }

    private static URI parse(String value) {
        try {
            return new URI(value);
        } catch (URISyntaxException ex) {
            throw new InventoryException(ErrorKind.NOT_FOUND, "malformed URI '" + value + "': " + ex.getReason(), ex);
        }
    }

    private static URI relative(String path) {
        try {
            return new URI(path);
        } catch (URISyntaxException ex) {
            try {
                // quote characters such as spaces that are legal in file names but not in URIs
                return new URI(null, null, path, null);
            } catch (URISyntaxException nested) {
                throw new InventoryException(ErrorKind.NOT_FOUND, "malformed reference '" + path + "'", nested);
            }
        }
    }
}
