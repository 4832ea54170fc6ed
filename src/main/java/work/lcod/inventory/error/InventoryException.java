package work.lcod.inventory.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exception carrying an {@link ErrorKind} plus the location (environment, category, uri, key)
 * where the build failed.
 */
public final class InventoryException extends RuntimeException {
    private final ErrorKind kind;
    private final String detail;
    private final Map<String, Object> context;

    public InventoryException(ErrorKind kind, String detail) {
        this(kind, detail, Map.of(), null);
    }

    public InventoryException(ErrorKind kind, String detail, Throwable cause) {
        this(kind, detail, Map.of(), cause);
    }

    private InventoryException(ErrorKind kind, String detail, Map<String, Object> context, Throwable cause) {
        super(render(kind, detail, context), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ErrorKind kind() {
        return kind;
    }

    public String detail() {
        return detail;
    }

    public Map<String, Object> context() {
        return context;
    }

    /**
     * Returns a copy of this failure with {@code extra} added to its context.
     * Entries already present win so the innermost location is kept.
     */
    public InventoryException withContext(Map<String, ?> extra) {
        var merged = new LinkedHashMap<String, Object>();
        extra.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });
        merged.putAll(context);
        var enriched = new InventoryException(kind, detail, merged, getCause());
        enriched.setStackTrace(getStackTrace());
        return enriched;
    }

    private static String render(ErrorKind kind, String detail, Map<String, Object> context) {
        var builder = new StringBuilder();
        builder.append('[').append(kind).append("] ").append(detail == null ? "" : detail);
        if (!context.isEmpty()) {
            builder.append(" (");
            boolean first = true;
            for (var entry : context.entrySet()) {
                if (!first) {
                    builder.append(", ");
                }
                builder.append(entry.getKey()).append('=').append(entry.getValue());
                first = false;
            }
            builder.append(')');
        }
        return builder.toString();
    }
}
