package work.lcod.inventory.fetch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Locale;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Document formats understood by the loader and used for output.
 */
public enum FragmentFormat {
    YAML(new ObjectMapper(new YAMLFactory()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))),
    JSON(new ObjectMapper());

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    FragmentFormat(ObjectMapper mapper) {
        this.mapper = mapper;
        this.writer = mapper.writerWithDefaultPrettyPrinter();
    }

    public static FragmentFormat fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new InventoryException(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported data type: " + value);
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        switch (normalized) {
            case "yaml":
            case "yml":
                return YAML;
            case "json":
                return JSON;
            default:
                throw new InventoryException(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported data type: " + value);
        }
    }

    /**
     * Infers the format from the suffix of the URI path.
     */
    public static FragmentFormat infer(URI uri) {
        String path = uri.isOpaque() ? uri.getSchemeSpecificPart() : uri.getPath();
        if (path == null) {
            path = "";
        }
        int slash = path.lastIndexOf('/');
        String name = path.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new InventoryException(ErrorKind.UNSUPPORTED_FORMAT, "Unsupported data type: no file extension on " + uri);
        }
        return fromName(name.substring(dot));
    }

    /**
     * Parses {@code text} into plain maps, lists and scalars. Empty documents parse as an empty mapping.
     */
    public Object parse(String text, URI source) {
        try {
            JsonNode root = mapper.readTree(text);
            if (root == null || root.isMissingNode() || root.isNull()) {
                return new LinkedHashMap<String, Object>();
            }
            return convertNode(root);
        } catch (JsonProcessingException ex) {
            throw new InventoryException(
                ErrorKind.PARSE_ERROR,
                "Unable to parse " + name().toLowerCase(Locale.ROOT) + " from " + source + ": " + ex.getOriginalMessage(),
                ex
            );
        }
    }

    public String write(Object tree) {
        try {
            return writer.writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize inventory as " + name().toLowerCase(Locale.ROOT), ex);
        }
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
