package work.lcod.inventory.fetch;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;
import work.lcod.inventory.vault.Vault;

/**
 * Retrieves a fragment through the transport registered for its scheme, decrypts vault payloads and
 * parses the result into a plain tree.
 */
public final class FragmentLoader {
    private static final Logger log = LoggerFactory.getLogger(FragmentLoader.class);

    private final Map<String, Transport> transports;
    private final Optional<Vault> vault;

    public FragmentLoader(Map<String, Transport> transports, Optional<Vault> vault) {
        this.transports = Map.copyOf(Objects.requireNonNull(transports, "transports"));
        this.vault = Objects.requireNonNull(vault, "vault");
    }

    public static FragmentLoader standard(HttpTransport http, Optional<Vault> vault) {
        var file = new FileTransport();
        return new FragmentLoader(Map.of("file", file, "", file, "http", http, "https", http), vault);
    }

    public Object load(URI uri) {
        return load(uri, Optional.empty());
    }

    public Object load(URI uri, Optional<FragmentFormat> format) {
        try {
            return fetchAndParse(uri, format);
        } catch (InventoryException ex) {
            throw ex.withContext(Map.of("uri", uri));
        }
    }

    private Object fetchAndParse(URI uri, Optional<FragmentFormat> format) {
        // the format is resolved before any bytes are fetched
        FragmentFormat effective = format.orElseGet(() -> FragmentFormat.infer(uri));
        Transport transport = transports.get(UriResolver.scheme(uri));
        if (transport == null) {
            throw new InventoryException(ErrorKind.UNSUPPORTED_SCHEME, "unsupported URI '" + uri + "'");
        }
        String text = decode(transport.read(uri), uri).strip();
        if (Vault.isEncrypted(text)) {
            if (vault.isEmpty()) {
                log.warn("{} is vault encrypted but no vault password was supplied; treating it as an empty mapping", uri);
                return new LinkedHashMap<String, Object>();
            }
            log.debug("Decrypting vault payload from {}", uri);
            text = vault.get().decrypt(text);
        }
        return effective.parse(text, uri);
    }

    private static String decode(byte[] bytes, URI uri) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException ex) {
            throw new InventoryException(ErrorKind.PARSE_ERROR, uri + " is not valid UTF-8: " + ex, ex);
        }
    }
}
