package work.lcod.inventory.fetch;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Reads {@code file:} URIs from the local filesystem.
 */
public final class FileTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(FileTransport.class);

    @Override
    public byte[] read(URI uri) {
        Path path = toPath(uri);
        if (!Files.isRegularFile(path)) {
            throw new InventoryException(ErrorKind.NOT_FOUND, "The file " + path + " was not found");
        }
        try {
            log.debug("Reading {}", path);
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "Could not read file " + path + ": " + ex.getMessage(), ex);
        }
    }

    static Path toPath(URI uri) {
        if (uri.getScheme() == null) {
            return Path.of(uri.getPath()).toAbsolutePath().normalize();
        }
        try {
            return Path.of(uri).toAbsolutePath().normalize();
        } catch (IllegalArgumentException ex) {
            throw new InventoryException(ErrorKind.NOT_FOUND, "not a local file URI: " + uri, ex);
        }
    }
}
