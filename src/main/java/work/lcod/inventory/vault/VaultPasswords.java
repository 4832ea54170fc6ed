package work.lcod.inventory.vault;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Reads the vault password file. {@code /dev/null} disables decryption.
 */
public final class VaultPasswords {
    private static final Logger log = LoggerFactory.getLogger(VaultPasswords.class);
    public static final String DISABLED = "/dev/null";

    private VaultPasswords() {}

    /**
     * @param file     password file location
     * @param explicit whether the caller named the file (flag or environment variable); a missing
     *                 explicit file is an error, a missing default one just disables decryption
     */
    public static Optional<String> load(Path file, boolean explicit) {
        if (file == null || DISABLED.equals(file.toString())) {
            log.debug("Vault decryption disabled");
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            if (explicit) {
                throw new InventoryException(ErrorKind.NOT_FOUND, "vault password file not found: " + file);
            }
            log.info("No vault password file at {}, vault decryption disabled", file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8).strip());
        } catch (IOException ex) {
            throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "unable to read vault password file " + file, ex);
        }
    }
}
