package work.lcod.inventory.fetch;

import java.net.URI;

/**
 * Raw byte retrieval for one family of URI schemes.
 *
 * <p>Implementations fail with {@code NOT_FOUND} when the resource does not exist and with
 * {@code RETRIEVAL_FAILED} for any other transport problem.
 */
public interface Transport {
    byte[] read(URI uri);
}
