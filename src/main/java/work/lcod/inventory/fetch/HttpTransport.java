package work.lcod.inventory.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

/**
 * Fetches {@code http:}/{@code https:} URIs with a bounded per-request timeout. One client (and its
 * connection pool) is shared by every fragment of an invocation.
 */
public final class HttpTransport implements Transport {
    private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);

    private final HttpClient client;
    private final Duration timeout;

    public HttpTransport(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public byte[] read(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        try {
            log.debug("GET {}", uri);
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 404) {
                throw new InventoryException(ErrorKind.NOT_FOUND, "Failed to find data at: " + uri);
            }
            if (status < 200 || status >= 300) {
                throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "HTTP " + status + " while fetching " + uri);
            }
            return response.body();
        } catch (HttpTimeoutException ex) {
            throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "Timed out after " + timeout + " fetching " + uri, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "Interrupted while fetching " + uri, ex);
        } catch (IOException ex) {
            throw new InventoryException(ErrorKind.RETRIEVAL_FAILED, "Failed to fetch " + uri + ": " + ex.getMessage(), ex);
        }
    }
}
