package work.lcod.inventory.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InventoryExceptionTest {
    @Test
    void rendersKindDetailAndContext() {
        var ex = new InventoryException(ErrorKind.NOT_FOUND, "The file x.yml was not found")
            .withContext(Map.of("uri", "file:/x.yml"));
        assertEquals("[NOT_FOUND] The file x.yml was not found (uri=file:/x.yml)", ex.getMessage());
        assertEquals("The file x.yml was not found", ex.detail());
    }

    @Test
    void innerContextWinsAndNullsAreSkipped() {
        var outer = new LinkedHashMap<String, Object>();
        outer.put("environment", "prod");
        outer.put("uri", "file:/outer.yml");
        outer.put("key", null);
        var ex = new InventoryException(ErrorKind.PARSE_ERROR, "bad")
            .withContext(Map.of("uri", "file:/inner.yml"))
            .withContext(outer);
        assertEquals(List.of("environment", "uri"), List.copyOf(ex.context().keySet()));
        assertEquals("file:/inner.yml", ex.context().get("uri"));
        assertEquals(ErrorKind.PARSE_ERROR, ex.kind());
    }

    @Test
    void keepsCause() {
        var cause = new IOException("boom");
        var ex = new InventoryException(ErrorKind.RETRIEVAL_FAILED, "read failed", cause).withContext(Map.of("uri", "u"));
        assertSame(cause, ex.getCause());
    }
}
