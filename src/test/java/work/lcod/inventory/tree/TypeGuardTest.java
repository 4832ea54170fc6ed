package work.lcod.inventory.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;

class TypeGuardTest {
    @Test
    void reportsActualKind() {
        assertEquals(TreeKind.SEQUENCE, TypeGuard.assertType(List.of(), EnumSet.allOf(TreeKind.class), "x"));
        var ex = assertThrows(InventoryException.class, () ->
            TypeGuard.assertType("text", EnumSet.of(TreeKind.MAPPING, TreeKind.SEQUENCE), "hosts/web")
        );
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("invalid type 'scalar' in section 'hosts/web', must be: mapping or sequence", ex.detail());
    }

    @Test
    void convertsSequenceGroupsToMappings() {
        assertEquals(Map.of("hosts", List.of("h1")), TypeGuard.convertSequenceToMapping(List.of("h1"), "web"));
        var group = Map.<String, Object>of("hosts", List.of("h1"), "vars", Map.of());
        assertEquals(group, TypeGuard.convertSequenceToMapping(group, "web"));
    }

    @Test
    void rejectsScalarAndNullGroups() {
        assertThrows(InventoryException.class, () -> TypeGuard.convertSequenceToMapping("h1", "web"));
        assertThrows(InventoryException.class, () -> TypeGuard.convertSequenceToMapping(null, "web"));
    }
}
