package work.lcod.inventory.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.inventory.support.InventoryTestSupport.VAULT_PASSWORD;
import static work.lcod.inventory.support.InventoryTestSupport.read;
import static work.lcod.inventory.support.InventoryTestSupport.resource;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lcod.inventory.error.ErrorKind;
import work.lcod.inventory.error.InventoryException;
import work.lcod.inventory.support.InventoryTestSupport.InMemoryTransport;
import work.lcod.inventory.vault.Vault;

class InventoryBuilderTest {
    private static final String ROOT = "http://config.test/inventory/config.yml";

    private final InMemoryTransport transport = new InMemoryTransport();

    private InventoryBuilder builder() {
        return new InventoryBuilder(URI.create(ROOT), transport.loader());
    }

    @Test
    void buildsProdInventoryFromHostsAndGroupVars() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [hosts.yml]\n    include_group_vars: [groups.yml]\n")
            .put("http://config.test/inventory/hosts.yml", "web: [host1]\n")
            .put("http://config.test/inventory/groups.yml", "web: {role: frontend}\n");

        var builder = builder();
        var document = builder.build("prod");

        assertEquals(
            Map.of(
                "_meta", Map.of("hostvars", Map.of()),
                "all", Map.of("vars", Map.of("platform_name", "prod")),
                "web", Map.of("hosts", List.of("host1"), "vars", Map.of("role", "frontend"))
            ),
            document.tree()
        );
        assertEquals(List.of("_meta", "all", "web"), List.copyOf(document.tree().keySet()));
        assertEquals(BuildState.DONE, builder.state());
    }

    @Test
    void unionsHostFragmentsInDeclaredOrder() {
        transport
            .put(ROOT, "environments:\n  dev:\n    include_hosts: [a.yml, b.json]\n")
            .put("http://config.test/inventory/a.yml", "grp: [h1, h2]\n")
            .put("http://config.test/inventory/b.json", "{\"grp\": {\"hosts\": [\"h2\", \"h3\"]}}");

        var document = builder().build("dev");

        assertEquals(List.of("h1", "h2", "h3"), document.group("grp").get("hosts"));
        assertEquals(Map.of(), document.group("grp").get("vars"));
    }

    @Test
    void resolvesReferencesAgainstRootUri() {
        transport
            .put(ROOT, "environments:\n  dev:\n    include_hosts:\n      - hosts/a.yml\n      - ../shared/b.yml\n      - http://other.test/c.yml\n")
            .put("http://config.test/inventory/hosts/a.yml", "a: [h1]\n")
            .put("http://config.test/shared/b.yml", "b: [h2]\n")
            .put("http://other.test/c.yml", "c: [h3]\n");

        assertEquals(List.of("_meta", "all", "a", "b", "c"), List.copyOf(builder().build("dev").tree().keySet()));
        assertEquals(
            List.of(
                URI.create(ROOT),
                URI.create("http://config.test/inventory/hosts/a.yml"),
                URI.create("http://config.test/shared/b.yml"),
                URI.create("http://other.test/c.yml")
            ),
            transport.requests()
        );
    }

    @Test
    void keyedHostReferenceMergesIntoSubtree() {
        transport
            .put(ROOT, "environments:\n  dev:\n    include_hosts:\n      - hosts.yml\n      - {path: extra.yml, key: app/hosts}\n      - {path: db.yml, key: db.hosts}\n")
            .put("http://config.test/inventory/hosts.yml", "app: [h1]\n")
            .put("http://config.test/inventory/extra.yml", "- h1\n- h2\n")
            .put("http://config.test/inventory/db.yml", "[d1]\n");

        var document = builder().build("dev");

        assertEquals(List.of("h1", "h2"), document.group("app").get("hosts"));
        assertEquals(List.of("d1"), document.group("db").get("hosts"));
    }

    @Test
    void conflictingHostScalarsFailWithLocation() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [a.yml, b.yml]\n")
            .put("http://config.test/inventory/a.yml", "web: {vars: {port: 80}}\n")
            .put("http://config.test/inventory/b.yml", "web: {vars: {port: 81}}\n");

        var builder = builder();
        var ex = assertThrows(InventoryException.class, () -> builder.build("prod"));

        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("prod", ex.context().get("environment"));
        assertEquals("include_hosts", ex.context().get("category"));
        assertEquals(1, ex.context().get("fragment"));
        assertEquals(URI.create("http://config.test/inventory/b.yml"), ex.context().get("uri"));
        assertEquals(BuildState.FAILED, builder.state());
    }

    @Test
    void groupVarsOverlayInOrderAndCreateGroups() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [hosts.yml]\n    include_group_vars: [one.yml, two.yml]\n")
            .put("http://config.test/inventory/hosts.yml", "web: [w1]\n")
            .put("http://config.test/inventory/one.yml", "web: {port: 80, tls: false}\nall: {ntp: ntp1}\n")
            .put("http://config.test/inventory/two.yml", "web: {port: 81}\ncache: {size: 5}\n");

        var document = builder().build("prod");

        assertEquals(Map.of("port", 81, "tls", false), document.group("web").get("vars"));
        assertEquals(Map.of("ntp", "ntp1", "platform_name", "prod"), document.group("all").get("vars"));
        assertEquals(Map.of("vars", Map.of("size", 5)), document.group("cache"));
    }

    @Test
    void fragmentMayOverridePlatformName() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_group_vars: [all.yml]\n")
            .put("http://config.test/inventory/all.yml", "all: {platform_name: production}\n");

        assertEquals(Map.of("platform_name", "production"), builder().build("prod").group("all").get("vars"));
    }

    @Test
    void hostVarsLandInMetaHostvars() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [hosts.yml]\n    include_host_vars: [a.yml, {path: b.yml, key: /web01.example.com}]\n")
            .put("http://config.test/inventory/hosts.yml", "_meta: {hostvars: {w1: {rack: 1}}}\nweb: [w1]\n")
            .put("http://config.test/inventory/a.yml", "w1: {weight: 10}\n")
            .put("http://config.test/inventory/b.yml", "weight: 20\n");

        var document = builder().build("prod");

        assertEquals(
            Map.of("w1", Map.of("rack", 1, "weight", 10), "web01.example.com", Map.of("weight", 20)),
            document.hostvars()
        );
        assertEquals(List.of("all", "web"), document.groups());
    }

    @Test
    void nonMappingHostVarsAreRejected() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_host_vars: [a.yml]\n")
            .put("http://config.test/inventory/a.yml", "w1: [oops]\n");

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals(BuildState.MERGE_HOST_VARS, ex.context().get("stage"));
        assertEquals(URI.create("http://config.test/inventory/a.yml"), ex.context().get("uri"));
    }

    @Test
    void badGroupVarsFragmentIsReportedWithItsLocation() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_group_vars: [ok.yml, bad.yml]\n")
            .put("http://config.test/inventory/ok.yml", "web: {port: 80}\n")
            .put("http://config.test/inventory/bad.yml", "db: [oops]\n");

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));

        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("include_group_vars", ex.context().get("category"));
        assertEquals(1, ex.context().get("fragment"));
        assertEquals(URI.create("http://config.test/inventory/bad.yml"), ex.context().get("uri"));
        assertEquals(BuildState.MERGE_GROUP_VARS, ex.context().get("stage"));
        assertTrue(ex.getMessage().contains("prod:include_group_vars[1]/db"), ex.getMessage());
    }

    @Test
    void keyedHostVarsMustBeMappings() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_host_vars: [{path: w1.yml, key: /w1}]\n")
            .put("http://config.test/inventory/w1.yml", "[a, b]\n");

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));

        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("w1", ex.context().get("key"));
        assertEquals(URI.create("http://config.test/inventory/w1.yml"), ex.context().get("uri"));
    }

    @Test
    void hostvarsCarriedByHostFragmentAreChecked() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [good.yml, meta.yml]\n")
            .put("http://config.test/inventory/good.yml", "web: [w1]\n")
            .put("http://config.test/inventory/meta.yml", "_meta: {hostvars: {w1: rack-1}}\n");

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));

        assertEquals("include_hosts", ex.context().get("category"));
        assertEquals(URI.create("http://config.test/inventory/meta.yml"), ex.context().get("uri"));
    }

    @Test
    void invalidUtf8FragmentFails() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [latin1.yml]\n")
            .put("http://config.test/inventory/latin1.yml", "web: [caf\u00e9]\n".getBytes(StandardCharsets.ISO_8859_1));

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));

        assertEquals(ErrorKind.PARSE_ERROR, ex.kind());
        assertEquals(URI.create("http://config.test/inventory/latin1.yml"), ex.context().get("uri"));
    }

    @Test
    void legacyIncludesMergeAsHostsAndRejectConflictingVariables() {
        transport
            .put(ROOT, "environments:\n  old:\n    include: [a.yml, {path: vars.yml, key: web/vars}]\n  clash:\n    include: [a.yml, b.yml]\n")
            .put("http://config.test/inventory/a.yml", "web: {hosts: [w1], vars: {port: 80}}\n")
            .put("http://config.test/inventory/vars.yml", "tls: true\n")
            .put("http://config.test/inventory/b.yml", "web: {vars: {port: 81}}\n");

        var builder = builder();
        assertEquals(
            Map.of("hosts", List.of("w1"), "vars", Map.of("port", 80, "tls", true)),
            builder.build("old").group("web")
        );

        var ex = assertThrows(InventoryException.class, () -> builder.build("clash"));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("include_hosts", ex.context().get("category"));
    }

    @Test
    void unknownEnvironmentYieldsEmptyInventory() {
        transport.put(ROOT, "environments:\n  prod: {}\n");

        var builder = builder();
        var document = builder.build("staging");

        assertEquals(
            Map.of("_meta", Map.of("hostvars", Map.of()), "all", Map.of("vars", Map.of("platform_name", "staging"))),
            document.tree()
        );
        assertEquals(BuildState.DONE, builder.state());
    }

    @Test
    void missingFragmentFailsBuild() {
        transport.put(ROOT, "environments:\n  prod:\n    include_hosts: [missing.yml]\n");

        var builder = builder();
        var ex = assertThrows(InventoryException.class, () -> builder.build("prod"));

        assertEquals(ErrorKind.NOT_FOUND, ex.kind());
        assertEquals("missing.yml", ex.context().get("path"));
        assertEquals(BuildState.MERGE_HOSTS, ex.context().get("stage"));
        assertEquals(BuildState.FAILED, builder.state());
    }

    @Test
    void scalarHostFragmentIsRejected() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [a.yml]\n")
            .put("http://config.test/inventory/a.yml", "just-a-string\n");

        var ex = assertThrows(InventoryException.class, () -> builder().build("prod"));
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
    }

    @Test
    void encryptedFragmentWithoutPasswordIsEmpty() {
        transport
            .put(ROOT, "environments:\n  prod:\n    include_hosts: [hosts.yml]\n    include_group_vars: [secrets.yml]\n")
            .put("http://config.test/inventory/hosts.yml", "web: [w1]\n")
            .put("http://config.test/inventory/secrets.yml", read(resource("example", "secrets.yml")));

        assertEquals(Map.of("platform_name", "prod"), builder().build("prod").group("all").get("vars"));

        var decrypting = new InventoryBuilder(URI.create(ROOT), transport.loader(Optional.of(new Vault(VAULT_PASSWORD))));
        assertEquals(
            Map.of("is_this_secret", "yuppers", "platform_name", "prod"),
            decrypting.build("prod").group("all").get("vars")
        );
    }

    @Test
    void rootConfigurationIsFetchedOnce() {
        transport.put(ROOT, "environments:\n  prod: {}\n  dev: {}\n");

        var builder = builder();
        builder.build("prod");
        builder.build("dev");

        assertEquals(List.of("dev", "prod"), builder.rootConfiguration().environmentNames());
        assertEquals(1, transport.requests().size());
        assertTrue(builder.rootConfiguration().hasEnvironment("dev"));
    }
}
