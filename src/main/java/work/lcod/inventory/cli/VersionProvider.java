package work.lcod.inventory.cli;

import picocli.CommandLine;

/**
 * Version from the jar manifest; {@code development} when running from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        var pkg = Main.class.getPackage();
        String version = pkg.getImplementationVersion() == null ? "development" : pkg.getImplementationVersion();
        return new String[] {
            "inventory-aggregator " + version,
            "Java " + Runtime.version() + " (" + System.getProperty("java.vendor", "unknown vendor") + ")"
        };
    }
}
