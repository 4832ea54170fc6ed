package work.lcod.inventory.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution and the {@code inventory} wrapper script.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine(new InventoryCommand()).execute(args));
    }

    static CommandLine commandLine(InventoryCommand command) {
        return new CommandLine(command)
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
