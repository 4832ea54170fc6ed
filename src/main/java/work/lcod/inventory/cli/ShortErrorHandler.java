package work.lcod.inventory.cli;

import picocli.CommandLine;
import work.lcod.inventory.error.InventoryException;

/**
 * Reports a failed build as one line, {@code [KIND] detail (context)}, on stderr.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "inventory.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        } else if (!(ex instanceof InventoryException)) {
            message = ex.getClass().getSimpleName() + ": " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + message));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
