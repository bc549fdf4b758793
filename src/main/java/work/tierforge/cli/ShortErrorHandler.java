package work.tierforge.cli;

import picocli.CommandLine;
import work.tierforge.error.ScaffoldException;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (ex instanceof ScaffoldException scaffold) {
            for (String hint : scaffold.hints()) {
                commandLine.getErr().println("  hint: " + hint);
            }
        }
        if (Boolean.getBoolean("tierforge.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
