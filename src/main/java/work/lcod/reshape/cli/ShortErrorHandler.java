package work.lcod.reshape.cli;

import picocli.CommandLine;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.trace.Tracer;

/**
 * Keeps CLI failures short and focused on the root cause. With {@code -Dreshape.debug=true}
 * the stack trace and the evaluation trace follow the message.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "reshape.debug";
    private static final int TRACE_WIDTH = 80;

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
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
            if (ex instanceof ReshapeException reshape && reshape.scope() != null) {
                commandLine.getErr().println(Tracer.shortStack(reshape, TRACE_WIDTH));
            }
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
