package com.sandcastle.dispatch.cli;

import com.sandcastle.core.error.ConflictException;
import com.sandcastle.core.error.ContainerRuntimeException;
import com.sandcastle.core.error.EntityNotFoundException;
import com.sandcastle.core.error.GitBackendException;
import com.sandcastle.core.error.PreconditionException;
import com.sandcastle.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Prints engine failures as one-line errors and maps them to process exit codes.
 */
public class CliExceptionHandler implements IExecutionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    public static final int VALIDATION = 2;
    public static final int NOT_FOUND = 3;
    public static final int PRECONDITION = 4;
    public static final int BACKEND = 5;

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        int code = exitCodeFor(ex);
        if (code == CommandLine.ExitCode.SOFTWARE) {
            log.error("Command '{}' failed", commandLine.getCommandName(), ex);
        }
        ConsoleOutput.error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        return code;
    }

    public static int exitCodeFor(Throwable ex) {
        if (ex instanceof ValidationException) {
            return VALIDATION;
        }
        if (ex instanceof EntityNotFoundException) {
            return NOT_FOUND;
        }
        if (ex instanceof PreconditionException || ex instanceof ConflictException) {
            return PRECONDITION;
        }
        if (ex instanceof ContainerRuntimeException || ex instanceof GitBackendException) {
            return BACKEND;
        }
        return CommandLine.ExitCode.SOFTWARE;
    }
}
