package com.cardioclaw.app.cli;

import com.cardioclaw.common.errors.CardioclawException;
import com.cardioclaw.common.errors.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

/**
 * Turns exceptions escaping a subcommand into a message on stderr and an exit
 * code: 2 for usage errors, 1 for everything else.
 */
@Slf4j
public class CliErrorHandler implements IExecutionExceptionHandler {

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    @Override
    public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
        cmd.getErr().println("Error: " + ex.getMessage());
        if (ex instanceof CardioclawException ce) {
            log.debug("{} failed ({})", cmd.getCommandName(), ce.getKind(), ex);
            return ce.getKind() == ErrorKind.USAGE ? EXIT_USAGE : EXIT_FAILURE;
        }
        log.error("{} failed unexpectedly", cmd.getCommandName(), ex);
        return EXIT_FAILURE;
    }
}
