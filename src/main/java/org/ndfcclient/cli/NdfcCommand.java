package org.ndfcclient.cli;

import org.springframework.boot.ApplicationArguments;

import java.io.PrintStream;

/**
 * A command of the command line client. Every bean implementing this interface is
 * available under its {@link #getName() name}.
 */
public interface NdfcCommand {

    /**
     * Name used on the command line, for example "vrf-create".
     */
    String getName();

    /**
     * One-line description shown by "help".
     */
    String getDescription();

    /**
     * Whether the runner logs in to the controller before executing the command.
     */
    default boolean requiresLogin() {
        return true;
    }

    /**
     * Executes the command.
     *
     * @param args Application arguments; the first non-option argument is the command name
     * @param out Stream receiving the JSON output
     * @throws UsageException if the arguments are incomplete
     */
    void execute(ApplicationArguments args, PrintStream out);
}
