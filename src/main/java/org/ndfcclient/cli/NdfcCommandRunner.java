package org.ndfcclient.cli;

import org.ndfcclient.rest.NdfcException;
import org.ndfcclient.rest.Sender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs the command named by the first non-option argument.
 *
 * Output goes to stdout as JSON; errors go to stderr. The exit code is 0 when the command
 * succeeds, 1 when it fails and 2 when it is unknown or invoked with bad arguments.
 */
@Component
public class NdfcCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(NdfcCommandRunner.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String HELP = "help";

    private final Map<String, NdfcCommand> commands = new TreeMap<>();
    private final Sender sender;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public NdfcCommandRunner(List<NdfcCommand> commands, Sender sender) {
        this(commands, sender, System.out, System.err);
    }

    public NdfcCommandRunner(List<NdfcCommand> commands, Sender sender, PrintStream out, PrintStream err) {
        for (NdfcCommand command : commands) {
            this.commands.put(command.getName(), command);
        }
        this.sender = sender;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> nonOptionArgs = args.getNonOptionArgs();
        if (nonOptionArgs.isEmpty()) {
            printUsage(err);
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = dispatch(nonOptionArgs.get(0), args);
    }

    /**
     * Executes one command and returns its exit code.
     */
    public int dispatch(String name, ApplicationArguments args) {
        if (HELP.equals(name)) {
            printUsage(out);
            return EXIT_OK;
        }
        NdfcCommand command = commands.get(name);
        if (command == null) {
            err.println("Unknown command: " + name);
            printUsage(err);
            return EXIT_USAGE;
        }

        try {
            if (command.requiresLogin()) {
                sender.login();
            }
            logger.debug("Executing command {}", name);
            command.execute(args, out);
            return EXIT_OK;
        } catch (UsageException e) {
            logger.error("{}: {}", name, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (NdfcException | IllegalArgumentException | IllegalStateException e) {
            logger.error("{} failed: {}", name, e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            logger.error("{} failed unexpectedly", name, e);
            err.println("Error: " + e);
            return EXIT_FAILED;
        }
    }

    private void printUsage(PrintStream stream) {
        stream.println("Usage: ndfc-client <command> [--config=<file>] [--ndfc.<property>=<value> ...]");
        stream.println();
        stream.println("Commands:");
        stream.printf("  %-22s %s%n", HELP, "Show this message");
        for (NdfcCommand command : commands.values()) {
            stream.printf("  %-22s %s%n", command.getName(), command.getDescription());
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
