package com.doctrace;

import ch.qos.logback.classic.Level;
import com.doctrace.cli.CacheCommand;
import com.doctrace.cli.ListCommand;
import com.doctrace.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocTrace.
 *
 * <p>DocTrace validates a tree of diagram and markdown documents: notation, metadata, folder
 * layout and the traceability graph linking personas, requirements, journeys and flows.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate a docs tree; exits 1 when an error-level rule is violated</li>
 *   <li>{@code cache} - Show, clear or prune the parse cache</li>
 *   <li>{@code list} - List available analyzers or active rules</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate the project in the current directory
 * doctrace validate
 *
 * # Validate with debug logging
 * doctrace -v validate path/to/project
 *
 * # Drop stale cache entries
 * doctrace cache prune
 * }</pre>
 */
@Command(
    name = "doctrace",
    mixinStandardHelpOptions = true,
    version = "DocTrace 1.0.0-SNAPSHOT",
    description = "Traceability and structure validation for diagram documentation",
    subcommands = {
        ValidateCommand.class,
        CacheCommand.class,
        ListCommand.class
    }
)
public class DocTraceCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocTraceCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DocTrace - Documentation Traceability Validator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'doctrace --help' to see available commands");
        System.out.println("Use 'doctrace <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return command line
     */
    public static CommandLine commandLine() {
        DocTraceCLI cli = new DocTraceCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
