package com.horae.cli;

import ch.qos.logback.classic.Level;
import com.horae.cli.commands.NextCommand;
import com.horae.cli.commands.RunCommand;
import com.horae.cli.commands.VersionCommand;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Horae CLI - main entry point and command dispatcher.
 * 
 * Root command with global options and subcommands to run a command on a
 * schedule and to preview schedules.
 */
@Command(
    name = "horae",
    description = "Horae - in-process job scheduler",
    version = "Horae v1.0-SNAPSHOT",
    mixinStandardHelpOptions = true,
    subcommands = {
        RunCommand.class,
        NextCommand.class,
        VersionCommand.class
    }
)
public class HoraeCli implements Callable<Integer> {

    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HoraeCli()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Global option, applies to every subcommand.
     */
    @Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output (DEBUG logging)"
    )
    void setVerbose(boolean verbose) {
        this.verbose = verbose;
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(Level.DEBUG);
        }
    }

    @Override
    public Integer call() {
        // No subcommand: show usage
        new CommandLine(this).usage(System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
