package com.challenges.mxql;

import ch.qos.logback.classic.Level;
import com.challenges.mxql.cli.CategoryCommand;
import com.challenges.mxql.cli.FixtureCommand;
import com.challenges.mxql.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "jmxql", mixinStandardHelpOptions = true, version = "1.0",
         description = "Static analysis and test fixtures for MXQL metrics queries",
         subcommands = {ValidateCommand.class, FixtureCommand.class, CategoryCommand.class})
public class MXQL implements Callable<Integer> {
    public static final int EXIT_VALID = 0;
    public static final int EXIT_INVALID = 1;
    public static final int EXIT_ERROR = 2;

    @Option(names = {"-v", "--verbose"}, description = "Log analysis steps to stderr")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    public static CommandLine commandLine() {
        MXQL root = new MXQL();
        CommandLine commandLine = new CommandLine(root);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            root.applyVerbosity();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_VALID;
    }

    private void applyVerbosity() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (verbose && root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.DEBUG);
        }
    }
}
