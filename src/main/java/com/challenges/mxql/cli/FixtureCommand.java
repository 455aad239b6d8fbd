package com.challenges.mxql.cli;

import com.challenges.mxql.MXQL;
import com.challenges.mxql.fixture.FixtureGenerator;
import com.challenges.mxql.fixture.SampleRowSynthesizer;
import com.challenges.mxql.fixture.TestFixture;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "fixture", mixinStandardHelpOptions = true,
         description = "Rewrite a query to read generated ADDROW sample data")
public class FixtureCommand implements Callable<Integer> {
    @Parameters(index = "0", arity = "0..1", description = "Query file (default: stdin)")
    private File inputFile;

    @Option(names = {"-n", "--rows"}, description = "Number of sample rows (default: ${DEFAULT-VALUE})")
    private int rows = SampleRowSynthesizer.DEFAULT_ROWS;

    @Option(names = {"-d", "--description"}, description = "Test description written as a header comment")
    private String description;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            String text = QueryInput.read(inputFile);
            TestFixture fixture = new FixtureGenerator().generate(text, rows, description);
            out.println(fixture.text());
            out.flush();
            return MXQL.EXIT_VALID;
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return MXQL.EXIT_ERROR;
        }
    }
}
