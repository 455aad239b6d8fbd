package com.challenges.mxql.cli;

import com.challenges.mxql.MXQL;
import com.challenges.mxql.category.CategoryCatalogException;
import com.challenges.mxql.category.CategoryMetadataSource;
import com.challenges.mxql.category.MetaFileCategoryCatalog;
import com.challenges.mxql.output.ReportFormatter;
import com.challenges.mxql.report.ValidationReport;
import com.challenges.mxql.validation.BatchValidator;
import com.challenges.mxql.validation.QueryValidator;
import com.challenges.mxql.validation.ValidatorSettings;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", mixinStandardHelpOptions = true,
         description = "Validate MXQL queries; exits 1 when any query has a critical issue")
public class ValidateCommand implements Callable<Integer> {
    @Parameters(arity = "0..*", description = "Query files (default: stdin)")
    private List<File> inputFiles;

    @Option(names = {"-f", "--format"}, defaultValue = "TEXT", description = "Report format: ${COMPLETION-CANDIDATES}")
    private ReportFormatter.Format format;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in JSON output")
    private boolean sortKeys = false;

    @Option(names = "--categories", description = "Directory of category .meta files used to check field names")
    private Path categories;

    @Option(names = "--granularity-ratio", defaultValue = "500",
            description = "Maximum time buckets over the query's time range (default: ${DEFAULT-VALUE})")
    private double granularityRatio;

    @Option(names = {"-j", "--threads"}, defaultValue = "4", description = "Worker threads for multiple files")
    private int threads;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CategoryMetadataSource metadata = categories != null
                ? new MetaFileCategoryCatalog(categories)
                : CategoryMetadataSource.unavailable();
            QueryValidator validator = new QueryValidator(new ValidatorSettings(granularityRatio, metadata));

            List<File> files = inputFiles == null || inputFiles.isEmpty() ? null : inputFiles;
            MutableList<String> texts = Lists.mutable.empty();
            MutableList<String> labels = Lists.mutable.empty();
            if (files == null) {
                texts.add(QueryInput.read(null));
                labels.add(QueryInput.label(null));
            } else {
                for (File file : files) {
                    texts.add(QueryInput.read(file));
                    labels.add(QueryInput.label(file));
                }
            }

            ImmutableList<ValidationReport> reports;
            if (texts.size() == 1) {
                reports = Lists.immutable.with(validator.validate(texts.getFirst()));
            } else {
                try (BatchValidator batch = new BatchValidator(validator, threads)) {
                    reports = batch.validateAll(texts);
                }
            }

            ReportFormatter formatter = new ReportFormatter(format, compactOutput, sortKeys);
            reports.forEachWithIndex((report, i) -> {
                if (reports.size() > 1) {
                    out.println("==> " + labels.get(i) + " <==");
                }
                out.println(formatter.format(report));
            });
            out.flush();

            return reports.allSatisfy(ValidationReport::valid) ? MXQL.EXIT_VALID : MXQL.EXIT_INVALID;
        } catch (IOException | CategoryCatalogException e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return MXQL.EXIT_ERROR;
        }
    }
}
