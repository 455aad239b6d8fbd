package com.challenges.mxql.cli;

import com.challenges.mxql.MXQL;
import com.challenges.mxql.category.CategoryField;
import com.challenges.mxql.category.CategoryMatch;
import com.challenges.mxql.category.CategoryMetadata;
import com.challenges.mxql.category.MetaFileCategoryCatalog;
import com.challenges.mxql.output.OutputFormatter;
import com.challenges.mxql.payload.PayloadNode;
import org.eclipse.collections.api.list.ImmutableList;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;

@Command(name = "category", mixinStandardHelpOptions = true, synopsisSubcommandLabel = "COMMAND",
         description = "Browse the category catalog used for field name checks")
public class CategoryCommand implements Runnable {
    @Option(names = {"-d", "--categories"}, required = true, description = "Directory of category .meta files")
    private Path directory;

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    @Command(name = "search", description = "Find categories by keyword")
    int search(@Parameters(arity = "1..*", description = "Search words") String[] words,
               @Option(names = "--limit", defaultValue = "10", description = "Maximum results") int limit) {
        ImmutableList<CategoryMatch> matches = catalog().search(String.join(" ", words), limit);
        PrintWriter out = out();
        if (matches.isEmpty()) {
            out.println("No categories found.");
        }
        matches.forEachWithIndex((match, i) -> {
            String line = (i + 1) + ". " + match.categoryName();
            if (!match.title().isEmpty()) {
                line += " - " + match.title();
            }
            if (match.platforms().notEmpty()) {
                line += " (Platforms: " + match.platforms().makeString(", ") + ")";
            }
            out.println(line);
        });
        out.flush();
        return MXQL.EXIT_VALID;
    }

    @Command(name = "info", description = "Print the field catalog of a category as JSON")
    int info(@Parameters(index = "0", description = "Category name") String categoryName,
             @Option(names = "--lang", defaultValue = "en", description = "Language variant: en, ko or ja") String language) {
        Optional<CategoryMetadata> metadata = catalog().lookup(categoryName, language);
        if (metadata.isEmpty()) {
            spec.commandLine().getErr().println("Category '" + categoryName + "' not found.");
            spec.commandLine().getErr().flush();
            return MXQL.EXIT_INVALID;
        }
        out().println(new OutputFormatter(true).format(toPayload(metadata.get())));
        out().flush();
        return MXQL.EXIT_VALID;
    }

    @Command(name = "products", description = "List product types and their category counts")
    int products() {
        MetaFileCategoryCatalog catalog = catalog();
        PrintWriter out = out();
        out.println("Available product types:");
        catalog.listProducts().forEach(product ->
            out.println("  - " + product + ": " + catalog.findByProduct(product).size() + " categories"));
        out.flush();
        return MXQL.EXIT_VALID;
    }

    @Command(name = "product", description = "List the categories of one product type")
    int product(@Parameters(index = "0", description = "Product type, e.g. db or server") String productType) {
        PrintWriter out = out();
        out.println("Categories for product '" + productType + "':");
        catalog().findByProduct(productType).forEach(name -> out.println("  - " + name));
        out.flush();
        return MXQL.EXIT_VALID;
    }

    private MetaFileCategoryCatalog catalog() {
        return new MetaFileCategoryCatalog(directory);
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    static PayloadNode toPayload(CategoryMetadata metadata) {
        PayloadNode.PayloadArray fields = PayloadNode.PayloadArray.empty();
        for (CategoryField field : metadata.fields()) {
            fields = fields.with(PayloadNode.PayloadObject.empty()
                .with("fieldName", new PayloadNode.PayloadString(field.fieldName()))
                .with("unit", new PayloadNode.PayloadString(field.unit()))
                .with("type", new PayloadNode.PayloadString(field.type()))
                .with("description", new PayloadNode.PayloadString(field.description())));
        }
        return PayloadNode.PayloadObject.empty()
            .with("categoryName", new PayloadNode.PayloadString(metadata.categoryName()))
            .with("title", new PayloadNode.PayloadString(metadata.title()))
            .with("platforms", strings(metadata.platforms()))
            .with("pk", strings(metadata.pk()))
            .with("fields", fields);
    }

    private static PayloadNode.PayloadArray strings(ImmutableList<String> values) {
        PayloadNode.PayloadArray array = PayloadNode.PayloadArray.empty();
        for (String value : values) {
            array = array.with(new PayloadNode.PayloadString(value));
        }
        return array;
    }
}
