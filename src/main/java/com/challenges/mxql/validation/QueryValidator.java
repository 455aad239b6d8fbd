package com.challenges.mxql.validation;

import com.challenges.mxql.query.ParsedQuery;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.query.QueryAssembler;
import com.challenges.mxql.report.IssueAggregator;
import com.challenges.mxql.report.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Validates query text: assembles it, then runs the structural, style, semantic,
 * performance and field catalog passes and merges their findings.
 * <p>
 * Instances hold no per-call state and may be shared between threads.
 */
public class QueryValidator {
    private static final Logger log = LoggerFactory.getLogger(QueryValidator.class);

    private final ValidatorSettings settings;
    private final QueryAssembler assembler = new QueryAssembler();
    private final StructuralValidator structural = new StructuralValidator();
    private final StyleCheck style = new StyleCheck();
    private final SemanticRuleEngine semantic = new SemanticRuleEngine();
    private final PerformanceAnalyzer performance = new PerformanceAnalyzer();
    private final FieldCatalogCheck fieldCatalog = new FieldCatalogCheck();

    public QueryValidator() {
        this(ValidatorSettings.defaults());
    }

    public QueryValidator(ValidatorSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Never throws for non-null text; malformed input yields Critical issues instead.
     */
    public ValidationReport validate(String text) {
        Objects.requireNonNull(text, "text");
        ParsedQuery parsed = assembler.assemble(text);
        Query query = parsed.query();
        ValidationContext context = new ValidationContext(settings);

        IssueAggregator aggregator = new IssueAggregator()
            .addAll(parsed.issues())
            .addAll(structural.check(query))
            .addAll(style.check(query))
            .addAll(semantic.check(query, context))
            .addAll(performance.check(query, settings))
            .addAll(fieldCatalog.check(query, context));

        ValidationReport report = ValidationReport.of(aggregator);
        log.debug("Validated {}: {}", query, report.summary());
        return report;
    }
}
