package com.challenges.mxql.validation;

import com.challenges.mxql.category.CategoryMetadata;
import com.challenges.mxql.query.Command;
import com.challenges.mxql.query.CommandFields;
import com.challenges.mxql.query.CommandKind;
import com.challenges.mxql.query.Query;
import com.challenges.mxql.report.Issue;
import com.challenges.mxql.report.IssueCode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Optional;

import static com.challenges.mxql.validation.StructuralValidator.issue;

/**
 * Checks referenced field names against the catalog of the scope's category.
 * <p>
 * Categories given as runtime parameters ({@code $name}) are skipped. When no catalog is
 * available the check degrades to an Info note.
 */
public class FieldCatalogCheck {
    static final String[] CATEGORY_KEYS = {"category", "name"};

    // present in every category
    private static final ImmutableSet<String> IMPLICIT_FIELDS = Sets.immutable.with("time", "oid", "oname");

    public MutableList<Issue> check(Query query, ValidationContext context) {
        MutableList<Issue> issues = Lists.mutable.empty();
        query.scopes().forEach(scope -> checkScope(scope, context, issues));
        return issues;
    }

    private void checkScope(Query scope, ValidationContext context, MutableList<Issue> issues) {
        Command source = scope.commands().detect(command -> command.is(CommandKind.SOURCE));
        if (source == null) {
            return;
        }
        Optional<String> categoryName = source.argument(CATEGORY_KEYS);
        if (categoryName.isEmpty() || categoryName.get().startsWith("$")) {
            return;
        }
        Optional<CategoryMetadata> metadata = context.category(categoryName.get());
        if (metadata.isEmpty()) {
            issues.add(issue(source, IssueCode.CATEGORY_METADATA_UNAVAILABLE,
                "No field catalog available for category '" + categoryName.get() + "'; field names were not checked",
                null));
            return;
        }

        MutableSet<String> created = Sets.mutable.empty();
        for (Command command : scope.commands()) {
            if (command.index() < source.index()) {
                continue;
            }
            if (command.is(CommandKind.TRANSFORM)) {
                CommandFields.createdField(command).ifPresent(created::add);
                continue;
            }
            referencedFields(command)
                .reject(field -> field.equals(CommandFields.WILDCARD))
                .reject(field -> IMPLICIT_FIELDS.contains(field) || created.contains(field))
                .reject(field -> metadata.get().hasField(field))
                .distinct()
                .forEach(field -> issues.add(issue(command, IssueCode.UNKNOWN_FIELD,
                    "Field '" + field + "' is not defined in category '" + categoryName.get() + "'",
                    "Check the field name against the category catalog")));
        }
    }

    private static ImmutableList<String> referencedFields(Command command) {
        return switch (command.kind()) {
            case PROJECT -> CommandFields.projection(command).collect(CommandFields::baseField);
            case FILTER -> CommandFields.filterKey(command)
                .map(key -> Lists.immutable.with(key))
                .orElse(Lists.immutable.empty());
            case GROUP -> CommandFields.groupKeys(command);
            case AGGREGATE -> CommandFields.aggregateTargets(command);
            case ORDER -> CommandFields.orderKeys(command);
            default -> Lists.immutable.empty();
        };
    }
}
