package com.challenges.mxql.validation;

import com.challenges.mxql.category.CategoryMetadata;
import com.challenges.mxql.category.CategoryMetadataSource;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * State of one validation call. A new context is created for every query text, so
 * validations running on different threads never share state.
 */
public class ValidationContext {
    private static final Logger log = LoggerFactory.getLogger(ValidationContext.class);

    private final ValidatorSettings settings;
    private final MutableMap<String, Optional<CategoryMetadata>> categories = Maps.mutable.empty();

    public ValidationContext(ValidatorSettings settings) {
        this.settings = settings;
    }

    public ValidatorSettings settings() {
        return settings;
    }

    /**
     * Catalog of {@code categoryName}, looked up at most once per call. A failing lookup
     * is logged and treated as unavailable.
     */
    public Optional<CategoryMetadata> category(String categoryName) {
        return categories.getIfAbsentPutWithKey(categoryName, this::lookup);
    }

    private Optional<CategoryMetadata> lookup(String categoryName) {
        CategoryMetadataSource source = settings.metadataSource();
        try {
            Optional<CategoryMetadata> result = source.lookup(categoryName);
            return result == null ? Optional.empty() : result;
        } catch (RuntimeException e) {
            log.warn("Category metadata lookup for '{}' failed: {}", categoryName, e.getMessage());
            log.debug("Lookup failure", e);
            return Optional.empty();
        }
    }

    /**
     * Forward-pass flags of one scope. Flags are set once and never reset within the scope.
     */
    public static final class ScopeState {
        private final MutableSet<String> visibleSubqueries;
        boolean sawSource;
        boolean sawLoader;
        boolean sawGroup;
        boolean sawOrder;
        boolean sawBound;
        int projections;

        ScopeState(ImmutableSet<String> inherited) {
            this.visibleSubqueries = Sets.mutable.withAll(inherited);
        }

        public boolean isVisible(String subqueryName) {
            return visibleSubqueries.contains(subqueryName);
        }

        void define(String subqueryName) {
            visibleSubqueries.add(subqueryName);
        }

        ImmutableSet<String> visibleSubqueries() {
            return visibleSubqueries.toImmutable();
        }
    }

    public ScopeState enterScope(ImmutableSet<String> inherited) {
        return new ScopeState(inherited);
    }

    public ScopeState enterTopLevel() {
        return new ScopeState(Sets.immutable.empty());
    }
}
