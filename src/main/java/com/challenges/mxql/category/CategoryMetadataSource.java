package com.challenges.mxql.category;

import java.util.Optional;

/**
 * Looks up the field catalog of a data category by its literal name.
 * <p>
 * An empty result means the category is unknown or the lookup is unavailable; callers
 * treat both the same way.
 */
@FunctionalInterface
public interface CategoryMetadataSource {

    Optional<CategoryMetadata> lookup(String categoryName);

    static CategoryMetadataSource unavailable() {
        return categoryName -> Optional.empty();
    }
}
