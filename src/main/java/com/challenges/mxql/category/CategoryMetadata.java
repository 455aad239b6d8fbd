package com.challenges.mxql.category;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Field catalog of one data category.
 *
 * @param categoryName name used in the query's source command
 * @param title        display title, may be empty
 * @param platforms    platforms the category is collected on
 * @param pk           primary key fields
 * @param fields       fields in catalog order
 */
public record CategoryMetadata(String categoryName, String title, ImmutableList<String> platforms,
                               ImmutableList<String> pk, ImmutableList<CategoryField> fields) {

    public boolean hasField(String name) {
        return pk.contains(name) || fields.anySatisfy(field -> field.fieldName().equals(name));
    }

    /**
     * First segment of the category name, e.g. {@code db} for {@code db_postgresql_counter}.
     */
    public String productType() {
        int underscore = categoryName.indexOf('_');
        return underscore < 0 ? categoryName : categoryName.substring(0, underscore);
    }
}
