package com.odata.writer.util;

/**
 * Converts entity names between singular and plural forms, used when matching
 * collection names against entity type names.
 */
public interface Pluralizer {

    String pluralize(String word);

    String singularize(String word);
}
