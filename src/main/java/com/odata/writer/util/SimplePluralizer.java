package com.odata.writer.util;

import java.util.Locale;
import java.util.Map;

/**
 * English pluralization rules good enough for typical entity names
 * ({@code Category/Categories}, {@code Address/Addresses}, {@code Person/People}).
 */
public class SimplePluralizer implements Pluralizer {

    private static final Map<String, String> IRREGULAR = Map.of(
            "person", "people",
            "child", "children",
            "man", "men",
            "woman", "women",
            "mouse", "mice",
            "goose", "geese");

    @Override
    public String pluralize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> irregular : IRREGULAR.entrySet()) {
            if (lower.endsWith(irregular.getKey())) {
                return replaceSuffix(word, irregular.getKey().length(), irregular.getValue());
            }
        }
        if (lower.endsWith("y") && lower.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
            return replaceSuffix(word, 1, "ies");
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
                || lower.endsWith("ch") || lower.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    @Override
    public String singularize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> irregular : IRREGULAR.entrySet()) {
            if (lower.endsWith(irregular.getValue())) {
                return replaceSuffix(word, irregular.getValue().length(), irregular.getKey());
            }
        }
        if (lower.endsWith("ies") && lower.length() > 3) {
            return replaceSuffix(word, 3, "y");
        }
        if (lower.endsWith("sses") || lower.endsWith("xes") || lower.endsWith("zes")
                || lower.endsWith("ches") || lower.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (lower.endsWith("s") && !lower.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }

    private static String replaceSuffix(String word, int suffixLength, String replacement) {
        String stem = word.substring(0, word.length() - suffixLength);
        if (word.equals(word.toUpperCase(Locale.ROOT))) {
            return stem + replacement.toUpperCase(Locale.ROOT);
        }
        if (stem.isEmpty() && Character.isUpperCase(word.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return stem + replacement;
    }
}
