package com.odata.writer.util;

import java.util.Locale;

/**
 * Name comparison rules shared by the metadata catalog and the encoders.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Strips namespace qualification, underscores and other separators and lower-cases the rest,
     * so {@code Sales.Order_Details} and {@code orderdetails} compare equal.
     */
    public static String homogenize(String name) {
        if (name == null) {
            return null;
        }
        String simple = name.substring(name.lastIndexOf('.') + 1);
        StringBuilder sb = new StringBuilder(simple.length());
        for (int i = 0; i < simple.length(); i++) {
            char c = simple.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-, separator- and (when a pluralizer is given) number-insensitive name equality.
     */
    public static boolean namesAreEqual(String actualName, String requestedName, Pluralizer pluralizer) {
        if (actualName == null || requestedName == null) {
            return false;
        }
        String actual = homogenize(actualName);
        String requested = homogenize(requestedName);
        if (actual.equals(requested)) {
            return true;
        }
        if (pluralizer == null) {
            return false;
        }
        return actual.equals(homogenize(pluralizer.singularize(requested)))
                || actual.equals(homogenize(pluralizer.pluralize(requested)))
                || homogenize(pluralizer.singularize(actual)).equals(requested)
                || homogenize(pluralizer.pluralize(actual)).equals(requested);
    }
}
