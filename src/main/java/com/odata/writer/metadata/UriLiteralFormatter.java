package com.odata.writer.metadata;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Formats key values as OData v4 URI literals.
 *
 * Single keys are written positionally ({@code (3)}), composite keys by name
 * ({@code (OrderID=1,ProductID=7)}). String literals are quoted with embedded quotes
 * doubled; percent-encoding is left to the transport that builds the final URI.
 */
public class UriLiteralFormatter {

    public String formatKey(Map<String, ?> keyValues) {
        if (keyValues.size() == 1) {
            return "(" + formatValue(keyValues.values().iterator().next()) + ")";
        }
        return keyValues.entrySet().stream()
                .map(e -> e.getKey() + "=" + formatValue(e.getValue()))
                .collect(Collectors.joining(",", "(", ")"));
    }

    public String formatValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof Duration duration) {
            return "duration'" + duration + "'";
        }
        if (value instanceof byte[] bytes) {
            return "binary'" + Base64.getUrlEncoder().encodeToString(bytes) + "'";
        }
        if (value instanceof Enum<?> e) {
            return "'" + e.name() + "'";
        }
        // temporal values are written in their ISO form
        return value.toString();
    }
}
