package com.odata.writer.request;

import com.odata.writer.format.PayloadFormat;
import com.odata.writer.util.Pluralizer;
import com.odata.writer.util.SimplePluralizer;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for the request writer.
 */
@Data
@Builder
public class WriterSettings {

    /**
     * Service root, e.g. {@code https://host/service/}. Operation URIs in a batch are
     * built from it.
     */
    private String urlBase;

    @Builder.Default
    private PayloadFormat payloadFormat = PayloadFormat.JSON;

    /**
     * Pretty-print JSON payloads.
     */
    private boolean indent;

    @Builder.Default
    private Pluralizer pluralizer = new SimplePluralizer();

    /**
     * Resolve a command text (e.g. {@code Orders(1)}) against the url base.
     */
    public String resolve(String commandText) {
        String base = urlBase == null ? "" : urlBase;
        String command = commandText == null ? "" : commandText;
        if (base.isEmpty()) {
            return command;
        }
        if (base.endsWith("/") && command.startsWith("/")) {
            return base + command.substring(1);
        }
        if (!base.endsWith("/") && !command.isEmpty() && !command.startsWith("/")) {
            return base + "/" + command;
        }
        return base + command;
    }
}
