package com.odata.writer.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps WriteEntryCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedWriteEntryOptions {
    String method;
    String commandText;
    boolean linkOnly;
    Path outputPath;
}
