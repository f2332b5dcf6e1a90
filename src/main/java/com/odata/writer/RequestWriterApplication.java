package com.odata.writer;

import com.odata.writer.cli.WriteEntryCommand;

import picocli.CommandLine;

/**
 * Main entry point for the OData request writer.
 * Reads a service's CSDL metadata and writes entity request bodies in JSON or Atom.
 */
public class RequestWriterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WriteEntryCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
