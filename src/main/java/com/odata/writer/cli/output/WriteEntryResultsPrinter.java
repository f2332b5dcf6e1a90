package com.odata.writer.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.odata.writer.cli.model.ValidatedWriteEntryOptions;
import com.odata.writer.cli.model.WriteEntryOptions;

/**
 * Responsible only for printing CLI output for the "write-entry" command.
 * The payload itself goes to the output file or standard output, never through the log.
 */
public class WriteEntryResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(WriteEntryResultsPrinter.class);

    public void printBanner(WriteEntryOptions o, ValidatedWriteEntryOptions v) {
        log.info("=================================================");
        log.info("OData Request Writer");
        log.info("=================================================");
        log.info("Metadata: {}", o.getMetadata().toAbsolutePath());
        if (v.isLinkOnly()) {
            log.info("Reference Link: {}", o.getLinkPath());
        } else {
            log.info("Collection: {}", o.getCollection());
            log.info("Method: {}", v.getMethod());
            log.info("Command: {}", v.getCommandText());
            log.info("Entity Data: {}", o.getData() != null ? o.getData().toAbsolutePath() : "None");
        }
        log.info("Format: {}", o.getFormat());
        log.info("Url Base: {}", o.getUrlBase() != null ? o.getUrlBase() : "None");
        log.info("Output: {}", v.getOutputPath() != null ? v.getOutputPath() : "stdout");
        log.info("=================================================");
    }

    public void printSuccess(ValidatedWriteEntryOptions v, int bytesWritten) {
        if (bytesWritten == 0) {
            log.info("{} request has no body", v.getMethod());
        } else {
            log.info("Wrote {} bytes", bytesWritten);
        }
    }
}
