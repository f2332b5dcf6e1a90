package com.odata.writer.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odata.writer.cli.exception.OptionsValidationException;
import com.odata.writer.cli.model.ValidatedWriteEntryOptions;
import com.odata.writer.cli.model.WriteEntryOptions;
import com.odata.writer.cli.output.WriteEntryResultsPrinter;
import com.odata.writer.cli.validation.WriteEntryOptionsValidator;
import com.odata.writer.exception.RequestWriterException;
import com.odata.writer.metadata.CsdlMetadataReader;
import com.odata.writer.metadata.DefaultMetadataCatalog;
import com.odata.writer.model.SchemaModel;
import com.odata.writer.request.HttpLiteral;
import com.odata.writer.request.RequestWriter;
import com.odata.writer.request.WriterSettings;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command writing the request body for one entity, or for an entity reference link.
 */
@Command(
        name = "write-entry",
        mixinStandardHelpOptions = true,
        version = "odata-request-writer 1.0.0",
        description = "Writes the OData request body for an entity described by a JSON data file."
)
public class WriteEntryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WriteEntryCommand.class);

    @Mixin
    private WriteEntryOptions options = new WriteEntryOptions();

    private final WriteEntryOptionsValidator validator = new WriteEntryOptionsValidator();
    private final WriteEntryResultsPrinter printer = new WriteEntryResultsPrinter();
    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final PrintStream stdout;

    public WriteEntryCommand() {
        this(System.out);
    }

    WriteEntryCommand(PrintStream stdout) {
        this.stdout = stdout;
    }

    @Override
    public Integer call() {
        try {
            ValidatedWriteEntryOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            SchemaModel model = CsdlMetadataReader.read(options.getMetadata());
            WriterSettings settings = WriterSettings.builder()
                    .urlBase(options.getUrlBase())
                    .payloadFormat(options.getFormat())
                    .indent(options.isIndent())
                    .build();
            RequestWriter writer = new RequestWriter(settings,
                    new DefaultMetadataCatalog(model, settings.getPluralizer()));

            InputStream body;
            if (validated.isLinkOnly()) {
                body = writer.writeLinkContent(options.getLinkPath());
            } else {
                Map<String, Object> entryData = HttpLiteral.DELETE.equals(validated.getMethod())
                        ? Map.of()
                        : readEntryData(options);
                body = writer.writeEntryContent(validated.getMethod(), options.getCollection(), entryData,
                        validated.getCommandText());
            }

            int written = body == null ? 0 : emit(body, validated);
            printer.printSuccess(validated, written);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (RequestWriterException e) {
            log.error("Writing failed: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Writing failed with exception", e);
            return 1;
        }
    }

    private Map<String, Object> readEntryData(WriteEntryOptions o) throws IOException {
        return mapper.readValue(o.getData().toFile(), new TypeReference<LinkedHashMap<String, Object>>() {
        });
    }

    private int emit(InputStream body, ValidatedWriteEntryOptions validated) throws IOException {
        byte[] bytes = body.readAllBytes();
        if (validated.getOutputPath() != null) {
            Files.write(validated.getOutputPath(), bytes);
        } else {
            OutputStream out = stdout;
            out.write(bytes);
            out.flush();
        }
        return bytes.length;
    }
}
