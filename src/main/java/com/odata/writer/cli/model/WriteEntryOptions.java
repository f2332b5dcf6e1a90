package com.odata.writer.cli.model;

import java.nio.file.Path;

import com.odata.writer.format.PayloadFormat;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "write-entry" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class WriteEntryOptions {

	@Option(names = { "--metadata", "-m" }, required = true, description = "Path to the service CSDL metadata document")
	private Path metadata;

	@Option(names = { "--collection", "-c" }, description = "Entity set the entry belongs to")
	private String collection;

	@Option(names = { "--method", "-X" }, defaultValue = "POST", description = "HTTP method: POST, PUT, PATCH, MERGE or DELETE")
	private String method;

	@Option(names = { "--data", "-d" }, description = "JSON file holding the entity data")
	private Path data;

	@Option(names = { "--command" }, description = "Request path relative to the url base (defaults to the collection)")
	private String commandText;

	@Option(names = {
			"--link" }, description = "Write an entity reference link body for this path instead of an entry, e.g. Employees(3)")
	private String linkPath;

	@Option(names = { "--format", "-f" }, defaultValue = "JSON", description = "Payload format: JSON or ATOM")
	private PayloadFormat format;

	@Option(names = { "--url-base", "-u" }, description = "Service root URL")
	private String urlBase;

	@Option(names = { "--indent" }, description = "Pretty-print JSON payloads")
	private boolean indent;

	@Option(names = { "--output", "-o" }, description = "Output file (defaults to standard output)")
	private Path output;

}
