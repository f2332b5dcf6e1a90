package com.odata.writer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.odata.writer.cli.exception.OptionsValidationException;
import com.odata.writer.cli.model.ValidatedWriteEntryOptions;
import com.odata.writer.cli.model.WriteEntryOptions;
import com.odata.writer.request.HttpLiteral;

public class WriteEntryOptionsValidator {

	private static final Set<String> METHODS = Set.of(HttpLiteral.POST, HttpLiteral.PUT, HttpLiteral.PATCH,
			HttpLiteral.MERGE, HttpLiteral.DELETE);

	public ValidatedWriteEntryOptions validate(WriteEntryOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getMetadata() == null || !Files.isRegularFile(o.getMetadata())) {
			errors.add("Metadata document does not exist or is not a file: " + o.getMetadata());
		}

		boolean linkOnly = !isBlank(o.getLinkPath());
		String method = o.getMethod() == null ? "" : o.getMethod().trim().toUpperCase(Locale.ROOT);

		if (!linkOnly) {
			if (isBlank(o.getCollection())) {
				errors.add("Entity collection is required (--collection / -c) unless --link is given.");
			}
			if (!METHODS.contains(method)) {
				errors.add("Unsupported method: " + o.getMethod() + ". Expected one of POST, PUT, PATCH, MERGE, DELETE.");
			}
			if (!HttpLiteral.DELETE.equals(method)) {
				if (o.getData() == null) {
					errors.add("Entity data file is required (--data / -d) for " + method + ".");
				} else if (!Files.isRegularFile(o.getData())) {
					errors.add("Entity data file does not exist or is not a file: " + o.getData());
				}
			}
		}

		Path outputPath = null;
		if (o.getOutput() != null) {
			outputPath = o.getOutput().toAbsolutePath().normalize();
			Path parent = outputPath.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				errors.add("Output directory does not exist: " + parent);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		String commandText = isBlank(o.getCommandText()) ? o.getCollection() : o.getCommandText().trim();
		return new ValidatedWriteEntryOptions(method, commandText, linkOnly, outputPath);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
