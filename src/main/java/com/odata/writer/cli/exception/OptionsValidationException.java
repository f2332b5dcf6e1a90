package com.odata.writer.cli.exception;

import java.util.List;

/**
 * Raised by the options validator with every problem it found, so the user can fix the
 * whole command line in one go.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(errors.size() + " invalid option(s):" + System.lineSeparator()
				+ String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
