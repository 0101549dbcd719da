package org.javai.asciidoc.diag;

/**
 * The closed set of problems the tokenizer, parser and validator report.
 */
public enum DiagnosticKind {
	LEX_ERROR(Severity.ERROR),
	UNEXPECTED_TOKEN(Severity.ERROR),
	UNCLOSED_DELIMITER(Severity.ERROR),
	INVALID_NESTING(Severity.ERROR),
	INCLUDE_DEPTH_EXCEEDED(Severity.ERROR),
	INCLUDE_NOT_FOUND(Severity.ERROR),
	INCLUDE_PATH_REJECTED(Severity.ERROR),
	CIRCULAR_ATTRIBUTE_REFERENCE(Severity.ERROR),
	UNDEFINED_ATTRIBUTE(Severity.WARNING),
	SECTION_NESTING_VIOLATION(Severity.ERROR),
	DUPLICATE_ID(Severity.WARNING);

	private final Severity defaultSeverity;

	DiagnosticKind(Severity defaultSeverity) {
		this.defaultSeverity = defaultSeverity;
	}

	public Severity defaultSeverity() {
		return defaultSeverity;
	}
}
