package org.javai.asciidoc;

import java.util.List;
import java.util.Objects;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Severity;

/**
 * Outcome of parsing one document: the AST, which is always produced, and every
 * diagnostic reported while parsing and validating it, sorted by source position.
 */
public record ParseResult(Document document, List<Diagnostic> diagnostics) {

	public ParseResult {
		Objects.requireNonNull(document, "document must not be null");
		diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public boolean isClean() {
		return diagnostics.isEmpty();
	}

	public List<Diagnostic> errors() {
		return withSeverity(Severity.ERROR);
	}

	public List<Diagnostic> warnings() {
		return withSeverity(Severity.WARNING);
	}

	public List<Diagnostic> diagnostics(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}

	private List<Diagnostic> withSeverity(Severity severity) {
		return diagnostics.stream().filter(d -> d.severity() == severity).toList();
	}
}
