package org.javai.asciidoc.diag;

import java.util.List;
import java.util.Objects;
import org.javai.asciidoc.ast.Span;

/**
 * A problem found in the source, located by a primary span.
 *
 * @param kind what went wrong
 * @param severity how bad it is, normally the kind's default severity
 * @param message human-readable description
 * @param primary the location the problem is reported at
 * @param secondary related locations, each with a label
 */
public record Diagnostic(DiagnosticKind kind, Severity severity, String message, Span primary,
		List<LabeledSpan> secondary) {

	public Diagnostic {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(severity, "severity must not be null");
		Objects.requireNonNull(message, "message must not be null");
		Objects.requireNonNull(primary, "primary must not be null");
		secondary = secondary != null ? List.copyOf(secondary) : List.of();
	}

	public static Diagnostic of(DiagnosticKind kind, String message, Span primary) {
		return new Diagnostic(kind, kind.defaultSeverity(), message, primary, List.of());
	}

	public static Diagnostic of(DiagnosticKind kind, String message, Span primary, LabeledSpan... secondary) {
		return new Diagnostic(kind, kind.defaultSeverity(), message, primary, List.of(secondary));
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	public Diagnostic withSeverity(Severity newSeverity) {
		return new Diagnostic(kind, newSeverity, message, primary, secondary);
	}

	@Override
	public String toString() {
		return severity.label() + "[" + kind + "] " + message + " @" + primary;
	}
}
