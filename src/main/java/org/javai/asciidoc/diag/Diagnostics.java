package org.javai.asciidoc.diag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import org.javai.asciidoc.ast.Span;

/**
 * Accumulates diagnostics in report order. Nothing is ever removed.
 */
public final class Diagnostics {

	private static final Comparator<Diagnostic> BY_POSITION =
			Comparator.comparingInt((Diagnostic d) -> d.primary().start());

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public void add(Diagnostic diagnostic) {
		diagnostics.add(diagnostic);
	}

	public void addAll(List<Diagnostic> more) {
		diagnostics.addAll(more);
	}

	public void report(DiagnosticKind kind, String message, Span primary, LabeledSpan... secondary) {
		add(Diagnostic.of(kind, message, primary, secondary));
	}

	public List<Diagnostic> list() {
		return Collections.unmodifiableList(diagnostics);
	}

	public int size() {
		return diagnostics.size();
	}

	public boolean isEmpty() {
		return diagnostics.isEmpty();
	}

	public boolean hasErrors() {
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public long count(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).count();
	}

	/**
	 * Returns the diagnostics stably sorted by primary span start: diagnostics at the same
	 * offset keep their report order.
	 */
	public List<Diagnostic> sorted() {
		return sorted(diagnostics);
	}

	public static List<Diagnostic> sorted(List<Diagnostic> diagnostics) {
		List<Diagnostic> copy = new ArrayList<>(diagnostics);
		copy.sort(BY_POSITION);
		return List.copyOf(copy);
	}
}
