package org.javai.asciidoc.diag;

import java.util.Objects;
import org.javai.asciidoc.ast.Span;

/**
 * A secondary location attached to a diagnostic, e.g. where a block was opened.
 */
public record LabeledSpan(Span span, String label) {

	public LabeledSpan {
		Objects.requireNonNull(span, "span must not be null");
		label = label != null ? label : "";
	}
}
