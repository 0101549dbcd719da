package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Objects;

public record TableRow(List<TableCell> cells, Span span) {

	public TableRow {
		cells = cells != null ? List.copyOf(cells) : List.of();
		Objects.requireNonNull(span, "span must not be null");
	}
}
