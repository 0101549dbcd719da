package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Objects;

/**
 * A table cell. Cells with the {@link CellStyle#ASCIIDOC} style carry blocks; all others carry inlines.
 */
public record TableCell(CellStyle style, List<Inline> content, List<Block> blocks, Span span) {

	public TableCell {
		style = style != null ? style : CellStyle.DEFAULT;
		content = content != null ? List.copyOf(content) : List.of();
		blocks = blocks != null ? List.copyOf(blocks) : List.of();
		Objects.requireNonNull(span, "span must not be null");
	}

	public String plainText() {
		return Inline.plainText(content);
	}
}
