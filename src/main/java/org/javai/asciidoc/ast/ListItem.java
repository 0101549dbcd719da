package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Objects;

/**
 * One item of a {@link Block.ListBlock}.
 *
 * @param content the item text following the marker
 * @param blocks blocks attached with a list continuation and nested lists
 */
public record ListItem(List<Inline> content, List<Block> blocks, Span span) {

	public ListItem {
		content = content != null ? List.copyOf(content) : List.of();
		blocks = blocks != null ? List.copyOf(blocks) : List.of();
		Objects.requireNonNull(span, "span must not be null");
	}
}
