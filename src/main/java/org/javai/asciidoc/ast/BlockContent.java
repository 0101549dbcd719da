package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Objects;

/**
 * Content of a delimited block: raw text for verbatim kinds, nested blocks otherwise.
 */
public sealed interface BlockContent {

	record Verbatim(String text) implements BlockContent {
		public Verbatim {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	record Compound(List<Block> blocks) implements BlockContent {
		public Compound {
			blocks = blocks != null ? List.copyOf(blocks) : List.of();
		}
	}
}
