package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Block-level AST nodes. Sealed so converters can switch over every kind.
 * <p>
 * Blocks can be:
 * <ul>
 *   <li>{@link Section} - a heading and the blocks it owns</li>
 *   <li>{@link Paragraph} - consecutive lines of inline content</li>
 *   <li>{@link Delimited} - a block fenced by repeated-character delimiter lines</li>
 *   <li>{@link ListBlock} - an ordered or unordered list</li>
 *   <li>{@link Table} - rows of cells fenced by {@code |===}</li>
 *   <li>{@link BlockMacro} - a line such as {@code image::diagram.png[]}</li>
 * </ul>
 * Attribute maps hold the block attribute line that preceded the block: positional
 * attributes under {@code "1"}, {@code "2"}, ..., the first one also under {@code "style"},
 * plus {@code "id"}, {@code "role"}, {@code "options"} and {@code "title"} when given.
 */
public sealed interface Block {

	Span span();

	Map<String, String> attributes();

	/**
	 * @param level section level, 1 to 6
	 * @param title the heading text
	 * @param id explicit or generated section id
	 * @param blocks blocks owned by the section, including subsections
	 */
	record Section(int level, List<Inline> title, String id, Map<String, String> attributes,
			List<Block> blocks, Span span) implements Block {
		public Section {
			if (level < 1 || level > 6) {
				throw new IllegalArgumentException("Section level must be between 1 and 6: " + level);
			}
			title = title != null ? List.copyOf(title) : List.of();
			Objects.requireNonNull(id, "id must not be null");
			attributes = Attributes.copyOf(attributes);
			blocks = blocks != null ? List.copyOf(blocks) : List.of();
			Objects.requireNonNull(span, "span must not be null");
		}

		public String titleText() {
			return Inline.plainText(title);
		}
	}

	record Paragraph(List<Inline> content, Map<String, String> attributes, Span span) implements Block {
		public Paragraph {
			content = content != null ? List.copyOf(content) : List.of();
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	record Delimited(DelimitedKind kind, BlockContent content, Map<String, String> attributes, Span span)
			implements Block {
		public Delimited {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(content, "content must not be null");
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}

		/**
		 * Nested blocks of a compound block; empty for verbatim content.
		 */
		public List<Block> blocks() {
			return content instanceof BlockContent.Compound compound ? compound.blocks() : List.of();
		}

		/**
		 * Raw text of a verbatim block, or {@code null} for compound content.
		 */
		public String text() {
			return content instanceof BlockContent.Verbatim verbatim ? verbatim.text() : null;
		}
	}

	/**
	 * @param style numbering style of an ordered list, {@code null} for unordered lists
	 * @param marker the marker of the first item ({@code *}, {@code ..}, {@code 1.}, ...)
	 */
	record ListBlock(ListKind kind, OrderedStyle style, String marker, List<ListItem> items,
			Map<String, String> attributes, Span span) implements Block {
		public ListBlock {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(marker, "marker must not be null");
			items = items != null ? List.copyOf(items) : List.of();
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	/**
	 * @param header the header row, or {@code null} when the table has none
	 */
	record Table(TableRow header, List<TableRow> rows, Map<String, String> attributes, Span span)
			implements Block {
		public Table {
			rows = rows != null ? List.copyOf(rows) : List.of();
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}

		public int columnCount() {
			if (header != null) {
				return header.cells().size();
			}
			return rows.isEmpty() ? 0 : rows.get(0).cells().size();
		}
	}

	record BlockMacro(String name, String target, Map<String, String> attributes, Span span) implements Block {
		public BlockMacro {
			Objects.requireNonNull(name, "name must not be null");
			target = target != null ? target : "";
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}
	}
}
