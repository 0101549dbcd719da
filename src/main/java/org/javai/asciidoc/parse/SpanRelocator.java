package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.List;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.BlockContent;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.ListItem;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.ast.TableCell;
import org.javai.asciidoc.ast.TableRow;

/**
 * Rebuilds a subtree with every span replaced by one span, used to anchor included
 * content to the include directive.
 */
public final class SpanRelocator {

	private SpanRelocator() {
		// Utility class - no instantiation
	}

	public static List<Block> relocate(List<Block> blocks, Span span) {
		List<Block> result = new ArrayList<>(blocks.size());
		for (Block block : blocks) {
			result.add(relocate(block, span));
		}
		return result;
	}

	public static Block relocate(Block block, Span span) {
		if (block instanceof Block.Section section) {
			return new Block.Section(section.level(), inlines(section.title(), span), section.id(),
					section.attributes(), relocate(section.blocks(), span), span);
		} else if (block instanceof Block.Paragraph paragraph) {
			return new Block.Paragraph(inlines(paragraph.content(), span), paragraph.attributes(), span);
		} else if (block instanceof Block.Delimited delimited) {
			BlockContent content = delimited.content() instanceof BlockContent.Compound compound
					? new BlockContent.Compound(relocate(compound.blocks(), span))
					: delimited.content();
			return new Block.Delimited(delimited.kind(), content, delimited.attributes(), span);
		} else if (block instanceof Block.ListBlock list) {
			List<ListItem> items = new ArrayList<>();
			for (ListItem item : list.items()) {
				items.add(new ListItem(inlines(item.content(), span), relocate(item.blocks(), span), span));
			}
			return new Block.ListBlock(list.kind(), list.style(), list.marker(), items, list.attributes(), span);
		} else if (block instanceof Block.Table table) {
			List<TableRow> rows = new ArrayList<>();
			for (TableRow row : table.rows()) {
				rows.add(row(row, span));
			}
			TableRow header = table.header() != null ? row(table.header(), span) : null;
			return new Block.Table(header, rows, table.attributes(), span);
		} else if (block instanceof Block.BlockMacro macro) {
			return new Block.BlockMacro(macro.name(), macro.target(), macro.attributes(), span);
		}
		throw new IllegalArgumentException("Unknown block type: " + block.getClass().getName());
	}

	private static TableRow row(TableRow row, Span span) {
		List<TableCell> cells = new ArrayList<>();
		for (TableCell cell : row.cells()) {
			cells.add(new TableCell(cell.style(), inlines(cell.content(), span), relocate(cell.blocks(), span), span));
		}
		return new TableRow(cells, span);
	}

	private static List<Inline> inlines(List<Inline> inlines, Span span) {
		List<Inline> result = new ArrayList<>(inlines.size());
		for (Inline inline : inlines) {
			result.add(inline(inline, span));
		}
		return result;
	}

	private static Inline inline(Inline inline, Span span) {
		if (inline instanceof Inline.Text text) {
			return new Inline.Text(text.text(), span);
		} else if (inline instanceof Inline.Formatted formatted) {
			return new Inline.Formatted(formatted.style(), inlines(formatted.content(), span), span);
		} else if (inline instanceof Inline.Macro macro) {
			return new Inline.Macro(macro.name(), macro.target(), macro.attributes(), span);
		} else if (inline instanceof Inline.Link link) {
			return new Inline.Link(link.url(), link.text(), span);
		} else if (inline instanceof Inline.AttributeRef ref) {
			return new Inline.AttributeRef(ref.name(), span);
		} else if (inline instanceof Inline.LineBreak) {
			return new Inline.LineBreak(span);
		}
		throw new IllegalArgumentException("Unknown inline type: " + inline.getClass().getName());
	}
}
