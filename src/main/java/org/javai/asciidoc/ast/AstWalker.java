package org.javai.asciidoc.ast;

import java.util.List;

/**
 * Pre-order traversal of documents, blocks and inlines.
 */
public final class AstWalker {

	private AstWalker() {
		// Utility class - no instantiation
	}

	/**
	 * Walks the whole document: header title first, then every block in document order.
	 */
	public static void walk(Document document, AstVisitor visitor) {
		if (document == null) {
			return;
		}
		visitor.visitDocument(document);
		if (document.header() != null) {
			visitor.visitHeader(document.header());
			walkInlines(document.header().title(), visitor);
			visitor.leave(document.header());
		}
		walkBlocks(document.blocks(), visitor);
		visitor.leave(document);
	}

	public static void walkBlocks(List<Block> blocks, AstVisitor visitor) {
		for (Block block : blocks) {
			walkBlock(block, visitor);
		}
	}

	public static void walkBlock(Block block, AstVisitor visitor) {
		if (block instanceof Block.Section section) {
			visitor.visitSection(section);
			walkInlines(section.title(), visitor);
			walkBlocks(section.blocks(), visitor);
		} else if (block instanceof Block.Paragraph paragraph) {
			visitor.visitParagraph(paragraph);
			walkInlines(paragraph.content(), visitor);
		} else if (block instanceof Block.Delimited delimited) {
			visitor.visitDelimited(delimited);
			walkBlocks(delimited.blocks(), visitor);
		} else if (block instanceof Block.ListBlock list) {
			visitor.visitList(list);
			for (ListItem item : list.items()) {
				visitor.visitListItem(item);
				walkInlines(item.content(), visitor);
				walkBlocks(item.blocks(), visitor);
				visitor.leave(item);
			}
		} else if (block instanceof Block.Table table) {
			visitor.visitTable(table);
			if (table.header() != null) {
				walkRow(table.header(), true, visitor);
			}
			for (TableRow row : table.rows()) {
				walkRow(row, false, visitor);
			}
		} else if (block instanceof Block.BlockMacro macro) {
			visitor.visitBlockMacro(macro);
		}
		visitor.leave(block);
	}

	private static void walkRow(TableRow row, boolean header, AstVisitor visitor) {
		visitor.visitTableRow(row, header);
		for (TableCell cell : row.cells()) {
			visitor.visitTableCell(cell);
			walkInlines(cell.content(), visitor);
			walkBlocks(cell.blocks(), visitor);
			visitor.leave(cell);
		}
		visitor.leave(row);
	}

	public static void walkInlines(List<Inline> inlines, AstVisitor visitor) {
		for (Inline inline : inlines) {
			walkInline(inline, visitor);
		}
	}

	public static void walkInline(Inline inline, AstVisitor visitor) {
		if (inline instanceof Inline.Text text) {
			visitor.visitText(text);
		} else if (inline instanceof Inline.Formatted formatted) {
			visitor.visitFormatted(formatted);
			walkInlines(formatted.content(), visitor);
			visitor.leave(formatted);
		} else if (inline instanceof Inline.Macro macro) {
			visitor.visitMacro(macro);
		} else if (inline instanceof Inline.Link link) {
			visitor.visitLink(link);
		} else if (inline instanceof Inline.AttributeRef ref) {
			visitor.visitAttributeRef(ref);
		} else if (inline instanceof Inline.LineBreak lineBreak) {
			visitor.visitLineBreak(lineBreak);
		}
	}
}
