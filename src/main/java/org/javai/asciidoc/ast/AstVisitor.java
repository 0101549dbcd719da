package org.javai.asciidoc.ast;

/**
 * Visitor for traversing a parsed document with {@link AstWalker}.
 * <p>
 * Every method has an empty default so implementations override only the nodes they
 * care about. {@code leave*} methods are called after a container's children have been
 * walked, which lets stateful visitors track depth.
 */
public interface AstVisitor {

	default void visitDocument(Document document) {
	}

	default void visitHeader(Header header) {
	}

	default void visitSection(Block.Section section) {
	}

	default void visitParagraph(Block.Paragraph paragraph) {
	}

	default void visitDelimited(Block.Delimited delimited) {
	}

	default void visitList(Block.ListBlock list) {
	}

	default void visitListItem(ListItem item) {
	}

	default void visitTable(Block.Table table) {
	}

	default void visitTableRow(TableRow row, boolean header) {
	}

	default void visitTableCell(TableCell cell) {
	}

	default void visitBlockMacro(Block.BlockMacro macro) {
	}

	default void visitText(Inline.Text text) {
	}

	default void visitFormatted(Inline.Formatted formatted) {
	}

	default void visitMacro(Inline.Macro macro) {
	}

	default void visitLink(Inline.Link link) {
	}

	default void visitAttributeRef(Inline.AttributeRef ref) {
	}

	default void visitLineBreak(Inline.LineBreak lineBreak) {
	}

	/**
	 * Called after the header title or any block's children have been walked.
	 */
	default void leave(Object node) {
	}
}
