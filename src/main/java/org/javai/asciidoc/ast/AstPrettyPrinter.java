package org.javai.asciidoc.ast;

/**
 * Visitor that renders an AST as an indented tree, one node per line.
 * <pre>
 * Document
 *   Header
 *     Text "Title"
 *   Paragraph
 *     Text "Hello "
 *     Formatted STRONG
 *       Text "world"
 *     Text "."
 * </pre>
 */
public class AstPrettyPrinter implements AstVisitor {

	private final StringBuilder output = new StringBuilder();
	private final int indentSize;
	private int indentLevel = 0;

	public AstPrettyPrinter() {
		this(2);
	}

	public AstPrettyPrinter(int indentSize) {
		this.indentSize = indentSize;
	}

	@Override
	public void visitDocument(Document document) {
		open("Document");
	}

	@Override
	public void visitHeader(Header header) {
		StringBuilder line = new StringBuilder("Header");
		if (header.author() != null) {
			line.append(" author=").append(quote(header.author()));
		}
		if (header.email() != null) {
			line.append(" email=").append(quote(header.email()));
		}
		if (header.revision() != null) {
			line.append(" revision=").append(quote(header.revision()));
		}
		open(line.toString());
	}

	@Override
	public void visitSection(Block.Section section) {
		open("Section " + section.level() + " #" + section.id());
	}

	@Override
	public void visitParagraph(Block.Paragraph paragraph) {
		open("Paragraph" + attributes(paragraph));
	}

	@Override
	public void visitDelimited(Block.Delimited delimited) {
		String text = delimited.text();
		open("Delimited " + delimited.kind() + attributes(delimited) + (text != null ? " " + quote(text) : ""));
	}

	@Override
	public void visitList(Block.ListBlock list) {
		String style = list.style() != null ? " " + list.style().attributeName() : "";
		open("List " + list.kind() + style + " " + quote(list.marker()));
	}

	@Override
	public void visitListItem(ListItem item) {
		open("Item");
	}

	@Override
	public void visitTable(Block.Table table) {
		open("Table cols=" + table.columnCount() + attributes(table));
	}

	@Override
	public void visitTableRow(TableRow row, boolean header) {
		open(header ? "Row (header)" : "Row");
	}

	@Override
	public void visitTableCell(TableCell cell) {
		open("Cell " + cell.style());
	}

	@Override
	public void visitBlockMacro(Block.BlockMacro macro) {
		open("BlockMacro " + macro.name() + "::" + macro.target() + attributes(macro));
	}

	@Override
	public void visitText(Inline.Text text) {
		line("Text " + quote(text.text()));
	}

	@Override
	public void visitFormatted(Inline.Formatted formatted) {
		open("Formatted " + formatted.style());
	}

	@Override
	public void visitMacro(Inline.Macro macro) {
		line("Macro " + macro.name() + ":" + macro.target() + (macro.attributes().isEmpty() ? "" : " " + macro.attributes()));
	}

	@Override
	public void visitLink(Inline.Link link) {
		line("Link " + link.url() + (link.text() != null ? " " + quote(link.text()) : ""));
	}

	@Override
	public void visitAttributeRef(Inline.AttributeRef ref) {
		line("AttributeRef {" + ref.name() + "}");
	}

	@Override
	public void visitLineBreak(Inline.LineBreak lineBreak) {
		line("LineBreak");
	}

	@Override
	public void leave(Object node) {
		indentLevel--;
	}

	private void open(String text) {
		line(text);
		indentLevel++;
	}

	private void line(String text) {
		output.append(" ".repeat(indentLevel * indentSize)).append(text).append('\n');
	}

	private static String attributes(Block block) {
		return block.attributes().isEmpty() ? "" : " " + block.attributes();
	}

	private static String quote(String value) {
		return '"' + value.replace("\\", "\\\\")
			.replace("\"", "\\\"")
			.replace("\n", "\\n")
			.replace("\t", "\\t")
			.replace("\r", "\\r") + '"';
	}

	/**
	 * Returns the rendered tree.
	 */
	@Override
	public String toString() {
		return output.toString();
	}

	/**
	 * Static convenience method to render a whole document.
	 */
	public static String print(Document document) {
		AstPrettyPrinter printer = new AstPrettyPrinter();
		AstWalker.walk(document, printer);
		return printer.toString();
	}

	/**
	 * Static convenience method to render a single block and its descendants.
	 */
	public static String print(Block block) {
		AstPrettyPrinter printer = new AstPrettyPrinter();
		AstWalker.walkBlock(block, printer);
		return printer.toString();
	}
}
