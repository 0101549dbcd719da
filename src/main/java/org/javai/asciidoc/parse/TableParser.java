package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.CellStyle;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.ast.TableCell;
import org.javai.asciidoc.ast.TableRow;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Severity;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;
import org.javai.asciidoc.token.Tokenizer;

/**
 * Parses a table fenced by {@code |===} (or {@code !===} for a table nested in a cell).
 * <p>
 * The column count comes from the {@code cols} attribute when present, otherwise from the
 * number of cells on the first line. The first row is a header when the {@code header}
 * option is set, or when the first line is followed by a blank line and {@code noheader}
 * is not set. Cells styled {@code a} are parsed as blocks, {@code l} cells keep their
 * text literally, the rest are parsed as inline content.
 */
final class TableParser {

	private static final Pattern COLUMN = Pattern.compile("(?:(\\d{1,3})\\*)?(.*)");

	private final BlockParser parser;
	private final ParserContext ctx;
	private final TokenCursor cursor;
	private final String source;

	TableParser(BlockParser parser) {
		this.parser = parser;
		this.ctx = parser.ctx();
		this.cursor = parser.cursor();
		this.source = parser.source();
	}

	private static final class RawCell {
		private final Token separator;
		private final List<Token> content = new ArrayList<>();

		RawCell(Token separator) {
			this.separator = separator;
		}

		List<Token> trimmed() {
			int from = 0;
			int to = content.size();
			while (from < to && content.get(from).kind().isLineEnd()) {
				from++;
			}
			while (to > from && content.get(to - 1).kind().isLineEnd()) {
				to--;
			}
			return content.subList(from, to);
		}
	}

	Block.Table parse(Map<String, String> attributes) {
		Token open = cursor.advance();
		String separator = open.is(TokenKind.TABLE_DELIMITER) ? "|" : "!";
		cursor.skipNewline();

		List<RawCell> cells = new ArrayList<>();
		RawCell current = null;
		int firstLineCells = -1;
		boolean firstLineThenBlank = false;
		boolean strayReported = false;
		Token close = null;
		while (!cursor.isAtEnd()) {
			Token token = cursor.peek();
			if (token.kind() == open.kind() && token.length() == open.length() && cursor.atLineStart()) {
				close = cursor.advance();
				cursor.skipNewline();
				break;
			}
			cursor.advance();
			if (token.is(TokenKind.CELL_SEPARATOR) && separator.equals(token.value())) {
				current = new RawCell(token);
				cells.add(current);
			} else if (token.is(TokenKind.NEWLINE) || token.is(TokenKind.BLANK_LINE)) {
				if (firstLineCells < 0 && !cells.isEmpty()) {
					firstLineCells = cells.size();
					firstLineThenBlank = token.is(TokenKind.BLANK_LINE);
				}
				if (current != null) {
					current.content.add(token);
				}
			} else if (token.is(TokenKind.COMMENT)) {
				continue;
			} else if (current == null) {
				if (!strayReported) {
					ctx.report(DiagnosticKind.UNEXPECTED_TOKEN,
							"table content before the first cell separator '" + separator + "'", token.span());
					strayReported = true;
				}
			} else {
				current.content.add(token);
			}
		}
		if (firstLineCells < 0) {
			firstLineCells = cells.size();
		}

		List<CellStyle> columns = columnStyles(attributes.get("cols"));
		int columnCount = columns != null ? columns.size() : Math.max(1, firstLineCells);
		boolean header = AttributeListParser.hasOption(attributes, "header")
				|| (firstLineThenBlank && firstLineCells == columnCount
						&& !AttributeListParser.hasOption(attributes, "noheader"));

		List<TableRow> rows = new ArrayList<>();
		TableRow headerRow = null;
		for (int start = 0; start < cells.size(); start += columnCount) {
			int end = Math.min(cells.size(), start + columnCount);
			boolean isHeader = header && start == 0;
			List<TableCell> rowCells = new ArrayList<>();
			for (int i = start; i < end; i++) {
				CellStyle columnStyle = columns != null ? columns.get(i - start) : CellStyle.DEFAULT;
				rowCells.add(buildCell(cells.get(i), columnStyle, isHeader));
			}
			TableRow row = new TableRow(rowCells,
					Span.union(rowCells.get(0).span(), rowCells.get(rowCells.size() - 1).span()));
			if (end - start < columnCount) {
				ctx.report(Diagnostic.of(DiagnosticKind.UNEXPECTED_TOKEN,
						"incomplete table row: " + (end - start) + " of " + columnCount + " cells", row.span())
						.withSeverity(Severity.WARNING));
			}
			if (isHeader) {
				headerRow = row;
			} else {
				rows.add(row);
			}
		}

		Span span;
		if (close != null) {
			span = Span.union(open.span(), close.span());
		} else {
			ctx.report(DiagnosticKind.UNCLOSED_DELIMITER,
					"table is never closed; expected " + open.span().slice(source), open.span());
			span = rows.isEmpty() ? open.span() : Span.union(open.span(), rows.get(rows.size() - 1).span());
			if (headerRow != null) {
				span = Span.union(span, headerRow.span());
			}
		}
		return new Block.Table(headerRow, rows, attributes, span);
	}

	private TableCell buildCell(RawCell cell, CellStyle columnStyle, boolean header) {
		String letter = cell.separator.name();
		CellStyle style = letter != null ? CellStyle.fromLetter(letter) : columnStyle;
		List<Token> content = cell.trimmed();
		if (content.isEmpty()) {
			return new TableCell(style, List.of(), List.of(), cell.separator.span());
		}
		Token first = content.get(0);
		Token last = content.get(content.size() - 1);
		Span span = Span.union(cell.separator.span(), last.span());
		if (header) {
			return new TableCell(style, parser.inline(content), List.of(), span);
		}
		return switch (style) {
			case ASCIIDOC -> new TableCell(style, List.of(), parseBlocks(first.start(), last.end()), span);
			case LITERAL -> new TableCell(style,
					List.of(new Inline.Text(source.substring(first.start(), last.end()),
							Span.union(first.span(), last.span()))),
					List.of(), span);
			default -> new TableCell(style, parser.inline(content), List.of(), span);
		};
	}

	/**
	 * Parses the text of an AsciiDoc cell as a block sequence without sections. Blocks opened
	 * outside the table cannot be closed from inside the cell.
	 */
	private List<Block> parseBlocks(int from, int to) {
		List<Token> tokens = new Tokenizer(source, from, to).tokenize();
		int floor = ctx.lockDelimited();
		try {
			BlockParser child = new BlockParser(ctx, source, tokens, parser.levelOffset());
			return child.parseBlockSequence(false, false);
		} finally {
			ctx.unlockDelimited(floor);
		}
	}

	/**
	 * Reads the column styles from a {@code cols} attribute: {@code 3} (three columns),
	 * {@code 1,2a} (one entry per column, optional style letter last) or {@code 3*a}
	 * (repeated entry).
	 *
	 * @return the style of each column, or {@code null} if the attribute is absent or unusable
	 */
	static List<CellStyle> columnStyles(String cols) {
		if (cols == null || cols.isBlank()) {
			return null;
		}
		String[] entries = cols.split("[,;]");
		if (entries.length == 1 && entries[0].strip().matches("\\d{1,3}")) {
			int count = Integer.parseInt(entries[0].strip());
			return count > 0 ? Collections.nCopies(count, CellStyle.DEFAULT) : null;
		}
		List<CellStyle> styles = new ArrayList<>();
		for (String entry : entries) {
			Matcher m = COLUMN.matcher(entry.strip());
			if (!m.matches()) {
				continue;
			}
			int repeat = m.group(1) != null ? Integer.parseInt(m.group(1)) : 1;
			String format = m.group(2);
			CellStyle style = format.isEmpty() ? CellStyle.DEFAULT
					: CellStyle.fromLetter(format.substring(format.length() - 1));
			for (int i = 0; i < repeat; i++) {
				styles.add(style);
			}
		}
		return styles.isEmpty() ? null : styles;
	}
}
