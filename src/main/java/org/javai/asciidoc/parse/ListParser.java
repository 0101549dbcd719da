package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.asciidoc.ast.Attributes;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.ListItem;
import org.javai.asciidoc.ast.ListKind;
import org.javai.asciidoc.ast.OrderedStyle;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;

/**
 * Parses ordered and unordered lists.
 * <p>
 * Items are grouped by marker class ({@code *}, {@code **}, {@code -}, {@code 1.},
 * {@code a.}, ...). A marker of a class not used by the list or its ancestors starts a
 * nested list inside the current item; an ancestor's class ends the list. Lines that are
 * neither blank nor line-level constructs continue the item text, and each {@code +} line
 * attaches the block that follows it to the item.
 */
final class ListParser {

	private final BlockParser parser;
	private final ParserContext ctx;
	private final TokenCursor cursor;
	private boolean depthReported;

	ListParser(BlockParser parser) {
		this.parser = parser;
		this.ctx = parser.ctx();
		this.cursor = parser.cursor();
	}

	Block.ListBlock parse(Map<String, String> attributes) {
		return parseList(new HashSet<>(), attributes);
	}

	private Block.ListBlock parseList(Set<String> ancestors, Map<String, String> attributes) {
		Token first = cursor.peek();
		String markerClass = first.name();
		Set<String> classes = new HashSet<>(ancestors);
		classes.add(markerClass);

		List<ListItem> items = new ArrayList<>();
		ctx.enterList();
		try {
			while (cursor.check(TokenKind.LIST_MARKER) && markerClass.equals(cursor.peek().name())) {
				items.add(parseItem(classes));
			}
		} finally {
			ctx.leaveList();
		}

		ListKind kind = isUnordered(markerClass) ? ListKind.UNORDERED : ListKind.ORDERED;
		OrderedStyle style = kind == ListKind.ORDERED ? orderedStyle(first.value(), attributes) : null;
		Span span = Span.union(first.span(), items.get(items.size() - 1).span());
		return new Block.ListBlock(kind, style, first.value(), items, attributes, span);
	}

	private ListItem parseItem(Set<String> classes) {
		Token marker = cursor.advance();
		List<Token> text = new ArrayList<>(cursor.restOfLine());
		while (cursor.check(TokenKind.NEWLINE)) {
			int mark = cursor.mark();
			Token newline = cursor.advance();
			Token next = cursor.peek();
			if (next.kind().isLineEnd() || next.kind().isLineLevel()) {
				cursor.reset(mark);
				break;
			}
			text.add(newline);
			text.addAll(cursor.restOfLine());
		}
		Span span = BlockParser.extend(marker.span(), text);

		List<Block> blocks = new ArrayList<>();
		while (true) {
			int mark = cursor.mark();
			cursor.skipNewline();
			if (cursor.check(TokenKind.LIST_CONTINUATION)) {
				if (!ctx.canEnterList()) {
					reportTooDeep(cursor.advance().span());
					cursor.skipNewline();
					break;
				}
				cursor.advance();
				cursor.skipNewline();
				List<Block> attached = parser.parseBlocks(BlockParser.Scope.continuation());
				blocks.addAll(attached);
				if (!attached.isEmpty()) {
					span = Span.union(span, attached.get(attached.size() - 1).span());
				}
				continue;
			}
			while (cursor.check(TokenKind.BLANK_LINE) || cursor.check(TokenKind.NEWLINE)) {
				cursor.advance();
			}
			if (!cursor.check(TokenKind.LIST_MARKER)) {
				cursor.reset(mark);
				break;
			}
			if (classes.contains(cursor.peek().name())) {
				break;
			}
			if (!ctx.canEnterList()) {
				reportTooDeep(cursor.peek().span());
				break;
			}
			Block.ListBlock nested = parseList(classes, Map.of());
			blocks.add(nested);
			span = Span.union(span, nested.span());
		}
		return new ListItem(parser.inline(text), blocks, span);
	}

	/**
	 * Reported once per list; the blocks that would have nested are parsed as siblings instead.
	 */
	private void reportTooDeep(Span span) {
		if (!depthReported) {
			depthReported = true;
			ctx.report(DiagnosticKind.INVALID_NESTING,
					"lists nested deeper than " + ctx.config().maxBlockDepth() + " levels; remaining blocks are not nested",
					span);
		}
	}

	private static boolean isUnordered(String markerClass) {
		return markerClass.startsWith("*") || markerClass.equals("-");
	}

	private static OrderedStyle orderedStyle(String marker, Map<String, String> attributes) {
		String style = Attributes.style(attributes);
		if (style != null) {
			for (OrderedStyle candidate : OrderedStyle.values()) {
				if (candidate.attributeName().equals(style)) {
					return candidate;
				}
			}
		}
		return OrderedStyle.fromMarker(marker);
	}
}
