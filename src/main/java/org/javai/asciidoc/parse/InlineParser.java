package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.javai.asciidoc.ast.FormatStyle;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;

/**
 * Builds inline nodes from the tokens of one paragraph, title, list item or table cell.
 * <p>
 * Text is rebuilt from the source: each token contributes its own text and the whitespace
 * between consecutive tokens is kept. A gap that is not whitespace is the text of a
 * directive removed by a conditional and is dropped. Adjacent text is merged into one node.
 * <p>
 * A single formatting mark is constrained: it opens only after a non-word character and
 * before a non-space, and closes only after a non-space and before a non-word character.
 * A doubled mark is unconstrained. A mark without a partner is literal text.
 */
public final class InlineParser {

	private final ParserContext ctx;
	private final String source;
	private final List<Token> tokens;
	private final int maxDepth;
	private boolean depthReported = false;
	private final Map<CloserKey, int[]> closerSearches = new HashMap<>();

	public InlineParser(ParserContext ctx, String source, List<Token> tokens) {
		this.ctx = ctx;
		this.source = source;
		this.tokens = tokens;
		this.maxDepth = ctx.config().maxInlineDepth();
	}

	public static List<Inline> parse(ParserContext ctx, String source, List<Token> tokens) {
		return new InlineParser(ctx, source, tokens).parse();
	}

	public List<Inline> parse() {
		if (tokens.isEmpty()) {
			return List.of();
		}
		return parseRange(0, tokens.size(), 0);
	}

	private List<Inline> parseRange(int from, int to, int depth) {
		InlineBuilder out = new InlineBuilder();
		int i = from;
		while (i < to) {
			appendGap(out, i);
			Token token = tokens.get(i);
			switch (token.kind()) {
				case FORMAT_MARK -> {
					int next = parseFormatted(out, i, to, depth);
					if (next < 0) {
						out.text(token.span().slice(source), token.span());
						i++;
					} else {
						i = next;
					}
				}
				case ATTRIBUTE_REF_OPEN -> i = parseAttributeRef(out, i, to);
				case URL -> {
					out.node(new Inline.Link(ctx.substitute(token.value(), token.span()), null, token.span()));
					i++;
				}
				case LINK -> {
					out.node(new Inline.Link(ctx.substitute(token.value(), token.span()), linkText(token.attrlist()),
							token.span()));
					i++;
				}
				case INLINE_MACRO -> {
					out.node(macro(token));
					i++;
				}
				case LINE_BREAK -> {
					out.node(new Inline.LineBreak(token.span()));
					i++;
				}
				case NEWLINE -> {
					out.text("\n", token.span());
					i++;
				}
				case BLANK_LINE -> {
					out.text("\n\n", token.span());
					i++;
				}
				default -> {
					out.text(token.span().slice(source), token.span());
					i++;
				}
			}
		}
		if (to < tokens.size() && to > from) {
			appendGap(out, to);
		}
		return out.build();
	}

	/**
	 * @return the index after the closing mark, or -1 if the mark at {@code open} is literal
	 */
	private int parseFormatted(InlineBuilder out, int open, int to, int depth) {
		Token mark = tokens.get(open);
		boolean constrained = mark.length() == 1;
		if (constrained && !canOpen(mark)) {
			return -1;
		}
		int close = findCloser(mark, constrained, open + 2, to);
		if (close < 0) {
			return -1;
		}
		if (depth >= maxDepth) {
			if (!depthReported) {
				ctx.report(DiagnosticKind.INVALID_NESTING,
						"inline formatting nested deeper than " + maxDepth + " levels", mark.span());
				depthReported = true;
			}
			return -1;
		}
		List<Inline> content = parseRange(open + 1, close, depth + 1);
		out.node(new Inline.Formatted(FormatStyle.fromMark(mark.mark()), content,
				Span.union(mark.span(), tokens.get(close).span())));
		return close + 1;
	}

	/**
	 * Finds the first closing mark at or after {@code from}. The last search per mark and range
	 * end is remembered, so a later search that starts inside an already scanned stretch is
	 * answered without rescanning it.
	 */
	private int findCloser(Token mark, boolean constrained, int from, int to) {
		CloserKey key = new CloserKey(mark.mark(), mark.length(), to);
		int[] last = closerSearches.get(key);
		if (last != null && from >= last[0] && (last[1] < 0 || last[1] >= from)) {
			return last[1];
		}
		int close = -1;
		for (int j = from; j < to; j++) {
			Token candidate = tokens.get(j);
			if (candidate.is(TokenKind.FORMAT_MARK) && candidate.mark() == mark.mark()
					&& candidate.length() == mark.length() && (!constrained || canClose(candidate))) {
				close = j;
				break;
			}
		}
		closerSearches.put(key, new int[] {from, close});
		return close;
	}

	private record CloserKey(char mark, int length, int to) {
	}

	private boolean canOpen(Token mark) {
		int before = mark.start() - 1;
		int after = mark.end();
		return (before < 0 || !isWordChar(source.charAt(before)))
				&& after < source.length() && !Character.isWhitespace(source.charAt(after));
	}

	private boolean canClose(Token mark) {
		int before = mark.start() - 1;
		int after = mark.end();
		return before >= 0 && !Character.isWhitespace(source.charAt(before))
				&& (after >= source.length() || !isWordChar(source.charAt(after)));
	}

	private static boolean isWordChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}

	private int parseAttributeRef(InlineBuilder out, int open, int to) {
		if (open + 2 >= to || !tokens.get(open + 1).is(TokenKind.WORD)
				|| !tokens.get(open + 2).is(TokenKind.ATTRIBUTE_REF_CLOSE)) {
			Token token = tokens.get(open);
			out.text(token.span().slice(source), token.span());
			return open + 1;
		}
		String name = tokens.get(open + 1).value();
		Span span = Span.union(tokens.get(open).span(), tokens.get(open + 2).span());
		Optional<String> value = ctx.resolveAttribute(name, span);
		if (value.isPresent()) {
			out.text(value.get(), span);
		} else {
			out.node(new Inline.AttributeRef(name.toLowerCase(Locale.ROOT), span));
		}
		return open + 3;
	}

	private Inline macro(Token token) {
		String target = ctx.substitute(token.value(), token.span());
		String attrlist = token.attrlist();
		switch (token.name()) {
			case "link" -> {
				return new Inline.Link(target, linkText(attrlist), token.span());
			}
			case "mailto" -> {
				return new Inline.Link("mailto:" + target, linkText(attrlist), token.span());
			}
			case "xref" -> {
				Map<String, String> attributes = new LinkedHashMap<>();
				if (attrlist != null && !attrlist.isBlank()) {
					attributes.put("text", attrlist.strip());
				}
				return new Inline.Macro("xref", target, attributes, token.span());
			}
			default -> {
				Map<String, String> attributes = AttributeListParser.parse(ctx.substitute(attrlist, token.span()));
				return new Inline.Macro(token.name(), target, attributes, token.span());
			}
		}
	}

	private static String linkText(String attrlist) {
		if (attrlist == null || attrlist.isBlank()) {
			return null;
		}
		return attrlist.strip();
	}

	private void appendGap(InlineBuilder out, int index) {
		if (index == 0) {
			return;
		}
		int start = tokens.get(index - 1).end();
		int end = tokens.get(index).start();
		if (end <= start) {
			return;
		}
		String gap = source.substring(start, end);
		if (!gap.isBlank()) {
			return;
		}
		String text = gap.replace("\r", "");
		if (!text.isEmpty()) {
			out.text(text, new Span(start, end));
		}
	}

	/**
	 * Collects inline nodes, merging consecutive text.
	 */
	private static final class InlineBuilder {
		private final List<Inline> nodes = new ArrayList<>();
		private final StringBuilder text = new StringBuilder();
		private int textStart = -1;
		private int textEnd = -1;

		void text(String value, Span span) {
			if (textStart < 0) {
				textStart = span.start();
			}
			textEnd = Math.max(textEnd, span.end());
			text.append(value);
		}

		void node(Inline node) {
			flush();
			nodes.add(node);
		}

		List<Inline> build() {
			flush();
			return nodes;
		}

		private void flush() {
			if (textStart >= 0) {
				nodes.add(new Inline.Text(text.toString(), new Span(textStart, textEnd)));
				text.setLength(0);
				textStart = -1;
				textEnd = -1;
			}
		}
	}
}
