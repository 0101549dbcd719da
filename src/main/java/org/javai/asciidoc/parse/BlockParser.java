package org.javai.asciidoc.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.asciidoc.ast.AttributeValue;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.BlockContent;
import org.javai.asciidoc.ast.DelimitedKind;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.ast.Header;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Severity;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;
import org.javai.asciidoc.token.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the block structure of one source text.
 * <p>
 * The block loop runs in one of two states. In {@code NORMAL} state each token starts a
 * block (or a line that modifies the next block). After an unexpected token the loop
 * switches to {@code RECOVERING} and skips tokens until a synchronization point: a blank
 * line, a heading, a delimiter line, a table delimiter or the end of input. Exactly one
 * diagnostic is reported per recovery.
 * <p>
 * Lists and tables are delegated to {@link ListParser} and {@link TableParser}, include
 * directives to {@link IncludeProcessor}, inline content to {@link InlineParser}.
 * The parser never throws on malformed content.
 */
public final class BlockParser {

	private static final Logger logger = LoggerFactory.getLogger(BlockParser.class);

	private static final Pattern AUTHOR = Pattern.compile("([^<]*?)\\s*(?:<([^>]*)>)?\\s*");
	private static final Pattern REVISION =
			Pattern.compile("v?(\\d[^,:]*?)\\s*(?:,\\s*([^:]*?))?\\s*(?::\\s*(.*))?");
	private static final Pattern NON_ID_CHARS = Pattern.compile("[^\\p{L}\\p{N}]+");

	private enum State {
		NORMAL,
		RECOVERING
	}

	/**
	 * Where a block sequence is parsed.
	 *
	 * @param sectionLevel a heading at or above this level ends the sequence
	 * @param allowsSections whether headings start sections; otherwise they are demoted to paragraphs
	 * @param maxBlocks number of blocks after which the sequence ends
	 */
	record Scope(int sectionLevel, boolean allowsSections, int maxBlocks) {

		static Scope top(boolean allowsSections) {
			return new Scope(0, allowsSections, Integer.MAX_VALUE);
		}

		static Scope section(int level) {
			return new Scope(level, true, Integer.MAX_VALUE);
		}

		static Scope delimited() {
			return new Scope(0, false, Integer.MAX_VALUE);
		}

		/**
		 * The single block attached to a list item by {@code +}. Any heading ends it.
		 */
		static Scope continuation() {
			return new Scope(6, true, 1);
		}
	}

	private final ParserContext ctx;
	private final String source;
	private final List<Token> tokens;
	private final ConditionalProcessor conditionals;
	private final TokenCursor cursor;
	private final int levelOffset;
	private final Deque<Block> included = new ArrayDeque<>();
	private Map<String, String> pending;
	private Span pendingSpan;

	public BlockParser(ParserContext ctx, String source) {
		this(ctx, source, new Tokenizer(source).tokenize(), 0);
	}

	/**
	 * @param tokens tokens of {@code source}, ending with EOF
	 * @param levelOffset added to every heading level, from an include's {@code leveloffset}
	 */
	public BlockParser(ParserContext ctx, String source, List<Token> tokens, int levelOffset) {
		this.ctx = ctx;
		this.source = source;
		this.tokens = tokens;
		this.conditionals = new ConditionalProcessor(ctx, tokens);
		this.cursor = new TokenCursor(tokens, conditionals);
		this.levelOffset = levelOffset;
	}

	/**
	 * Parses a whole document: an optional header followed by blocks up to the end of input.
	 */
	public Document parseDocument() {
		ctx.registerSource(source.length());
		Header header = parseHeader();
		if (header != null) {
			ctx.enterSection(1);
		}
		List<Block> blocks = parseBlocks(Scope.top(true));
		finish(true);
		logger.debug("Parsed document with {} top-level blocks and {} includes", blocks.size(),
				ctx.includeCount());
		return new Document(ctx.attributes(), header, blocks, ctx.includes(), new Span(0, source.length()));
	}

	/**
	 * Parses a self-contained block sequence, as for an included file or an AsciiDoc table cell.
	 *
	 * @param reportLexErrors whether invalid characters of the source are reported here
	 */
	public List<Block> parseBlockSequence(boolean allowsSections, boolean reportLexErrors) {
		List<Block> blocks = parseBlocks(Scope.top(allowsSections));
		finish(reportLexErrors);
		return blocks;
	}

	private void finish(boolean reportLexErrors) {
		reportPending();
		conditionals.reportUnclosed();
		if (reportLexErrors) {
			reportLexErrors();
		}
	}

	// Header

	private Header parseHeader() {
		while (true) {
			if (cursor.check(TokenKind.BLANK_LINE) || cursor.check(TokenKind.NEWLINE)
					|| cursor.check(TokenKind.COMMENT)) {
				cursor.advance();
			} else if (cursor.check(TokenKind.ATTRIBUTE_ENTRY)) {
				defineAttribute(cursor.advance());
				cursor.skipNewline();
			} else {
				break;
			}
		}
		if (!cursor.check(TokenKind.HEADING) || cursor.peek().length() != 1) {
			return null;
		}
		Token heading = cursor.advance();
		List<Token> titleTokens = cursor.restOfLine();
		List<Inline> title = inline(titleTokens);
		Span span = extend(heading.span(), titleTokens);
		ctx.defineAttribute("doctitle", AttributeValue.of(Inline.plainText(title)), span);
		cursor.skipNewline();

		String author = null;
		String email = null;
		String revision = null;
		if (startsTextLine()) {
			List<Token> line = cursor.restOfLine();
			span = extend(span, line);
			Matcher m = AUTHOR.matcher(lineText(line));
			if (m.matches()) {
				author = blankToNull(m.group(1));
				email = blankToNull(m.group(2));
			}
			cursor.skipNewline();
			if (startsTextLine()) {
				int mark = cursor.mark();
				line = cursor.restOfLine();
				m = REVISION.matcher(lineText(line));
				if (m.matches()) {
					revision = m.group(1);
					span = extend(span, line);
					defineIfPresent("revdate", m.group(2), span);
					defineIfPresent("revremark", m.group(3), span);
					cursor.skipNewline();
				} else {
					cursor.reset(mark);
				}
			}
		}
		defineIfPresent("author", author, span);
		defineIfPresent("email", email, span);
		defineIfPresent("revnumber", revision, span);

		Map<String, AttributeValue> attributes = new LinkedHashMap<>();
		while (cursor.check(TokenKind.ATTRIBUTE_ENTRY) || cursor.check(TokenKind.COMMENT)) {
			Token token = cursor.advance();
			if (token.is(TokenKind.ATTRIBUTE_ENTRY)) {
				defineAttribute(token);
				attributes.put(token.name(), AttributeValue.of(token.value()));
				span = Span.union(span, token.span());
			}
			cursor.skipNewline();
		}
		return new Header(title, author, email, revision, attributes, span);
	}

	private boolean startsTextLine() {
		Token next = cursor.peek();
		return !next.kind().isLineEnd() && !next.kind().isLineLevel();
	}

	private String lineText(List<Token> line) {
		String raw = source.substring(line.get(0).start(), line.get(line.size() - 1).end());
		return ctx.substitute(raw, Span.union(line.get(0).span(), line.get(line.size() - 1).span()));
	}

	private void defineIfPresent(String name, String value, Span span) {
		if (value != null && !value.isBlank()) {
			ctx.defineAttribute(name, AttributeValue.of(value), span);
		}
	}

	// Block loop

	/**
	 * Parses blocks until the end of input, a heading closing {@code scope}, a delimiter line
	 * closing the innermost open block, or {@code scope.maxBlocks()} blocks.
	 * <p>
	 * Blocks of an included file are queued and drained in order. An included section at or
	 * above the level of {@code scope} is left queued, so it ends the enclosing sections and
	 * is attached where a heading of its level would have been.
	 */
	List<Block> parseBlocks(Scope scope) {
		List<Block> blocks = new ArrayList<>();
		State state = State.NORMAL;
		while (true) {
			if (!included.isEmpty()) {
				Block next = included.peek();
				if (next instanceof Block.Section section && section.level() <= scope.sectionLevel()) {
					return blocks;
				}
				blocks.add(included.poll());
				continue;
			}
			if (cursor.isAtEnd() || blocks.size() >= scope.maxBlocks()) {
				break;
			}
			Token token = cursor.peek();
			if (state == State.RECOVERING) {
				if (!isSyncPoint(token.kind())) {
					cursor.advance();
					continue;
				}
				state = State.NORMAL;
			}
			switch (token.kind()) {
				case BLANK_LINE, NEWLINE, COMMENT -> cursor.advance();
				case HEADING -> {
					if (!scope.allowsSections()) {
						ctx.report(DiagnosticKind.INVALID_NESTING,
								"section heading is not allowed inside a delimited block", token.span());
						blocks.add(parseParagraph());
					} else if (headingLevel(token) <= scope.sectionLevel()) {
						return blocks;
					} else {
						blocks.add(parseSection());
					}
				}
				case DELIMITER -> {
					DelimitedKind kind = DelimitedKind.fromLine(token.mark(), token.length());
					ParserContext.OpenBlock open = ctx.topDelimited();
					if (open != null && open.closedBy(kind, token.length())) {
						reportPending();
						return blocks;
					}
					Block block = parseDelimited(kind);
					if (block != null) {
						blocks.add(block);
					}
				}
				case TABLE_DELIMITER, NESTED_TABLE_DELIMITER -> blocks.add(new TableParser(this).parse(takePending()));
				case LIST_MARKER -> blocks.add(new ListParser(this).parse(takePending()));
				case LIST_CONTINUATION -> {
					ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, "list continuation outside of a list item",
							token.span());
					cursor.advance();
					state = State.RECOVERING;
				}
				case ATTRIBUTE_ENTRY -> {
					defineAttribute(cursor.advance());
					cursor.skipNewline();
				}
				case BLOCK_ATTRIBUTES -> {
					cursor.advance();
					addPending(AttributeListParser.parse(ctx.substitute(token.attrlist(), token.span())), token.span());
					cursor.skipNewline();
				}
				case BLOCK_ANCHOR -> {
					cursor.advance();
					Map<String, String> anchor = new LinkedHashMap<>();
					anchor.put("id", token.value());
					if (token.attrlist() != null && !token.attrlist().isBlank()) {
						anchor.put("reftext", token.attrlist().strip());
					}
					addPending(anchor, token.span());
					cursor.skipNewline();
				}
				case BLOCK_TITLE -> {
					cursor.advance();
					List<Token> line = cursor.restOfLine();
					Span span = extend(token.span(), line);
					String title = line.isEmpty() ? "" : lineText(line);
					addPending(Map.of("title", title), span);
					cursor.skipNewline();
				}
				case DIRECTIVE -> {
					if (token.value().isEmpty()) {
						ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, "include directive requires a target",
								token.span());
						cursor.advance();
						state = State.RECOVERING;
					} else {
						cursor.advance();
						cursor.skipNewline();
						included.addAll(new IncludeProcessor(ctx, levelOffset).process(token, scope.allowsSections()));
					}
				}
				case BLOCK_MACRO -> blocks.add(parseBlockMacro());
				default -> blocks.add(parseParagraph());
			}
		}
		if (cursor.isAtEnd()) {
			reportPending();
		}
		return blocks;
	}

	private static boolean isSyncPoint(TokenKind kind) {
		return switch (kind) {
			case BLANK_LINE, HEADING, DELIMITER, TABLE_DELIMITER, EOF -> true;
			default -> false;
		};
	}

	// Sections

	private int headingLevel(Token heading) {
		return Math.max(1, Math.min(6, heading.length() + levelOffset));
	}

	private Block parseSection() {
		Token heading = cursor.advance();
		int level = headingLevel(heading);
		List<Token> titleTokens = cursor.restOfLine();
		List<Inline> title = inline(titleTokens);
		Span headingSpan = extend(heading.span(), titleTokens);
		cursor.skipNewline();

		int parent = ctx.currentLevel();
		if (parent > 0 && level > parent + 1) {
			ctx.report(DiagnosticKind.SECTION_NESTING_VIOLATION,
					"section level " + level + " skips a level; expected at most level " + (parent + 1),
					headingSpan);
		}
		Map<String, String> attributes = takePending();
		String id = attributes.get("id");
		if (id == null) {
			id = ctx.uniqueId(generateId(Inline.plainText(title)));
		}

		int previous = ctx.enterSection(level);
		List<Block> blocks = parseBlocks(Scope.section(level));
		ctx.leaveSection(previous);
		Span span = blocks.isEmpty() ? headingSpan : Span.union(headingSpan, blocks.get(blocks.size() - 1).span());
		return new Block.Section(level, title, id, attributes, blocks, span);
	}

	static String generateId(String title) {
		String words = NON_ID_CHARS.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("_");
		int start = 0;
		int end = words.length();
		while (start < end && words.charAt(start) == '_') {
			start++;
		}
		while (end > start && words.charAt(end - 1) == '_') {
			end--;
		}
		return "_" + words.substring(start, end);
	}

	// Paragraphs

	private Block parseParagraph() {
		List<Token> content = new ArrayList<>(cursor.restOfLine());
		while (cursor.check(TokenKind.NEWLINE)) {
			Token newline = cursor.advance();
			while (cursor.check(TokenKind.COMMENT)) {
				cursor.advance();
				cursor.skipNewline();
			}
			Token next = cursor.peek();
			if (next.kind().isLineEnd() || next.kind().isLineLevel()) {
				break;
			}
			content.add(newline);
			content.addAll(cursor.restOfLine());
		}
		Map<String, String> attributes = takePending();
		Span span = Span.union(content.get(0).span(), content.get(content.size() - 1).span());
		return new Block.Paragraph(inline(content), attributes, span);
	}

	// Delimited blocks

	private Block parseDelimited(DelimitedKind kind) {
		Token open = cursor.peek();
		Map<String, String> attributes = takePending();
		if (kind.isVerbatim()) {
			return parseVerbatim(kind, open, attributes);
		}
		int maxDepth = ctx.config().maxBlockDepth();
		if (ctx.delimitedDepth() >= maxDepth) {
			ctx.report(DiagnosticKind.INVALID_NESTING,
					"delimited blocks nested deeper than " + maxDepth + " levels; content kept verbatim",
					open.span());
			return parseVerbatim(kind, open, attributes);
		}
		cursor.advance();
		cursor.skipNewline();
		ctx.pushDelimited(new ParserContext.OpenBlock(kind, open.length(), open.span()));
		List<Block> blocks = parseBlocks(Scope.delimited());
		ctx.popDelimited();
		Span span;
		if (cursor.check(TokenKind.DELIMITER)) {
			Token close = cursor.advance();
			cursor.skipNewline();
			span = Span.union(open.span(), close.span());
		} else {
			ctx.report(DiagnosticKind.UNCLOSED_DELIMITER,
					name(kind) + " block is never closed; expected " + open.span().slice(source), open.span());
			span = blocks.isEmpty() ? open.span() : Span.union(open.span(), blocks.get(blocks.size() - 1).span());
		}
		return new Block.Delimited(kind, new BlockContent.Compound(blocks), attributes, span);
	}

	/**
	 * Captures the raw text up to the matching delimiter line without interpreting it.
	 * Include and conditional directives inside are literal text.
	 *
	 * @return the block, or {@code null} for a comment block
	 */
	private Block parseVerbatim(DelimitedKind kind, Token open, Map<String, String> attributes) {
		int openIndex = cursor.index();
		int limit = tokens.get(tokens.size() - 1).start();
		int newline = source.indexOf('\n', open.end());
		int contentStart = newline < 0 || newline >= limit ? limit : newline + 1;

		int closeIndex = findClosingDelimiter(openIndex, open);
		String text;
		Span span;
		if (closeIndex >= 0) {
			Token close = tokens.get(closeIndex);
			text = stripFinalNewline(source.substring(Math.min(contentStart, close.start()), close.start()));
			span = Span.union(open.span(), close.span());
			cursor.seek(closeIndex + 1);
			cursor.skipNewline();
		} else {
			ctx.report(DiagnosticKind.UNCLOSED_DELIMITER,
					name(kind) + " block is never closed; expected " + open.span().slice(source), open.span());
			text = stripTrailingNewlines(source.substring(contentStart, limit));
			span = new Span(open.start(), Math.max(open.end(), contentStart + text.length()));
			cursor.seek(tokens.size() - 1);
		}
		if (kind == DelimitedKind.COMMENT) {
			return null;
		}
		return new Block.Delimited(kind, new BlockContent.Verbatim(text), attributes, span);
	}

	private int findClosingDelimiter(int openIndex, Token open) {
		for (int i = openIndex + 1; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (token.is(TokenKind.DELIMITER) && token.mark() == open.mark() && token.length() == open.length()
					&& (token.start() == 0 || source.charAt(token.start() - 1) == '\n')) {
				return i;
			}
		}
		return -1;
	}

	private static String stripFinalNewline(String text) {
		if (text.endsWith("\r\n")) {
			return text.substring(0, text.length() - 2);
		}
		if (text.endsWith("\n")) {
			return text.substring(0, text.length() - 1);
		}
		return text;
	}

	private static String stripTrailingNewlines(String text) {
		int end = text.length();
		while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
			end--;
		}
		return text.substring(0, end);
	}

	private static String name(DelimitedKind kind) {
		return kind.name().toLowerCase(Locale.ROOT);
	}

	// Block macros

	private Block parseBlockMacro() {
		Token token = cursor.advance();
		cursor.skipNewline();
		Map<String, String> attributes = takePending();
		attributes.putAll(AttributeListParser.parse(ctx.substitute(token.attrlist(), token.span())));
		return new Block.BlockMacro(token.name(), ctx.substitute(token.value(), token.span()), attributes,
				token.span());
	}

	// Attributes

	private void defineAttribute(Token entry) {
		ctx.defineAttribute(entry.name(), AttributeValue.of(entry.value()), entry.span());
	}

	private void addPending(Map<String, String> attributes, Span span) {
		if (pending == null) {
			pending = new LinkedHashMap<>();
			pendingSpan = span;
		} else {
			pendingSpan = Span.union(pendingSpan, span);
		}
		pending.putAll(attributes);
	}

	/**
	 * Hands the block attributes collected since the last block to the block being parsed.
	 * An explicit id is registered so generated ids avoid it.
	 */
	Map<String, String> takePending() {
		Map<String, String> attributes = pending != null ? pending : new LinkedHashMap<>();
		pending = null;
		pendingSpan = null;
		String id = attributes.get("id");
		if (id != null) {
			ctx.registerId(id);
		}
		return attributes;
	}

	private void reportPending() {
		if (pending != null) {
			ctx.report(Diagnostic.of(DiagnosticKind.UNEXPECTED_TOKEN,
					"block attributes are not followed by a block", pendingSpan).withSeverity(Severity.WARNING));
			pending = null;
			pendingSpan = null;
		}
	}

	// Lexical errors

	private void reportLexErrors() {
		for (Token token : tokens) {
			if (token.is(TokenKind.LEX_ERROR)) {
				ctx.report(DiagnosticKind.LEX_ERROR, describeInvalid(token.value()), token.span());
			}
		}
	}

	private static String describeInvalid(String text) {
		StringBuilder codes = new StringBuilder();
		for (int i = 0; i < text.length(); i++) {
			if (i > 0) {
				codes.append(' ');
			}
			codes.append(String.format("U+%04X", (int) text.charAt(i)));
		}
		return (text.length() == 1 ? "invalid character " : "invalid characters ") + codes;
	}

	// Shared with the list and table parsers

	ParserContext ctx() {
		return ctx;
	}

	TokenCursor cursor() {
		return cursor;
	}

	String source() {
		return source;
	}

	int levelOffset() {
		return levelOffset;
	}

	List<Inline> inline(List<Token> content) {
		return InlineParser.parse(ctx, source, content);
	}

	static Span extend(Span span, List<Token> line) {
		return line.isEmpty() ? span : Span.union(span, line.get(line.size() - 1).span());
	}

	private static String blankToNull(String value) {
		return value == null || value.isBlank() ? null : value.strip();
	}
}
