package org.javai.asciidoc.token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.asciidoc.ast.DelimitedKind;
import org.javai.asciidoc.ast.FormatStyle;
import org.javai.asciidoc.ast.Span;

/**
 * Converts AsciiDoc source into a stream of tokens.
 * <p>
 * Recognition is line-oriented: at the start of each line the line-level constructs
 * (delimiters, headings, attribute entries, directives, list markers, ...) are tried first,
 * then the rest of the line is split into inline tokens. Inline whitespace is elided; the
 * parser recovers it from the gaps between token spans.
 * <p>
 * The tokenizer never fails. Characters that cannot appear in a document (control
 * characters, the U+FFFD replacement character, unpaired surrogates) become
 * {@link TokenKind#LEX_ERROR} tokens and tokenization continues.
 */
public class Tokenizer implements Iterator<Token> {

	private static final Pattern TABLE_DELIMITER = Pattern.compile("([|!])(={3,})");
	private static final Pattern HEADING = Pattern.compile("(={1,6})[ \\t]+\\S.*");
	private static final Pattern ATTRIBUTE_ENTRY =
			Pattern.compile(":(!)?([A-Za-z0-9_][A-Za-z0-9_-]*)(!)?:(?:[ \\t]+(.*))?");
	private static final Pattern DIRECTIVE =
			Pattern.compile("(ifdef|ifndef|ifeval|endif|include)::([^\\[]*)\\[(.*)]");
	private static final Pattern BLOCK_ANCHOR =
			Pattern.compile("\\[\\[([A-Za-z_:][\\w:.-]*)(?:,\\s*(.*?))?]]");
	private static final Pattern BLOCK_MACRO = Pattern.compile("([A-Za-z][\\w-]*)::(\\S*?)\\[(.*)]");
	private static final Pattern BLOCK_ATTRIBUTES = Pattern.compile("\\[((?:[^\\[].*)?)]");
	private static final Pattern BLOCK_TITLE = Pattern.compile("\\.[^.\\s].*");
	private static final Pattern LIST_MARKER = Pattern.compile(
			"([ \\t]*)(\\*{1,5}|-|\\.{1,5}|\\d+\\.|[a-z]\\.|[A-Z]\\.|[ivxlcdm]+\\)|[IVXLCDM]+\\))[ \\t]+\\S.*");

	private static final Pattern ATTRIBUTE_REF = Pattern.compile("\\{([A-Za-z0-9_][A-Za-z0-9_-]*)}");
	private static final Pattern XREF = Pattern.compile("<<([^\\s,>]+)(?:,\\s*([^>]*))?>>");
	private static final Pattern URL =
			Pattern.compile("(?:https?|ftp|irc|file)://[^\\s\\[\\]<>\"]+|mailto:[^\\s\\[\\]<>\"]+");
	private static final Pattern INLINE_MACRO =
			Pattern.compile("([A-Za-z][\\w-]*):(?!/)([^\\s\\[\\]]*)\\[([^\\]\\n]*)]");

	private static final String CELL_STYLE_LETTERS = "adehlmsv";
	private static final String URL_TRAILING_PUNCTUATION = ".,;:!?)'";

	private final String input;
	private final int from;
	private final int to;
	private final Deque<Token> pending = new ArrayDeque<>();
	private int pos;
	private int lineBegin;
	private boolean lineStart = true;
	private boolean nestedTable = false;
	private boolean finished = false;

	public Tokenizer(String input) {
		this(input != null ? input : "", 0, input != null ? input.length() : 0);
	}

	/**
	 * Tokenizes only {@code input[from, to)}; token spans stay absolute offsets into {@code input}.
	 * The range start is treated as the start of a line.
	 */
	public Tokenizer(String input, int from, int to) {
		this.input = Objects.requireNonNull(input, "input must not be null");
		if (from < 0 || to > input.length() || from > to) {
			throw new IllegalArgumentException("Invalid range [" + from + ", " + to + ") for input of length " + input.length());
		}
		this.from = from;
		this.to = to;
		this.pos = from;
		if (from > 0 && input.charAt(from - 1) != '\n') {
			skipWhitespace();
		}
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return list of tokens (includes EOF token at end)
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<>();
		while (hasNext()) {
			tokens.add(next());
		}
		return tokens;
	}

	@Override
	public boolean hasNext() {
		return !pending.isEmpty() || !finished;
	}

	@Override
	public Token next() {
		while (pending.isEmpty()) {
			if (finished) {
				throw new NoSuchElementException("Tokenizer already produced EOF");
			}
			scan();
		}
		return pending.poll();
	}

	private void scan() {
		if (lineStart) {
			lineStart = false;
			lineBegin = pos;
			if (scanLine()) {
				return;
			}
		}
		skipWhitespace();
		if (isAtEnd()) {
			pending.add(Token.of(TokenKind.EOF, to, to, ""));
			finished = true;
			return;
		}
		if (peek() == '\n') {
			scanNewline();
		} else {
			scanInline();
		}
	}

	// Line-level constructs

	private boolean scanLine() {
		int lineEnd = lineEnd(pos);
		if (isBlank(pos, lineEnd)) {
			int blankEnd = blankRunEnd(pos);
			if (blankEnd < 0) {
				return false;
			}
			emit(Token.of(TokenKind.BLANK_LINE, pos, blankEnd, null));
			pos = blankEnd;
			lineStart = true;
			return true;
		}
		int start = pos;
		int end = lineEnd;
		while (isWhitespace(input.charAt(end - 1))) {
			end--;
		}
		String trimmed = input.substring(start, end);

		char first = trimmed.charAt(0);
		if (isRepeated(trimmed, first)) {
			DelimitedKind kind = DelimitedKind.fromLine(first, trimmed.length());
			if (kind != null) {
				emit(new Token(TokenKind.DELIMITER, new Span(start, end), trimmed.length(), null,
						String.valueOf(first), null));
				pos = end;
				return true;
			}
		}
		Matcher m = TABLE_DELIMITER.matcher(trimmed);
		if (m.matches()) {
			boolean nested = m.group(1).equals("!");
			if (nested) {
				nestedTable = !nestedTable;
			}
			emit(new Token(nested ? TokenKind.NESTED_TABLE_DELIMITER : TokenKind.TABLE_DELIMITER,
					new Span(start, end), trimmed.length(), null, m.group(1), null));
			pos = end;
			return true;
		}
		if (trimmed.startsWith("//")) {
			emit(Token.of(TokenKind.COMMENT, start, end, trimmed.substring(2).strip()));
			pos = end;
			return true;
		}
		m = HEADING.matcher(trimmed);
		if (m.matches()) {
			int level = m.group(1).length();
			emit(new Token(TokenKind.HEADING, new Span(start, start + level), level, null, m.group(1), null));
			pos = start + level;
			return true;
		}
		m = ATTRIBUTE_ENTRY.matcher(trimmed);
		if (m.matches()) {
			boolean unset = m.group(1) != null || m.group(3) != null;
			String value = unset ? null : (m.group(4) != null ? m.group(4).strip() : "");
			emit(new Token(TokenKind.ATTRIBUTE_ENTRY, new Span(start, end), trimmed.length(),
					m.group(2).toLowerCase(Locale.ROOT), value, null));
			pos = end;
			return true;
		}
		m = DIRECTIVE.matcher(trimmed);
		if (m.matches()) {
			scanDirective(m, start, end);
			return true;
		}
		m = BLOCK_ANCHOR.matcher(trimmed);
		if (m.matches()) {
			emit(new Token(TokenKind.BLOCK_ANCHOR, new Span(start, end), trimmed.length(), null,
					m.group(1), m.group(2)));
			pos = end;
			return true;
		}
		m = BLOCK_MACRO.matcher(trimmed);
		if (m.matches()) {
			emit(new Token(TokenKind.BLOCK_MACRO, new Span(start, end), trimmed.length(), m.group(1),
					m.group(2), m.group(3)));
			pos = end;
			return true;
		}
		m = BLOCK_ATTRIBUTES.matcher(trimmed);
		if (m.matches()) {
			emit(new Token(TokenKind.BLOCK_ATTRIBUTES, new Span(start, end), trimmed.length(), null, null,
					m.group(1)));
			pos = end;
			return true;
		}
		if (BLOCK_TITLE.matcher(trimmed).matches()) {
			emit(Token.of(TokenKind.BLOCK_TITLE, start, start + 1, "."));
			pos = start + 1;
			return true;
		}
		if (trimmed.equals("+")) {
			emit(Token.of(TokenKind.LIST_CONTINUATION, start, end, "+"));
			pos = end;
			return true;
		}
		m = LIST_MARKER.matcher(trimmed);
		if (m.matches()) {
			String marker = m.group(2);
			int markerStart = start + m.group(1).length();
			emit(new Token(TokenKind.LIST_MARKER, new Span(markerStart, markerStart + marker.length()),
					listDepth(marker), listClass(marker), marker, null));
			pos = markerStart + marker.length();
			return true;
		}
		return false;
	}

	private void scanDirective(Matcher m, int start, int end) {
		String name = m.group(1);
		String target = m.group(2).strip();
		String attrlist = m.group(3);
		boolean singleLine = (name.equals("ifdef") || name.equals("ifndef")) && !attrlist.isBlank();
		if (!singleLine) {
			emit(new Token(TokenKind.DIRECTIVE, new Span(start, end), end - start, name, target, attrlist));
			pos = end;
			return;
		}
		// ifdef::name[content] is followed by the tokens of its content
		int contentStart = start + m.start(3);
		int contentEnd = start + m.end(3);
		emit(new Token(TokenKind.DIRECTIVE, new Span(start, contentStart), contentStart - start, name, target,
				attrlist));
		Tokenizer content = new Tokenizer(input, contentStart, contentEnd);
		while (content.hasNext()) {
			Token token = content.next();
			if (!token.is(TokenKind.EOF)) {
				emit(token);
			}
		}
		pos = end;
	}

	private static boolean isRepeated(String line, char c) {
		if (line.length() < 2) {
			return false;
		}
		for (int i = 1; i < line.length(); i++) {
			if (line.charAt(i) != c) {
				return false;
			}
		}
		return true;
	}

	private static int listDepth(String marker) {
		char c = marker.charAt(0);
		return c == '*' || c == '.' ? marker.length() : 1;
	}

	private static String listClass(String marker) {
		char c = marker.charAt(0);
		if (c == '*' || c == '.' || c == '-') {
			return marker;
		}
		if (Character.isDigit(c)) {
			return "1.";
		}
		if (marker.endsWith(")")) {
			return Character.isUpperCase(c) ? "I)" : "i)";
		}
		return Character.isUpperCase(c) ? "A." : "a.";
	}

	// Newlines

	private void scanNewline() {
		int newline = pos;
		int blankEnd = blankRunEnd(newline + 1);
		if (blankEnd >= 0) {
			emit(Token.of(TokenKind.BLANK_LINE, newline, blankEnd, null));
			pos = blankEnd;
		} else {
			emit(Token.of(TokenKind.NEWLINE, newline, newline + 1, "\n"));
			pos = newline + 1;
		}
		lineStart = true;
	}

	/**
	 * Returns the end of the run of whitespace-only lines starting at {@code lineStart},
	 * or -1 if the line there is not blank.
	 */
	private int blankRunEnd(int lineStart) {
		int k = lineStart;
		int end = -1;
		while (k < to) {
			int e = lineEnd(k);
			if (!isBlank(k, e)) {
				break;
			}
			if (e < to) {
				k = e + 1;
				end = k;
			} else {
				if (e > k) {
					end = e;
				}
				break;
			}
		}
		return end;
	}

	private int lineEnd(int start) {
		int newline = input.indexOf('\n', start);
		return newline < 0 || newline >= to ? to : newline;
	}

	private boolean isBlank(int start, int end) {
		for (int i = start; i < end; i++) {
			if (!isWhitespace(input.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	// Inline constructs

	private void scanInline() {
		int start = pos;
		char c = peek();

		if (isBadAt(pos)) {
			while (!isAtEnd() && isBadAt(pos)) {
				pos++;
			}
			emit(Token.of(TokenKind.LEX_ERROR, start, pos, input.substring(start, pos)));
			return;
		}
		if (c == '+' && pos > lineBegin && isWhitespace(input.charAt(pos - 1)) && isBlank(pos + 1, lineEnd(pos))) {
			pos++;
			emit(Token.of(TokenKind.LINE_BREAK, start, pos, "+"));
			return;
		}
		if (c == '{') {
			Matcher m = lookingAt(ATTRIBUTE_REF, start);
			if (m != null) {
				int nameEnd = m.end(1);
				emit(Token.of(TokenKind.ATTRIBUTE_REF_OPEN, start, start + 1, "{"));
				emit(Token.of(TokenKind.WORD, start + 1, nameEnd, m.group(1)));
				emit(Token.of(TokenKind.ATTRIBUTE_REF_CLOSE, nameEnd, nameEnd + 1, "}"));
				pos = m.end();
				return;
			}
		}
		if (c == '<') {
			Matcher m = lookingAt(XREF, start);
			if (m != null) {
				emit(new Token(TokenKind.INLINE_MACRO, new Span(start, m.end()), m.end() - start, "xref",
						m.group(1), m.group(2)));
				pos = m.end();
				return;
			}
		}
		if (Character.isLetter(c) && isWordStart(start)) {
			if (scanUrl(start) || scanInlineMacro(start)) {
				return;
			}
		}
		if (FormatStyle.isMark(c)) {
			int length = pos + 1 < to && input.charAt(pos + 1) == c ? 2 : 1;
			pos += length;
			emit(new Token(TokenKind.FORMAT_MARK, new Span(start, pos), length, null, String.valueOf(c), null));
			return;
		}
		if (isSeparator(c)) {
			pos++;
			emit(Token.of(TokenKind.CELL_SEPARATOR, start, pos, String.valueOf(c)));
			return;
		}
		if (CELL_STYLE_LETTERS.indexOf(c) >= 0 && pos + 1 < to && isSeparator(input.charAt(pos + 1))
				&& (pos == lineBegin || isWhitespace(input.charAt(pos - 1)))) {
			pos += 2;
			emit(new Token(TokenKind.CELL_SEPARATOR, new Span(start, pos), 2, String.valueOf(c),
					String.valueOf(input.charAt(start + 1)), null));
			return;
		}
		scanWord();
	}

	private boolean scanUrl(int start) {
		Matcher m = lookingAt(URL, start);
		if (m == null) {
			return false;
		}
		int urlEnd = m.end();
		if (urlEnd < to && input.charAt(urlEnd) == '[') {
			int close = input.indexOf(']', urlEnd);
			if (close > 0 && close < lineEnd(urlEnd)) {
				emit(new Token(TokenKind.LINK, new Span(start, close + 1), close + 1 - start, null,
						input.substring(start, urlEnd), input.substring(urlEnd + 1, close)));
				pos = close + 1;
				return true;
			}
		}
		while (urlEnd > start && URL_TRAILING_PUNCTUATION.indexOf(input.charAt(urlEnd - 1)) >= 0) {
			urlEnd--;
		}
		emit(Token.of(TokenKind.URL, start, urlEnd, input.substring(start, urlEnd)));
		pos = urlEnd;
		return true;
	}

	private boolean scanInlineMacro(int start) {
		Matcher m = lookingAt(INLINE_MACRO, start);
		if (m == null) {
			return false;
		}
		emit(new Token(TokenKind.INLINE_MACRO, new Span(start, m.end()), m.end() - start, m.group(1), m.group(2),
				m.group(3)));
		pos = m.end();
		return true;
	}

	private void scanWord() {
		int start = pos;
		pos += isSurrogatePair(pos) ? 2 : 1;
		while (!isAtEnd() && !endsWord(pos)) {
			pos += isSurrogatePair(pos) ? 2 : 1;
		}
		emit(Token.of(TokenKind.WORD, start, pos, input.substring(start, pos)));
	}

	private boolean endsWord(int i) {
		char c = input.charAt(i);
		if (isWhitespace(c) || c == '\n' || FormatStyle.isMark(c) || isSeparator(c) || isBadAt(i)) {
			return true;
		}
		if (c == '{') {
			return lookingAt(ATTRIBUTE_REF, i) != null;
		}
		if (c == '<') {
			return lookingAt(XREF, i) != null;
		}
		// a URL scheme starting mid-word ends the word: "(https://example.org)"
		return Character.isLetter(c) && isWordStart(i) && lookingAt(URL, i) != null;
	}

	private boolean isWordStart(int i) {
		return i == from || !Character.isLetterOrDigit(input.charAt(i - 1));
	}

	private boolean isSeparator(char c) {
		return c == '|' || (c == '!' && nestedTable);
	}

	private boolean isSurrogatePair(int i) {
		return Character.isHighSurrogate(input.charAt(i)) && i + 1 < to
				&& Character.isLowSurrogate(input.charAt(i + 1));
	}

	private boolean isBadAt(int i) {
		char c = input.charAt(i);
		if (Character.isHighSurrogate(c)) {
			return !isSurrogatePair(i);
		}
		if (Character.isLowSurrogate(c)) {
			return i == from || !Character.isHighSurrogate(input.charAt(i - 1));
		}
		return (c < 0x20 && c != '\t' && c != '\n' && c != '\r') || c == 0x7f || c == '\uFFFD';
	}

	private Matcher lookingAt(Pattern pattern, int start) {
		Matcher m = pattern.matcher(input);
		m.region(start, to);
		return m.lookingAt() ? m : null;
	}

	private void emit(Token token) {
		pending.add(token);
	}

	private void skipWhitespace() {
		while (!isAtEnd() && isWhitespace(peek())) {
			pos++;
		}
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private boolean isAtEnd() {
		return pos >= to;
	}

	private static boolean isWhitespace(char c) {
		return c == ' ' || c == '\t' || c == '\r';
	}
}
