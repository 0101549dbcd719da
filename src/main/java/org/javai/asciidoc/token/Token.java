package org.javai.asciidoc.token;

import java.util.Objects;
import org.javai.asciidoc.ast.Span;

/**
 * A token of AsciiDoc source.
 * <p>
 * Which of the optional fields are set depends on the kind:
 * <ul>
 *   <li>{@code HEADING}: {@code length} is the level (number of {@code =})</li>
 *   <li>{@code DELIMITER}: {@code value} is the delimiter character, {@code length} the line length</li>
 *   <li>{@code TABLE_DELIMITER}, {@code NESTED_TABLE_DELIMITER}: {@code length} is the line length</li>
 *   <li>{@code LIST_MARKER}: {@code name} is the marker class ({@code **}, {@code -}, {@code 1.},
 *       {@code a.}, {@code i)}, ...), {@code value} the marker as written, {@code length} the depth</li>
 *   <li>{@code CELL_SEPARATOR}: {@code value} is {@code |} or {@code !}, {@code name} the cell style letter</li>
 *   <li>{@code FORMAT_MARK}: {@code value} is the mark character, {@code length} is 1 or 2</li>
 *   <li>{@code ATTRIBUTE_ENTRY}: {@code name} is the lower-cased attribute name, {@code value} the raw
 *       value, or {@code null} for an unset entry</li>
 *   <li>{@code DIRECTIVE}, {@code BLOCK_MACRO}, {@code INLINE_MACRO}: {@code name}, target in
 *       {@code value}, bracket content in {@code attrlist}</li>
 *   <li>{@code URL}, {@code LINK}: {@code value} is the URL, {@code attrlist} the link text</li>
 *   <li>{@code BLOCK_ATTRIBUTES}: {@code attrlist} is the bracket content</li>
 *   <li>{@code BLOCK_ANCHOR}: {@code value} is the id, {@code attrlist} the optional reference text</li>
 *   <li>{@code WORD}, {@code COMMENT}, {@code LEX_ERROR}: {@code value} is the text</li>
 * </ul>
 *
 * @param kind the token kind
 * @param span the source range
 * @param length kind-specific length (see above), otherwise the span length
 */
public record Token(TokenKind kind, Span span, int length, String name, String value, String attrlist) {

	public Token {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}

	public static Token of(TokenKind kind, int start, int end, String value) {
		return new Token(kind, new Span(start, end), end - start, null, value, null);
	}

	public int start() {
		return span.start();
	}

	public int end() {
		return span.end();
	}

	public boolean is(TokenKind expected) {
		return kind == expected;
	}

	/**
	 * Whether this is a {@code DIRECTIVE} with the given name.
	 */
	public boolean isDirective(String directive) {
		return kind == TokenKind.DIRECTIVE && directive.equals(name);
	}

	/**
	 * The character of a delimiter or formatting mark token.
	 */
	public char mark() {
		return value != null && !value.isEmpty() ? value.charAt(0) : '\0';
	}

	@Override
	public String toString() {
		return switch (kind) {
			case WORD, COMMENT, LEX_ERROR -> kind + "('" + value + "')";
			case HEADING, FORMAT_MARK, DELIMITER, TABLE_DELIMITER, NESTED_TABLE_DELIMITER ->
					kind + "(" + (value != null ? value + "x" : "") + length + ")@" + span;
			case LIST_MARKER, ATTRIBUTE_ENTRY, DIRECTIVE, BLOCK_MACRO, INLINE_MACRO ->
					kind + "(" + name + ":" + value + (attrlist != null ? "[" + attrlist + "]" : "") + ")";
			case URL, LINK, BLOCK_ANCHOR, CELL_SEPARATOR -> kind + "(" + value + ")";
			case BLOCK_ATTRIBUTES -> kind + "[" + attrlist + "]";
			default -> kind.toString();
		};
	}
}
