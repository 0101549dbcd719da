package org.javai.asciidoc.ast;

/**
 * Inline formatting styles and the mark character that produces each.
 */
public enum FormatStyle {
	STRONG('*'),
	EMPHASIS('_'),
	MONOSPACE('`'),
	MARK('#');

	private final char mark;

	FormatStyle(char mark) {
		this.mark = mark;
	}

	public char mark() {
		return mark;
	}

	public static FormatStyle fromMark(char c) {
		for (FormatStyle style : values()) {
			if (style.mark == c) {
				return style;
			}
		}
		throw new IllegalArgumentException("Not a formatting mark: '" + c + "'");
	}

	public static boolean isMark(char c) {
		return c == '*' || c == '_' || c == '`' || c == '#';
	}
}
