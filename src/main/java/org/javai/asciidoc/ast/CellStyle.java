package org.javai.asciidoc.ast;

/**
 * Table cell styles, selected by the letter written before the cell separator ({@code a|}).
 */
public enum CellStyle {
	DEFAULT('d'),
	ASCIIDOC('a'),
	EMPHASIS('e'),
	HEADER('h'),
	LITERAL('l'),
	MONOSPACE('m'),
	STRONG('s'),
	VERSE('v');

	private final char letter;

	CellStyle(char letter) {
		this.letter = letter;
	}

	public char letter() {
		return letter;
	}

	/**
	 * Looks up the style for a prefix letter; unknown or absent letters give {@link #DEFAULT}.
	 */
	public static CellStyle fromLetter(String letter) {
		if (letter == null || letter.length() != 1) {
			return DEFAULT;
		}
		for (CellStyle style : values()) {
			if (style.letter == letter.charAt(0)) {
				return style;
			}
		}
		return DEFAULT;
	}
}
