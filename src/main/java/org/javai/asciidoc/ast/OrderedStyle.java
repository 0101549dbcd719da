package org.javai.asciidoc.ast;

/**
 * Numbering style of an ordered list, fixed by the list's first marker.
 */
public enum OrderedStyle {
	ARABIC("arabic"),
	LOWER_ALPHA("loweralpha"),
	UPPER_ALPHA("upperalpha"),
	LOWER_ROMAN("lowerroman"),
	UPPER_ROMAN("upperroman");

	private final String attributeName;

	OrderedStyle(String attributeName) {
		this.attributeName = attributeName;
	}

	/**
	 * Name of the style as written in a block attribute line ({@code [loweralpha]}).
	 */
	public String attributeName() {
		return attributeName;
	}

	/**
	 * Infers the style of an explicit or implicit ordered-list marker.
	 *
	 * @param marker a marker such as {@code .}, {@code 3.}, {@code b.}, {@code iv)}
	 */
	public static OrderedStyle fromMarker(String marker) {
		if (marker.isEmpty() || marker.charAt(0) == '.' || Character.isDigit(marker.charAt(0))) {
			return ARABIC;
		}
		if (marker.endsWith(")")) {
			return Character.isUpperCase(marker.charAt(0)) ? UPPER_ROMAN : LOWER_ROMAN;
		}
		return Character.isUpperCase(marker.charAt(0)) ? UPPER_ALPHA : LOWER_ALPHA;
	}
}
