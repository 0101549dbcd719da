package org.javai.asciidoc.token;

/**
 * Kinds of tokens produced by the {@link Tokenizer}.
 */
public enum TokenKind {
	HEADING("section heading"),
	DELIMITER("block delimiter"),
	TABLE_DELIMITER("table delimiter"),
	NESTED_TABLE_DELIMITER("nested table delimiter"),
	LIST_MARKER("list marker"),
	LIST_CONTINUATION("list continuation"),
	CELL_SEPARATOR("cell separator"),
	FORMAT_MARK("formatting mark"),
	ATTRIBUTE_ENTRY("attribute entry"),
	ATTRIBUTE_REF_OPEN("attribute reference"),
	ATTRIBUTE_REF_CLOSE("end of attribute reference"),
	DIRECTIVE("preprocessor directive"),
	BLOCK_MACRO("block macro"),
	INLINE_MACRO("inline macro"),
	URL("URL"),
	LINK("link"),
	BLOCK_ATTRIBUTES("block attribute line"),
	BLOCK_ANCHOR("block anchor"),
	BLOCK_TITLE("block title"),
	WORD("text"),
	LINE_BREAK("line break"),
	NEWLINE("newline"),
	BLANK_LINE("blank line"),
	COMMENT("comment"),
	LEX_ERROR("invalid character"),
	EOF("end of input");

	private final String description;

	TokenKind(String description) {
		this.description = description;
	}

	/**
	 * Human-readable name used in diagnostic messages.
	 */
	public String description() {
		return description;
	}

	/**
	 * Whether tokens of this kind are only recognized at the start of a line and therefore
	 * end a paragraph when they begin the next line.
	 */
	public boolean isLineLevel() {
		return switch (this) {
			case HEADING, DELIMITER, TABLE_DELIMITER, NESTED_TABLE_DELIMITER, LIST_MARKER,
					LIST_CONTINUATION, ATTRIBUTE_ENTRY, DIRECTIVE, BLOCK_MACRO, BLOCK_ATTRIBUTES,
					BLOCK_ANCHOR, BLOCK_TITLE, COMMENT -> true;
			default -> false;
		};
	}

	public boolean isLineEnd() {
		return this == NEWLINE || this == BLANK_LINE || this == EOF;
	}
}
