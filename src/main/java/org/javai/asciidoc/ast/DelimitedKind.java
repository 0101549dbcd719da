package org.javai.asciidoc.ast;

/**
 * Kinds of delimited blocks, keyed by the character their delimiter lines repeat.
 * <p>
 * Verbatim kinds keep their content as raw text; the others hold nested blocks.
 * The open block is the only kind with a fixed delimiter length ({@code --}).
 */
public enum DelimitedKind {
	LISTING('-', true),
	LITERAL('.', true),
	PASSTHROUGH('+', true),
	COMMENT('/', true),
	EXAMPLE('=', false),
	SIDEBAR('*', false),
	QUOTE('_', false),
	OPEN('-', false);

	public static final int MIN_LENGTH = 4;

	private final char delimiter;
	private final boolean verbatim;

	DelimitedKind(char delimiter, boolean verbatim) {
		this.delimiter = delimiter;
		this.verbatim = verbatim;
	}

	public char delimiter() {
		return delimiter;
	}

	public boolean isVerbatim() {
		return verbatim;
	}

	/**
	 * Resolves the kind of a delimiter line made of {@code length} copies of {@code c}.
	 *
	 * @return the kind, or {@code null} if no delimited block uses that line
	 */
	public static DelimitedKind fromLine(char c, int length) {
		if (c == '-' && length == 2) {
			return OPEN;
		}
		if (length < MIN_LENGTH) {
			return null;
		}
		for (DelimitedKind kind : values()) {
			if (kind != OPEN && kind.delimiter == c) {
				return kind;
			}
		}
		return null;
	}
}
