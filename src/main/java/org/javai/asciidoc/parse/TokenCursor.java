package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;

/**
 * Position in a token list, shared by the parsers working on one source.
 * <p>
 * Whenever the cursor moves onto a conditional directive the {@link ConditionalProcessor}
 * decides where reading continues, so parsers never see conditional directives or the
 * tokens of excluded regions. Each directive is processed once; moving back with
 * {@link #reset(int)} and reading forward again reuses the recorded decision.
 */
public final class TokenCursor {

	private final List<Token> tokens;
	private final ConditionalProcessor conditionals;
	private final Map<Integer, Integer> jumps = new HashMap<>();
	private int current = 0;

	public TokenCursor(List<Token> tokens, ConditionalProcessor conditionals) {
		if (tokens == null || tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
			throw new IllegalArgumentException("Token list must end with EOF");
		}
		this.tokens = tokens;
		this.conditionals = conditionals;
		settle();
	}

	public Token peek() {
		return tokens.get(current);
	}

	/**
	 * Returns the raw token {@code offset} positions after the current one, without
	 * applying conditionals. Never reads past EOF.
	 */
	public Token peekRaw(int offset) {
		return tokens.get(Math.min(current + offset, tokens.size() - 1));
	}

	public Token advance() {
		Token token = tokens.get(current);
		if (!isAtEnd()) {
			current++;
			settle();
		}
		return token;
	}

	public boolean check(TokenKind kind) {
		return peek().kind() == kind;
	}

	/**
	 * Consumes the current token if it has the given kind.
	 */
	public boolean match(TokenKind kind) {
		if (check(kind)) {
			advance();
			return true;
		}
		return false;
	}

	public boolean isAtEnd() {
		return peek().is(TokenKind.EOF);
	}

	/**
	 * Whether the current token is the first on its line.
	 */
	public boolean atLineStart() {
		return current == 0 || tokens.get(current - 1).kind().isLineEnd();
	}

	/**
	 * Consumes a single line terminator if present; a blank line is left for the block loop.
	 */
	public void skipNewline() {
		match(TokenKind.NEWLINE);
	}

	/**
	 * Consumes tokens up to the end of the current line, returning them without the terminator.
	 */
	public List<Token> restOfLine() {
		List<Token> line = new ArrayList<>();
		while (!peek().kind().isLineEnd()) {
			line.add(advance());
		}
		return line;
	}

	public int mark() {
		return current;
	}

	public void reset(int mark) {
		current = mark;
	}

	/**
	 * Moves to {@code index} after a raw scan, applying conditionals from there.
	 */
	public void seek(int index) {
		current = Math.min(index, tokens.size() - 1);
		settle();
	}

	public int index() {
		return current;
	}

	public List<Token> tokens() {
		return tokens;
	}

	public int eofIndex() {
		return tokens.size() - 1;
	}

	private void settle() {
		if (conditionals == null) {
			return;
		}
		while (ConditionalProcessor.isConditional(tokens.get(current))) {
			Integer jump = jumps.get(current);
			if (jump == null) {
				jump = conditionals.process(current);
				jumps.put(current, jump);
			}
			current = jump;
		}
	}
}
