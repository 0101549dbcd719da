package org.javai.asciidoc.parse;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.LabeledSpan;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.TokenKind;

/**
 * Evaluates {@code ifdef}, {@code ifndef}, {@code ifeval} and {@code endif} directives.
 * <ul>
 *   <li>{@code ifdef::a[]} includes its body if {@code a} is defined; {@code a,b} means any,
 *       {@code a+b} means all. {@code ifndef} is the negation.</li>
 *   <li>{@code ifeval::[lhs op rhs]} compares numerically when both sides are numbers,
 *       otherwise as strings, after attribute substitution.</li>
 *   <li>{@code ifdef::a[content]} includes the single line {@code content}.</li>
 * </ul>
 * An excluded body is skipped up to the matching {@code endif} without producing nodes or
 * diagnostics.
 */
public final class ConditionalProcessor {

	private static final Set<String> DIRECTIVES = Set.of("ifdef", "ifndef", "ifeval", "endif");
	private static final Pattern EXPRESSION = Pattern.compile("\\s*(.+?)\\s*(==|!=|<=|>=|<|>)\\s*(.+?)\\s*");

	private final ParserContext ctx;
	private final List<Token> tokens;
	private final int floor;

	/**
	 * @param tokens the token list the directives are read from
	 */
	public ConditionalProcessor(ParserContext ctx, List<Token> tokens) {
		this.ctx = ctx;
		this.tokens = tokens;
		this.floor = ctx.conditionalDepth();
	}

	public static boolean isConditional(Token token) {
		return token.is(TokenKind.DIRECTIVE) && DIRECTIVES.contains(token.name());
	}

	/**
	 * Processes the directive at {@code index}.
	 *
	 * @return the index reading continues at
	 */
	public int process(int index) {
		Token directive = tokens.get(index);
		if (directive.name().equals("endif")) {
			closeConditional(directive);
			return afterLine(index);
		}
		boolean singleLine = !directive.name().equals("ifeval") && !directive.attrlist().isBlank();
		boolean included = evaluate(directive);
		if (singleLine) {
			return included ? index + 1 : afterContent(index);
		}
		if (included) {
			ctx.pushConditional(new ParserContext.OpenConditional(directive.name(), directive.value(),
					directive.span()));
			return afterLine(index);
		}
		return skipExcluded(index);
	}

	/**
	 * Reports every conditional this processor opened that is still open, innermost first.
	 */
	public void reportUnclosed() {
		while (ctx.conditionalDepth() > floor) {
			ParserContext.OpenConditional open = ctx.popConditional();
			ctx.report(DiagnosticKind.UNCLOSED_DELIMITER,
					open.directive() + "::" + open.target() + "[] is never closed by endif", open.span());
		}
	}

	private void closeConditional(Token endif) {
		if (ctx.conditionalDepth() <= floor) {
			ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, "endif without a matching conditional directive",
					endif.span());
			return;
		}
		ParserContext.OpenConditional open = ctx.popConditional();
		String target = endif.value();
		if (!target.isEmpty() && !target.equals(open.target())) {
			ctx.report(DiagnosticKind.INVALID_NESTING,
					"endif::" + target + "[] does not match the open " + open.directive() + "::" + open.target() + "[]",
					endif.span(), new LabeledSpan(open.span(), "conditional opened here"));
		}
	}

	private boolean evaluate(Token directive) {
		String name = directive.name();
		if (name.equals("ifeval")) {
			return evaluateExpression(directive);
		}
		String target = ctx.substitute(directive.value(), directive.span());
		if (target.isEmpty()) {
			ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, name + " requires an attribute name", directive.span());
			return false;
		}
		boolean defined;
		if (target.contains("+")) {
			defined = true;
			for (String attribute : target.split("\\+")) {
				defined &= ctx.isDefined(attribute.strip());
			}
		} else {
			defined = false;
			for (String attribute : target.split(",")) {
				defined |= ctx.isDefined(attribute.strip());
			}
		}
		return name.equals("ifdef") == defined;
	}

	private boolean evaluateExpression(Token directive) {
		Matcher m = EXPRESSION.matcher(directive.attrlist());
		if (!directive.value().isEmpty() || !m.matches()) {
			ctx.report(DiagnosticKind.UNEXPECTED_TOKEN,
					"malformed ifeval expression: [" + directive.attrlist() + "]", directive.span());
			return false;
		}
		String lhs = operand(m.group(1), directive.span());
		String rhs = operand(m.group(3), directive.span());
		int comparison = compare(lhs, rhs);
		return switch (m.group(2)) {
			case "==" -> comparison == 0;
			case "!=" -> comparison != 0;
			case "<" -> comparison < 0;
			case "<=" -> comparison <= 0;
			case ">" -> comparison > 0;
			default -> comparison >= 0;
		};
	}

	private String operand(String raw, Span span) {
		String value = ctx.substitute(raw, span).strip();
		if (value.length() >= 2) {
			char first = value.charAt(0);
			if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
				return value.substring(1, value.length() - 1);
			}
		}
		return value;
	}

	private static int compare(String lhs, String rhs) {
		try {
			return Double.compare(Double.parseDouble(lhs), Double.parseDouble(rhs));
		} catch (NumberFormatException e) {
			return lhs.compareTo(rhs);
		}
	}

	private int skipExcluded(int index) {
		int depth = 0;
		for (int i = index + 1; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			if (token.is(TokenKind.EOF)) {
				Token directive = tokens.get(index);
				ctx.report(DiagnosticKind.UNCLOSED_DELIMITER,
						directive.name() + "::" + directive.value() + "[] is never closed by endif", directive.span());
				return i;
			}
			if (!isConditional(token)) {
				continue;
			}
			if (token.name().equals("endif")) {
				if (depth == 0) {
					return afterLine(i);
				}
				depth--;
			} else if (token.name().equals("ifeval") || token.attrlist().isBlank()) {
				depth++;
			}
		}
		return tokens.size() - 1;
	}

	private int afterLine(int index) {
		int next = index + 1;
		return tokens.get(next).is(TokenKind.NEWLINE) ? next + 1 : next;
	}

	private int afterContent(int index) {
		int next = index + 1;
		while (!tokens.get(next).kind().isLineEnd()) {
			next++;
		}
		return tokens.get(next).is(TokenKind.NEWLINE) ? next + 1 : next;
	}
}
