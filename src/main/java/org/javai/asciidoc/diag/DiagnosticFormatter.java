package org.javai.asciidoc.diag;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.javai.asciidoc.ast.Span;

/**
 * Renders diagnostics against their source text.
 * <pre>
 * error[UNCLOSED_DELIMITER]: listing block is never closed
 *  --> guide.adoc:3:1
 *   |
 * 3 | ----
 *   | ^^^^ opened here
 * </pre>
 * Secondary spans are rendered the same way, underlined with {@code -}.
 */
public final class DiagnosticFormatter {

	private static final ObjectMapper mapper = new ObjectMapper();

	private final String source;
	private final String sourceName;
	private final LineIndex lines;

	public DiagnosticFormatter(String source, String sourceName) {
		this.source = source;
		this.sourceName = sourceName != null ? sourceName : "<input>";
		this.lines = new LineIndex(source);
	}

	public String format(List<Diagnostic> diagnostics) {
		StringBuilder sb = new StringBuilder();
		for (Diagnostic diagnostic : diagnostics) {
			if (sb.length() > 0) {
				sb.append('\n');
			}
			sb.append(format(diagnostic));
		}
		return sb.toString();
	}

	public String format(Diagnostic diagnostic) {
		Span primary = diagnostic.primary();
		int gutter = String.valueOf(maxLine(diagnostic)).length();

		StringBuilder sb = new StringBuilder();
		sb.append(diagnostic.severity().label())
			.append('[').append(diagnostic.kind()).append("]: ")
			.append(diagnostic.message()).append('\n');
		sb.append(" ".repeat(gutter)).append("--> ")
			.append(sourceName).append(':').append(lines.position(primary.start())).append('\n');
		sb.append(" ".repeat(gutter)).append(" |\n");
		snippet(sb, primary, '^', "", gutter);
		for (LabeledSpan secondary : diagnostic.secondary()) {
			snippet(sb, secondary.span(), '-', secondary.label(), gutter);
		}
		return sb.toString();
	}

	private void snippet(StringBuilder sb, Span span, char underline, String label, int gutter) {
		int line = lines.line(span.start());
		String text = lines.lineText(line);
		int column = lines.column(span.start());
		int lineEnd = lines.lineStart(line) + text.length();
		int width = Math.max(1, Math.min(span.end(), lineEnd) - span.start());

		sb.append(pad(String.valueOf(line), gutter)).append(" | ").append(text).append('\n');
		sb.append(" ".repeat(gutter)).append(" | ")
			.append(" ".repeat(column - 1))
			.append(String.valueOf(underline).repeat(width));
		if (!label.isEmpty()) {
			sb.append(' ').append(label);
		}
		sb.append('\n');
	}

	private int maxLine(Diagnostic diagnostic) {
		int max = lines.line(diagnostic.primary().start());
		for (LabeledSpan secondary : diagnostic.secondary()) {
			max = Math.max(max, lines.line(secondary.span().start()));
		}
		return max;
	}

	private static String pad(String value, int width) {
		return " ".repeat(Math.max(0, width - value.length())) + value;
	}

	/**
	 * Converts diagnostics to a JSON array, with 1-based line and column of each primary span.
	 */
	public ArrayNode toJson(List<Diagnostic> diagnostics) {
		ArrayNode array = mapper.createArrayNode();
		for (Diagnostic diagnostic : diagnostics) {
			ObjectNode node = array.addObject();
			node.put("kind", diagnostic.kind().name());
			node.put("severity", diagnostic.severity().label());
			node.put("message", diagnostic.message());
			node.set("span", mapper.createArrayNode()
				.add(diagnostic.primary().start())
				.add(diagnostic.primary().end()));
			node.put("line", lines.line(diagnostic.primary().start()));
			node.put("column", lines.column(diagnostic.primary().start()));
			if (!diagnostic.secondary().isEmpty()) {
				ArrayNode secondary = node.putArray("secondary");
				for (LabeledSpan labeled : diagnostic.secondary()) {
					ObjectNode labeledNode = secondary.addObject();
					labeledNode.put("label", labeled.label());
					labeledNode.set("span", mapper.createArrayNode()
						.add(labeled.span().start())
						.add(labeled.span().end()));
				}
			}
		}
		return array;
	}

	public String source() {
		return source;
	}
}
