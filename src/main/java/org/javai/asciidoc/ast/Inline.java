package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inline content of paragraphs, titles, list items and table cells.
 * <p>
 * Inline nodes:
 * <ul>
 *   <li>{@link Text} - literal text, including resolved attribute references</li>
 *   <li>{@link Formatted} - strong, emphasis, monospace or highlighted content</li>
 *   <li>{@link Macro} - an inline macro such as {@code image:logo.png[]} or {@code kbd:[Ctrl]}</li>
 *   <li>{@link Link} - a bare URL or a URL with link text</li>
 *   <li>{@link AttributeRef} - a reference to an attribute that was not defined when it was read</li>
 *   <li>{@link LineBreak} - a hard line break ({@code " +"} at end of line)</li>
 * </ul>
 */
public sealed interface Inline {

	Span span();

	/**
	 * Text content with all markup removed; unresolved references render as {@code {name}}.
	 */
	static String plainText(List<Inline> inlines) {
		StringBuilder sb = new StringBuilder();
		for (Inline inline : inlines) {
			appendPlainText(inline, sb);
		}
		return sb.toString();
	}

	private static void appendPlainText(Inline inline, StringBuilder sb) {
		if (inline instanceof Text text) {
			sb.append(text.text());
		} else if (inline instanceof Formatted formatted) {
			for (Inline child : formatted.content()) {
				appendPlainText(child, sb);
			}
		} else if (inline instanceof Link link) {
			sb.append(link.text() != null ? link.text() : link.url());
		} else if (inline instanceof Macro macro) {
			sb.append(macro.target());
		} else if (inline instanceof AttributeRef ref) {
			sb.append('{').append(ref.name()).append('}');
		} else if (inline instanceof LineBreak) {
			sb.append('\n');
		}
	}

	record Text(String text, Span span) implements Inline {
		public Text {
			Objects.requireNonNull(text, "text must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	record Formatted(FormatStyle style, List<Inline> content, Span span) implements Inline {
		public Formatted {
			Objects.requireNonNull(style, "style must not be null");
			content = content != null ? List.copyOf(content) : List.of();
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	record Macro(String name, String target, Map<String, String> attributes, Span span) implements Inline {
		public Macro {
			Objects.requireNonNull(name, "name must not be null");
			target = target != null ? target : "";
			attributes = Attributes.copyOf(attributes);
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	/**
	 * @param url the link target
	 * @param text the link text, or {@code null} for a bare URL
	 */
	record Link(String url, String text, Span span) implements Inline {
		public Link {
			Objects.requireNonNull(url, "url must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	record AttributeRef(String name, Span span) implements Inline {
		public AttributeRef {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(span, "span must not be null");
		}
	}

	record LineBreak(Span span) implements Inline {
		public LineBreak {
			Objects.requireNonNull(span, "span must not be null");
		}
	}
}
