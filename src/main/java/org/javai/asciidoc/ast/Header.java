package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The document header: a level-1 title, optional author and revision lines and the
 * attribute entries that directly follow them.
 *
 * @param author author name, or {@code null}
 * @param email author email, or {@code null}
 * @param revision revision line as written, or {@code null}
 * @param attributes attribute entries of the header in declaration order
 */
public record Header(List<Inline> title, String author, String email, String revision,
		Map<String, AttributeValue> attributes, Span span) {

	public Header {
		title = title != null ? List.copyOf(title) : List.of();
		attributes = Attributes.copyOf(attributes);
		Objects.requireNonNull(span, "span must not be null");
	}

	public String titleText() {
		return Inline.plainText(title);
	}
}
