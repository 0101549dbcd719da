package org.javai.asciidoc.ast;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of the AST.
 *
 * @param attributes the attribute table as it stood at the end of the parse
 * @param header the document header, or {@code null} when the document has none
 * @param blocks top-level blocks
 * @param includes include directives that were resolved, in document order
 */
public record Document(Map<String, AttributeValue> attributes, Header header, List<Block> blocks,
		List<IncludeRecord> includes, Span span) {

	public Document {
		attributes = Attributes.copyOf(attributes);
		blocks = blocks != null ? List.copyOf(blocks) : List.of();
		includes = includes != null ? List.copyOf(includes) : List.of();
		Objects.requireNonNull(span, "span must not be null");
	}

	public Optional<Header> findHeader() {
		return Optional.ofNullable(header);
	}

	/**
	 * Looks up an attribute by case-insensitive name. Unset attributes are reported as absent.
	 */
	public Optional<AttributeValue> attribute(String name) {
		AttributeValue value = attributes.get(name.toLowerCase(Locale.ROOT));
		return value != null && value.isDefined() ? Optional.of(value) : Optional.empty();
	}

	public boolean isDefined(String name) {
		return attribute(name).isPresent();
	}
}
