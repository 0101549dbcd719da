package org.javai.asciidoc.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * Value of a document attribute.
 * <p>
 * Values come from attribute entries ({@code :name: value}) or from configuration:
 * <ul>
 *   <li>{@link TextValue} - any non-empty, non-numeric value (may reference other attributes)</li>
 *   <li>{@link BoolValue} - an entry with an empty value ({@code :toc:}) is {@code true}</li>
 *   <li>{@link IntValue} - an all-digit value</li>
 *   <li>{@link Unset} - an explicit unset ({@code :name!:}); the attribute counts as undefined</li>
 * </ul>
 */
public sealed interface AttributeValue {

	/**
	 * Classifies a raw attribute entry value.
	 *
	 * @param raw the value text, or {@code null} for an unset entry
	 */
	static AttributeValue of(String raw) {
		if (raw == null) {
			return Unset.INSTANCE;
		}
		String value = raw.strip();
		if (value.isEmpty()) {
			return BoolValue.TRUE;
		}
		// only digit runs that print back unchanged are numbers; 007 stays text
		if (value.length() <= 18 && value.chars().allMatch(c -> c >= '0' && c <= '9')
				&& (value.length() == 1 || value.charAt(0) != '0')) {
			return new IntValue(Long.parseLong(value));
		}
		return new TextValue(value);
	}

	/**
	 * Text this value contributes when referenced, or empty when the attribute is unset.
	 */
	Optional<String> asText();

	default boolean isDefined() {
		return asText().isPresent();
	}

	record TextValue(String text) implements AttributeValue {
		public TextValue {
			Objects.requireNonNull(text, "text must not be null");
		}

		@Override
		public Optional<String> asText() {
			return Optional.of(text);
		}
	}

	record BoolValue(boolean value) implements AttributeValue {
		public static final BoolValue TRUE = new BoolValue(true);

		@Override
		public Optional<String> asText() {
			return value ? Optional.of("") : Optional.empty();
		}
	}

	record IntValue(long value) implements AttributeValue {
		@Override
		public Optional<String> asText() {
			return Optional.of(Long.toString(value));
		}
	}

	enum Unset implements AttributeValue {
		INSTANCE;

		@Override
		public Optional<String> asText() {
			return Optional.empty();
		}
	}
}
