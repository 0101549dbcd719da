package org.javai.asciidoc.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for the insertion-ordered, unmodifiable attribute maps held by AST nodes.
 */
public final class Attributes {

	private Attributes() {
	}

	public static <V> Map<String, V> copyOf(Map<String, V> attributes) {
		if (attributes == null || attributes.isEmpty()) {
			return Map.of();
		}
		return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
	}

	/**
	 * Positional style of a block ({@code [source,java]} yields {@code source}).
	 */
	public static String style(Map<String, String> attributes) {
		return attributes.get("style");
	}
}
