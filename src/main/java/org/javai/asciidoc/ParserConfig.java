package org.javai.asciidoc;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for parsing.
 *
 * <p>Bounds recursion in every dimension the parser nests in, controls how include
 * directives are resolved and seeds the attribute table.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ParserConfig config = ParserConfig.defaults();
 *
 * // Custom configuration
 * ParserConfig config = ParserConfig.builder()
 *         .baseDir(Path.of("docs"))
 *         .safeMode(true)
 *         .attribute("product", "Widget")
 *         .build();
 * }</pre>
 *
 * @param maxIncludeDepth maximum nesting of include directives
 * @param maxSectionDepth deepest allowed section level, 1 to 6
 * @param baseDir directory include targets are resolved against at the root, or {@code null}
 *        for the working directory
 * @param safeMode whether include targets escaping {@code baseDir} (and URI targets) are rejected
 * @param maxBlockDepth maximum nesting of delimited blocks, and separately of lists
 * @param maxInlineDepth maximum nesting of inline formatting
 * @param attributes attributes defined before the document is read; a {@code null} value unsets
 */
public record ParserConfig(
		int maxIncludeDepth,
		int maxSectionDepth,
		Path baseDir,
		boolean safeMode,
		int maxBlockDepth,
		int maxInlineDepth,
		Map<String, String> attributes
) {

	public static final int DEFAULT_MAX_INCLUDE_DEPTH = 10;
	public static final int DEFAULT_MAX_SECTION_DEPTH = 6;
	public static final int DEFAULT_MAX_BLOCK_DEPTH = 32;
	public static final int DEFAULT_MAX_INLINE_DEPTH = 32;

	public ParserConfig {
		if (maxIncludeDepth < 0) {
			throw new IllegalArgumentException("maxIncludeDepth must be non-negative");
		}
		if (maxSectionDepth < 1 || maxSectionDepth > 6) {
			throw new IllegalArgumentException("maxSectionDepth must be between 1 and 6");
		}
		if (maxBlockDepth < 1) {
			throw new IllegalArgumentException("maxBlockDepth must be positive");
		}
		if (maxInlineDepth < 1) {
			throw new IllegalArgumentException("maxInlineDepth must be positive");
		}
		Map<String, String> normalized = new LinkedHashMap<>();
		if (attributes != null) {
			attributes.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
		}
		attributes = Collections.unmodifiableMap(normalized);
	}

	/**
	 * Creates a configuration with default values.
	 *
	 * @return default configuration
	 */
	public static ParserConfig defaults() {
		return builder().build();
	}

	/**
	 * Creates a new builder for custom configuration.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns a builder initialized with this configuration's values.
	 */
	public Builder toBuilder() {
		Builder builder = new Builder()
				.maxIncludeDepth(maxIncludeDepth)
				.maxSectionDepth(maxSectionDepth)
				.baseDir(baseDir)
				.safeMode(safeMode)
				.maxBlockDepth(maxBlockDepth)
				.maxInlineDepth(maxInlineDepth);
		attributes.forEach(builder::attribute);
		return builder;
	}

	/**
	 * The base directory as an absolute, normalized path; the working directory when none is set.
	 */
	public Path effectiveBaseDir() {
		Path dir = baseDir != null ? baseDir : Path.of("");
		return dir.toAbsolutePath().normalize();
	}

	/**
	 * Builder for {@link ParserConfig}.
	 */
	public static class Builder {
		private int maxIncludeDepth = DEFAULT_MAX_INCLUDE_DEPTH;
		private int maxSectionDepth = DEFAULT_MAX_SECTION_DEPTH;
		private Path baseDir;
		private boolean safeMode = false;
		private int maxBlockDepth = DEFAULT_MAX_BLOCK_DEPTH;
		private int maxInlineDepth = DEFAULT_MAX_INLINE_DEPTH;
		private final Map<String, String> attributes = new LinkedHashMap<>();

		private Builder() {}

		public Builder maxIncludeDepth(int maxIncludeDepth) {
			this.maxIncludeDepth = maxIncludeDepth;
			return this;
		}

		/**
		 * Sets the deepest section level the validator accepts.
		 *
		 * @param maxSectionDepth a level between 1 and 6
		 * @return this builder
		 */
		public Builder maxSectionDepth(int maxSectionDepth) {
			this.maxSectionDepth = maxSectionDepth;
			return this;
		}

		public Builder baseDir(Path baseDir) {
			this.baseDir = baseDir;
			return this;
		}

		/**
		 * Restricts include directives to files below the base directory.
		 *
		 * @param safeMode whether to reject includes escaping the base directory
		 * @return this builder
		 */
		public Builder safeMode(boolean safeMode) {
			this.safeMode = safeMode;
			return this;
		}

		public Builder maxBlockDepth(int maxBlockDepth) {
			this.maxBlockDepth = maxBlockDepth;
			return this;
		}

		public Builder maxInlineDepth(int maxInlineDepth) {
			this.maxInlineDepth = maxInlineDepth;
			return this;
		}

		public Builder attribute(String name, String value) {
			this.attributes.put(name, value);
			return this;
		}

		public Builder attributes(Map<String, String> values) {
			if (values != null) {
				this.attributes.putAll(values);
			}
			return this;
		}

		/**
		 * Builds the configuration.
		 *
		 * @return the configuration
		 * @throws IllegalArgumentException if a limit is out of range
		 */
		public ParserConfig build() {
			return new ParserConfig(maxIncludeDepth, maxSectionDepth, baseDir, safeMode,
					maxBlockDepth, maxInlineDepth, attributes);
		}
	}
}
