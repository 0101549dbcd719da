package org.javai.asciidoc.ast;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An include directive that was resolved and read.
 *
 * @param target the target as written, after attribute substitution
 * @param path the normalized path the target resolved to
 * @param span the span of the include directive in the root document
 */
public record IncludeRecord(String target, Path path, Span span) {

	public IncludeRecord {
		Objects.requireNonNull(target, "target must not be null");
		Objects.requireNonNull(path, "path must not be null");
		Objects.requireNonNull(span, "span must not be null");
	}
}
