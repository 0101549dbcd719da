package org.javai.asciidoc.ast;

/**
 * Half-open range {@code [start, end)} of character offsets into the source text.
 * <p>
 * Offsets are indexes into the Java {@code String} the parser was given (UTF-16 code units).
 *
 * @param start the start offset (inclusive)
 * @param end the end offset (exclusive)
 */
public record Span(int start, int end) {

	public Span {
		if (start < 0) {
			throw new IllegalArgumentException("Span start must not be negative: " + start);
		}
		if (end < start) {
			throw new IllegalArgumentException("Span end " + end + " is before start " + start);
		}
	}

	/**
	 * Creates an empty span at the given offset.
	 */
	public static Span at(int offset) {
		return new Span(offset, offset);
	}

	/**
	 * Returns the minimal span covering both arguments.
	 */
	public static Span union(Span a, Span b) {
		return new Span(Math.min(a.start, b.start), Math.max(a.end, b.end));
	}

	public Span union(Span other) {
		return union(this, other);
	}

	public int length() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean contains(Span other) {
		return start <= other.start && other.end <= end;
	}

	/**
	 * Returns the covered slice of {@code source}.
	 */
	public String slice(String source) {
		return source.substring(start, end);
	}

	@Override
	public String toString() {
		return start + ".." + end;
	}
}
