package org.javai.asciidoc;

/**
 * Exception thrown when a document or configuration cannot be read at all.
 * <p>
 * Problems in the content of a document are never thrown; they are reported as
 * diagnostics in the {@link ParseResult}.
 */
public class AsciidocException extends RuntimeException {

	public AsciidocException(String message) {
		super(message);
	}

	public AsciidocException(String message, Throwable cause) {
		super(message, cause);
	}
}
