package org.javai.asciidoc.include;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the content of include targets. Paths are already resolved and normalized.
 */
@FunctionalInterface
public interface IncludeResolver {

	/**
	 * @param path absolute, normalized path of the include target
	 * @return the decoded text of the target
	 * @throws IOException if the target cannot be read
	 */
	String read(Path path) throws IOException;
}
