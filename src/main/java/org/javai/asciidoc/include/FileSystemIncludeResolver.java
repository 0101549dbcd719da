package org.javai.asciidoc.include;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads include targets from the file system as UTF-8.
 * <p>
 * Malformed byte sequences decode to U+FFFD, which the tokenizer reports as lexical errors.
 */
public class FileSystemIncludeResolver implements IncludeResolver {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemIncludeResolver.class);

	@Override
	public String read(Path path) throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new IOException("Not a regular file: " + path);
		}
		byte[] bytes = Files.readAllBytes(path);
		logger.debug("Read {} bytes from {}", bytes.length, path);
		return new String(bytes, StandardCharsets.UTF_8);
	}
}
