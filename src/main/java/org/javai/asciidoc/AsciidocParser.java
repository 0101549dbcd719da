package org.javai.asciidoc;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.include.FileSystemIncludeResolver;
import org.javai.asciidoc.include.IncludeResolver;
import org.javai.asciidoc.parse.BlockParser;
import org.javai.asciidoc.parse.ParserContext;
import org.javai.asciidoc.validate.DocumentValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: parses AsciiDoc text into a {@link Document} and validates it.
 * <p>
 * Parsing never fails on content. Every problem found is reported in the returned
 * {@link ParseResult}, and the document holds everything that could be recovered.
 * An instance only holds immutable configuration and a resolver, so it can be shared
 * between threads.
 *
 * <pre>{@code
 * AsciidocParser parser = new AsciidocParser(ParserConfig.builder().safeMode(true).build());
 * ParseResult result = parser.parseFile(Path.of("docs/index.adoc"));
 * if (result.hasErrors()) {
 *     System.err.println(new DiagnosticFormatter(source, "index.adoc").format(result.diagnostics()));
 * }
 * }</pre>
 */
public class AsciidocParser {

	private static final Logger logger = LoggerFactory.getLogger(AsciidocParser.class);

	private final ParserConfig config;
	private final IncludeResolver resolver;

	public AsciidocParser() {
		this(ParserConfig.defaults());
	}

	public AsciidocParser(ParserConfig config) {
		this(config, new FileSystemIncludeResolver());
	}

	public AsciidocParser(ParserConfig config, IncludeResolver resolver) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	public ParserConfig config() {
		return config;
	}

	public ParseResult parse(String text) {
		return parse(text, config);
	}

	/**
	 * Reads and parses a UTF-8 file. Malformed bytes are replaced and reported as lexical
	 * errors. Unless a base directory is configured, includes resolve against the file's directory.
	 *
	 * @throws AsciidocException if the file cannot be read
	 */
	public ParseResult parseFile(Path path) {
		Objects.requireNonNull(path, "path must not be null");
		byte[] bytes;
		try {
			bytes = Files.readAllBytes(path);
		} catch (IOException e) {
			throw new AsciidocException("Failed to read document: " + path, e);
		}
		String text = new String(bytes, StandardCharsets.UTF_8);
		if (text.startsWith("\uFEFF")) {
			text = text.substring(1);
		}
		ParserConfig effective = config;
		if (config.baseDir() == null) {
			Path parent = path.toAbsolutePath().getParent();
			effective = config.toBuilder().baseDir(parent).build();
		}
		logger.debug("Parsing {}", path);
		return parse(text, effective);
	}

	private ParseResult parse(String text, ParserConfig config) {
		Objects.requireNonNull(text, "text must not be null");
		Diagnostics diagnostics = new Diagnostics();
		ParserContext ctx = new ParserContext(config, resolver, diagnostics);
		Document document = new BlockParser(ctx, text).parseDocument();
		diagnostics.addAll(new DocumentValidator(config).validate(document));
		List<Diagnostic> sorted = diagnostics.sorted();
		logger.debug("Parsed {} characters into {} blocks with {} diagnostics", text.length(),
				document.blocks().size(), sorted.size());
		return new ParseResult(document, sorted);
	}
}
