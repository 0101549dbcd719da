package org.javai.asciidoc;

import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link ParserConfig} from YAML.
 * <pre>
 * max_include_depth: 5
 * max_section_depth: 4
 * base_dir: docs
 * safe_mode: true
 * max_block_depth: 16
 * max_inline_depth: 16
 * attributes:
 *   product: Widget
 *   toc: true
 *   draft: false
 * </pre>
 * Every key is optional. Attribute values of {@code true} define the attribute with an
 * empty value; {@code false} or {@code null} unset it.
 */
public class ParserConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(ParserConfigLoader.class);

	private static final Set<String> KEYS = Set.of("max_include_depth", "max_section_depth", "base_dir",
			"safe_mode", "max_block_depth", "max_inline_depth", "attributes");

	private final Yaml yaml = new Yaml();

	/**
	 * Load a configuration file from a path. A relative {@code base_dir} is resolved
	 * against the directory containing the file.
	 */
	public ParserConfig load(Path path) {
		try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			Map<String, Object> data = yaml.load(reader);
			Path parent = path.toAbsolutePath().getParent();
			logger.debug("Loading parser configuration from {}", path);
			return buildConfig(data, parent);
		} catch (AsciidocException e) {
			throw e;
		} catch (Exception e) {
			throw new AsciidocException("Failed to load parser configuration from path: " + path, e);
		}
	}

	/**
	 * Load a configuration from an input stream.
	 */
	public ParserConfig load(InputStream inputStream) {
		try {
			Map<String, Object> data = yaml.load(inputStream);
			return buildConfig(data, null);
		} catch (AsciidocException e) {
			throw e;
		} catch (Exception e) {
			throw new AsciidocException("Failed to load parser configuration from input stream", e);
		}
	}

	/**
	 * Load a configuration from a reader.
	 */
	public ParserConfig load(Reader reader) {
		try {
			Map<String, Object> data = yaml.load(reader);
			return buildConfig(data, null);
		} catch (AsciidocException e) {
			throw e;
		} catch (Exception e) {
			throw new AsciidocException("Failed to load parser configuration from reader", e);
		}
	}

	/**
	 * Load a configuration from a string.
	 */
	public ParserConfig loadString(String yamlContent) {
		try {
			Map<String, Object> data = yaml.load(yamlContent);
			return buildConfig(data, null);
		} catch (AsciidocException e) {
			throw e;
		} catch (Exception e) {
			throw new AsciidocException("Failed to load parser configuration from string", e);
		}
	}

	@SuppressWarnings("unchecked")
	private ParserConfig buildConfig(Map<String, Object> data, Path relativeTo) {
		ParserConfig.Builder builder = ParserConfig.builder();
		if (data == null) {
			return builder.build();
		}
		for (String key : data.keySet()) {
			if (!KEYS.contains(key)) {
				throw new AsciidocException("Unknown configuration key: " + key);
			}
		}
		if (data.containsKey("max_include_depth")) {
			builder.maxIncludeDepth(intValue(data, "max_include_depth"));
		}
		if (data.containsKey("max_section_depth")) {
			builder.maxSectionDepth(intValue(data, "max_section_depth"));
		}
		if (data.containsKey("max_block_depth")) {
			builder.maxBlockDepth(intValue(data, "max_block_depth"));
		}
		if (data.containsKey("max_inline_depth")) {
			builder.maxInlineDepth(intValue(data, "max_inline_depth"));
		}
		if (data.containsKey("safe_mode")) {
			Object safeMode = data.get("safe_mode");
			if (!(safeMode instanceof Boolean)) {
				throw new AsciidocException("safe_mode must be true or false, got: " + safeMode);
			}
			builder.safeMode((Boolean) safeMode);
		}
		Object baseDir = data.get("base_dir");
		if (baseDir != null) {
			Path dir = Path.of(String.valueOf(baseDir));
			builder.baseDir(relativeTo != null && !dir.isAbsolute() ? relativeTo.resolve(dir) : dir);
		}
		Object attributes = data.get("attributes");
		if (attributes != null) {
			if (!(attributes instanceof Map)) {
				throw new AsciidocException("attributes must be a mapping");
			}
			((Map<Object, Object>) attributes).forEach((name, value) ->
					builder.attribute(String.valueOf(name), attributeValue(value)));
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new AsciidocException("Invalid parser configuration: " + e.getMessage(), e);
		}
	}

	private static int intValue(Map<String, Object> data, String key) {
		Object value = data.get(key);
		if (value instanceof Integer number) {
			return number;
		}
		throw new AsciidocException(key + " must be an integer, got: " + value);
	}

	private static String attributeValue(Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return null;
		}
		if (Boolean.TRUE.equals(value)) {
			return "";
		}
		return String.valueOf(value);
	}
}
