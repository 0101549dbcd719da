package org.javai.asciidoc.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the content of a bracketed attribute list such as
 * {@code source#example.lead%linenums,java,title="Main class"}.
 * <p>
 * Positional attributes are stored under {@code "1"}, {@code "2"}, ...; the first also under
 * {@code "style"}. Shorthand in the first position adds {@code "id"} ({@code #}), {@code "role"}
 * ({@code .}, space separated) and {@code "options"} ({@code %}, comma separated).
 * {@code opts} is an alias of {@code options}.
 */
public final class AttributeListParser {

	private static final Pattern NAMED = Pattern.compile("([A-Za-z_][\\w-]*)\\s*=\\s*(.*)", Pattern.DOTALL);

	private AttributeListParser() {
	}

	public static Map<String, String> parse(String attrlist) {
		Map<String, String> attributes = new LinkedHashMap<>();
		if (attrlist == null || attrlist.isBlank()) {
			return attributes;
		}
		int position = 0;
		for (String item : split(attrlist)) {
			String entry = item.strip();
			Matcher named = NAMED.matcher(entry);
			if (named.matches()) {
				String name = named.group(1).toLowerCase(Locale.ROOT);
				String value = unquote(named.group(2).strip());
				if (name.equals("opts") || name.equals("options")) {
					addOptions(attributes, value);
				} else {
					attributes.put(name, value);
				}
				continue;
			}
			position++;
			if (entry.isEmpty()) {
				continue;
			}
			if (position == 1) {
				parseShorthand(attributes, unquote(entry));
			} else {
				attributes.put(String.valueOf(position), unquote(entry));
			}
		}
		return attributes;
	}

	/**
	 * Whether {@code option} appears in the {@code options} attribute.
	 */
	public static boolean hasOption(Map<String, String> attributes, String option) {
		String options = attributes.get("options");
		if (options == null) {
			return false;
		}
		for (String value : options.split(",")) {
			if (value.strip().equals(option)) {
				return true;
			}
		}
		return false;
	}

	private static void parseShorthand(Map<String, String> attributes, String entry) {
		int i = 0;
		while (i < entry.length() && "#.%".indexOf(entry.charAt(i)) < 0) {
			i++;
		}
		String style = entry.substring(0, i).strip();
		if (!style.isEmpty()) {
			attributes.put("1", style);
			attributes.put("style", style);
		}
		while (i < entry.length()) {
			char kind = entry.charAt(i);
			int start = ++i;
			while (i < entry.length() && "#.%".indexOf(entry.charAt(i)) < 0) {
				i++;
			}
			String value = entry.substring(start, i);
			if (value.isEmpty()) {
				continue;
			}
			switch (kind) {
				case '#' -> attributes.put("id", value);
				case '.' -> attributes.merge("role", value, (a, b) -> a + " " + b);
				default -> addOptions(attributes, value);
			}
		}
	}

	private static void addOptions(Map<String, String> attributes, String options) {
		for (String option : options.split(",")) {
			String value = option.strip();
			if (!value.isEmpty()) {
				attributes.merge("options", value, (a, b) -> a + "," + b);
			}
		}
	}

	/**
	 * Splits on commas that are not inside a quoted value.
	 */
	private static List<String> split(String attrlist) {
		List<String> items = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		char quote = 0;
		for (int i = 0; i < attrlist.length(); i++) {
			char c = attrlist.charAt(i);
			if (quote != 0) {
				if (c == quote) {
					quote = 0;
				}
				current.append(c);
			} else if ((c == '"' || c == '\'') && isValueStart(current)) {
				quote = c;
				current.append(c);
			} else if (c == ',') {
				items.add(current.toString());
				current.setLength(0);
			} else {
				current.append(c);
			}
		}
		items.add(current.toString());
		return items;
	}

	private static boolean isValueStart(StringBuilder current) {
		String text = current.toString().strip();
		return text.isEmpty() || text.endsWith("=");
	}

	private static String unquote(String value) {
		if (value.length() >= 2) {
			char first = value.charAt(0);
			if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
				return value.substring(1, value.length() - 1);
			}
		}
		return value;
	}
}
