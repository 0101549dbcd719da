package org.javai.asciidoc.parse;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.asciidoc.ParserConfig;
import org.javai.asciidoc.ast.AttributeValue;
import org.javai.asciidoc.ast.DelimitedKind;
import org.javai.asciidoc.ast.IncludeRecord;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.diag.LabeledSpan;
import org.javai.asciidoc.include.IncludeResolver;

/**
 * Mutable state shared by every parser taking part in one parse: the attribute table, the
 * conditional and delimited-block stacks, section and include depth, registered ids and the
 * diagnostic sink.
 * <p>
 * A context lives for exactly one parse and is not thread-safe.
 */
public final class ParserContext {

	/**
	 * Longest chain of attribute references followed before resolution gives up.
	 */
	public static final int MAX_RESOLUTION_DEPTH = 10;

	/**
	 * Characters attribute substitution may produce in any parse, however small the source.
	 */
	public static final long MIN_EXPANSION_BUDGET = 1L << 20;

	/**
	 * Characters of expansion allowed per character of source read, on top of the minimum.
	 */
	public static final int EXPANSION_FACTOR = 16;

	private static final Pattern REFERENCE = Pattern.compile("\\{([A-Za-z0-9_][A-Za-z0-9_-]*)}");

	private static final Map<String, String> INTRINSIC_ATTRIBUTES = Map.ofEntries(
			Map.entry("empty", ""),
			Map.entry("blank", ""),
			Map.entry("sp", " "),
			Map.entry("nbsp", "\u00a0"),
			Map.entry("zwsp", "\u200b"),
			Map.entry("wj", "\u2060"),
			Map.entry("apos", "'"),
			Map.entry("quot", "\""),
			Map.entry("lsquo", "\u2018"),
			Map.entry("rsquo", "\u2019"),
			Map.entry("ldquo", "\u201c"),
			Map.entry("rdquo", "\u201d"),
			Map.entry("deg", "\u00b0"),
			Map.entry("plus", "+"),
			Map.entry("brvbar", "\u00a6"),
			Map.entry("vbar", "|"),
			Map.entry("amp", "&"),
			Map.entry("lt", "<"),
			Map.entry("gt", ">"),
			Map.entry("startsb", "["),
			Map.entry("endsb", "]"),
			Map.entry("caret", "^"),
			Map.entry("asterisk", "*"),
			Map.entry("tilde", "~"),
			Map.entry("backslash", "\\"),
			Map.entry("backtick", "`"),
			Map.entry("two-colons", "::"),
			Map.entry("two-semicolons", ";;"),
			Map.entry("cpp", "C++"));

	/**
	 * A conditional directive whose body is being included.
	 */
	public record OpenConditional(String directive, String target, Span span) {
	}

	/**
	 * A delimited block that has been opened but not yet closed.
	 */
	public record OpenBlock(DelimitedKind kind, int length, Span openSpan) {

		public boolean closedBy(DelimitedKind otherKind, int otherLength) {
			return kind == otherKind && length == otherLength;
		}
	}

	private final ParserConfig config;
	private final IncludeResolver resolver;
	private final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
	private final Map<String, Span> definitions = new HashMap<>();
	private final Set<String> reportedCycles = new HashSet<>();
	private final Map<String, String> resolved = new HashMap<>();
	private final Set<String> reportedExpansions = new HashSet<>();
	private long expansionBudget = MIN_EXPANSION_BUDGET;
	private int resolutionFaults = 0;
	private boolean expansionExceeded;
	private final Deque<OpenConditional> conditionals = new ArrayDeque<>();
	private final Deque<OpenBlock> delimited = new ArrayDeque<>();
	private final Deque<Path> directories = new ArrayDeque<>();
	private final Deque<Diagnostics> sinks = new ArrayDeque<>();
	private final Map<String, Integer> ids = new HashMap<>();
	private final List<IncludeRecord> includes = new ArrayList<>();
	private int delimitedFloor = 0;
	private int currentLevel = 0;
	private int includeDepth = 0;
	private int listDepth = 0;

	public ParserContext(ParserConfig config, IncludeResolver resolver, Diagnostics diagnostics) {
		this.config = Objects.requireNonNull(config, "config must not be null");
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.sinks.push(Objects.requireNonNull(diagnostics, "diagnostics must not be null"));
		this.directories.push(config.effectiveBaseDir());
		config.attributes().forEach((name, value) -> defineAttribute(name, AttributeValue.of(value), null));
	}

	public ParserConfig config() {
		return config;
	}

	public IncludeResolver resolver() {
		return resolver;
	}

	// Attributes

	/**
	 * Defines (or unsets) an attribute; the last definition wins. A value that references other
	 * attributes is resolved once so that a cycle is reported at the definition closing it.
	 *
	 * @param span the attribute entry, or {@code null} for attributes from configuration
	 */
	public void defineAttribute(String name, AttributeValue value, Span span) {
		String key = name.toLowerCase(Locale.ROOT);
		attributes.put(key, value);
		resolved.clear();
		if (span != null) {
			definitions.put(key, span);
		} else {
			definitions.remove(key);
		}
		if (value instanceof AttributeValue.TextValue text && text.text().indexOf('{') >= 0) {
			resolveAttribute(key, span != null ? span : Span.at(0));
		}
	}

	/**
	 * Whether {@code name} is a built-in character replacement such as {@code nbsp} or {@code amp}.
	 */
	public static boolean isIntrinsic(String name) {
		return INTRINSIC_ATTRIBUTES.containsKey(name.toLowerCase(Locale.ROOT));
	}

	public boolean isDefined(String name) {
		String key = name.toLowerCase(Locale.ROOT);
		AttributeValue value = attributes.get(key);
		return value != null ? value.isDefined() : INTRINSIC_ATTRIBUTES.containsKey(key);
	}

	/**
	 * Resolves an attribute to its text, substituting references in its value.
	 * <p>
	 * Every resolution draws on one expansion budget per parse (see {@link #registerSource(int)}).
	 * A resolution that would exceed it is reported once per attribute and yields the literal
	 * attribute name.
	 *
	 * @param span where the reference occurs; cycles found during resolution are reported there
	 * @return the text, or empty when the attribute is not defined
	 */
	public Optional<String> resolveAttribute(String name, Span span) {
		String key = name.toLowerCase(Locale.ROOT);
		Set<String> chain = new LinkedHashSet<>();
		chain.add(key);
		expansionExceeded = false;
		Optional<String> text = resolve(key, chain, span);
		if (!expansionExceeded && text.isPresent() && !charge(text.get().length())) {
			expansionExceeded = true;
		}
		if (expansionExceeded) {
			expansionExceeded = false;
			reportExpansion(key, span);
			return Optional.of(key);
		}
		return text;
	}

	/**
	 * Adds the length of a source about to be parsed to the expansion budget.
	 */
	public void registerSource(int length) {
		expansionBudget += (long) length * EXPANSION_FACTOR;
	}

	public long expansionBudget() {
		return expansionBudget;
	}

	/**
	 * Replaces every reference to a defined attribute in {@code text}; references to undefined
	 * attributes are kept as written.
	 */
	public String substitute(String text, Span span) {
		if (text == null || text.indexOf('{') < 0) {
			return text;
		}
		Matcher m = REFERENCE.matcher(text);
		StringBuilder sb = new StringBuilder();
		while (m.find()) {
			String replacement = resolveAttribute(m.group(1), span).orElse(m.group());
			m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		m.appendTail(sb);
		return sb.toString();
	}

	private Optional<String> resolve(String name, Set<String> chain, Span span) {
		AttributeValue value = attributes.get(name);
		if (value == null) {
			return Optional.ofNullable(INTRINSIC_ATTRIBUTES.get(name));
		}
		Optional<String> text = value.asText();
		if (text.isEmpty() || !(value instanceof AttributeValue.TextValue) || text.get().indexOf('{') < 0) {
			return text;
		}
		String cached = resolved.get(name);
		if (cached != null) {
			return Optional.of(cached);
		}
		int faults = resolutionFaults;
		Matcher m = REFERENCE.matcher(text.get());
		StringBuilder sb = new StringBuilder();
		while (m.find()) {
			String ref = m.group(1).toLowerCase(Locale.ROOT);
			String replacement;
			if (chain.contains(ref) || chain.size() >= MAX_RESOLUTION_DEPTH) {
				resolutionFaults++;
				reportCycle(chain, ref, span);
				replacement = m.group(1);
			} else {
				chain.add(ref);
				replacement = resolve(ref, chain, span).orElse(m.group());
				chain.remove(ref);
				if (expansionExceeded) {
					return Optional.empty();
				}
			}
			m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
			if (sb.length() > expansionBudget) {
				charge(sb.length());
				expansionExceeded = true;
				return Optional.empty();
			}
		}
		m.appendTail(sb);
		if (!charge(sb.length())) {
			expansionExceeded = true;
			return Optional.empty();
		}
		String result = sb.toString();
		if (faults == resolutionFaults) {
			resolved.put(name, result);
		}
		return Optional.of(result);
	}

	/**
	 * Takes {@code length} characters from the expansion budget.
	 *
	 * @return false if the budget did not cover them; it is then exhausted
	 */
	private boolean charge(long length) {
		if (length > expansionBudget) {
			expansionBudget = 0;
			return false;
		}
		expansionBudget -= length;
		return true;
	}

	private void reportExpansion(String name, Span span) {
		if (reportedExpansions.add(name)) {
			report(DiagnosticKind.CIRCULAR_ATTRIBUTE_REFERENCE,
					"expansion of attribute `" + name + "` exceeds the substitution limit for this document", span);
		}
	}

	private void reportCycle(Set<String> chain, String ref, Span span) {
		List<String> involved = new ArrayList<>();
		boolean cycle = chain.contains(ref);
		boolean inCycle = !cycle;
		for (String name : chain) {
			inCycle |= name.equals(ref);
			if (inCycle) {
				involved.add(name);
			}
		}
		String key = String.join(",", involved.stream().sorted().toList());
		if (!reportedCycles.add(key)) {
			return;
		}
		String path = String.join(" -> ", involved) + " -> " + ref;
		String message = cycle
				? "circular attribute reference: " + path
				: "attribute references nested deeper than " + MAX_RESOLUTION_DEPTH + ": " + path;
		List<LabeledSpan> secondary = new ArrayList<>();
		for (String name : involved) {
			Span definition = definitions.get(name);
			if (definition != null && !definition.equals(span)) {
				secondary.add(new LabeledSpan(definition, "`" + name + "` defined here"));
			}
		}
		report(new Diagnostic(DiagnosticKind.CIRCULAR_ATTRIBUTE_REFERENCE,
				DiagnosticKind.CIRCULAR_ATTRIBUTE_REFERENCE.defaultSeverity(), message, span, secondary));
	}

	/**
	 * Snapshot of the attribute table with text values resolved.
	 */
	public Map<String, AttributeValue> attributes() {
		Map<String, AttributeValue> snapshot = new LinkedHashMap<>();
		for (Map.Entry<String, AttributeValue> entry : attributes.entrySet()) {
			AttributeValue value = entry.getValue();
			if (value instanceof AttributeValue.TextValue text && text.text().indexOf('{') >= 0) {
				Span span = definitions.getOrDefault(entry.getKey(), Span.at(0));
				value = new AttributeValue.TextValue(resolveAttribute(entry.getKey(), span).orElse(text.text()));
			}
			snapshot.put(entry.getKey(), value);
		}
		return snapshot;
	}

	// Conditionals

	public void pushConditional(OpenConditional conditional) {
		conditionals.push(conditional);
	}

	/**
	 * @return the innermost open conditional, or {@code null} if none is open
	 */
	public OpenConditional popConditional() {
		return conditionals.poll();
	}

	public int conditionalDepth() {
		return conditionals.size();
	}

	// Delimited blocks

	public void pushDelimited(OpenBlock block) {
		delimited.push(block);
	}

	public OpenBlock popDelimited() {
		return delimited.pop();
	}

	/**
	 * The innermost open block the current parser may close, or {@code null}. Blocks opened
	 * outside an included file or a table cell are not visible from inside it.
	 */
	public OpenBlock topDelimited() {
		return delimited.size() > delimitedFloor ? delimited.peek() : null;
	}

	public int delimitedDepth() {
		return delimited.size();
	}

	/**
	 * Hides every currently open block from {@link #topDelimited()}.
	 *
	 * @return the previous floor, to be passed to {@link #unlockDelimited(int)}
	 */
	public int lockDelimited() {
		int previous = delimitedFloor;
		delimitedFloor = delimited.size();
		return previous;
	}

	public void unlockDelimited(int previousFloor) {
		delimitedFloor = previousFloor;
	}

	// Lists

	/**
	 * Whether another list may be opened inside the lists currently being parsed. Lists nest
	 * through marker classes and through blocks attached with {@code +}; both count against
	 * {@link ParserConfig#maxBlockDepth()}.
	 */
	public boolean canEnterList() {
		return listDepth < config.maxBlockDepth();
	}

	public void enterList() {
		listDepth++;
	}

	public void leaveList() {
		listDepth--;
	}

	public int listDepth() {
		return listDepth;
	}

	// Sections

	/**
	 * @return the previous level, to be passed to {@link #leaveSection(int)}
	 */
	public int enterSection(int level) {
		int previous = currentLevel;
		currentLevel = level;
		return previous;
	}

	public void leaveSection(int previousLevel) {
		currentLevel = previousLevel;
	}

	public int currentLevel() {
		return currentLevel;
	}

	// Includes

	public boolean canEnterInclude() {
		return includeDepth < config.maxIncludeDepth();
	}

	public void enterInclude(Path directory) {
		includeDepth++;
		directories.push(directory);
	}

	public void leaveInclude() {
		includeDepth--;
		directories.pop();
	}

	public int includeDepth() {
		return includeDepth;
	}

	public Path currentDirectory() {
		return directories.peek();
	}

	public void addInclude(IncludeRecord include) {
		includes.add(include);
	}

	public int includeCount() {
		return includes.size();
	}

	/**
	 * Re-anchors the include records added since {@code fromIndex} to {@code span}.
	 */
	public void relocateIncludes(int fromIndex, Span span) {
		for (int i = fromIndex; i < includes.size(); i++) {
			IncludeRecord include = includes.get(i);
			includes.set(i, new IncludeRecord(include.target(), include.path(), span));
		}
	}

	public List<IncludeRecord> includes() {
		return List.copyOf(includes);
	}

	// Ids

	/**
	 * Registers an id, returning {@code false} if it was already taken.
	 */
	public boolean registerId(String id) {
		return ids.merge(id, 1, Integer::sum) == 1;
	}

	/**
	 * Registers {@code base}, or the first of {@code base_2}, {@code base_3}, ... not yet taken.
	 */
	public String uniqueId(String base) {
		if (registerId(base)) {
			return base;
		}
		int n = 2;
		while (!registerId(base + "_" + n)) {
			n++;
		}
		return base + "_" + n;
	}

	// Diagnostics

	public void report(Diagnostic diagnostic) {
		sinks.peek().add(diagnostic);
	}

	public void report(DiagnosticKind kind, String message, Span primary, LabeledSpan... secondary) {
		report(Diagnostic.of(kind, message, primary, secondary));
	}

	/**
	 * Redirects reports to {@code diagnostics} until the matching {@link #popDiagnostics()}.
	 */
	public void pushDiagnostics(Diagnostics diagnostics) {
		sinks.push(diagnostics);
	}

	public Diagnostics popDiagnostics() {
		if (sinks.size() == 1) {
			throw new IllegalStateException("Cannot remove the root diagnostic sink");
		}
		return sinks.pop();
	}
}
