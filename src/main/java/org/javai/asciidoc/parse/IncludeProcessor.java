package org.javai.asciidoc.parse;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.IncludeRecord;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.diag.LabeledSpan;
import org.javai.asciidoc.diag.LineIndex;
import org.javai.asciidoc.token.Token;
import org.javai.asciidoc.token.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands {@code include::target[]} directives.
 * <p>
 * The target is resolved against the directory of the including file, read through the
 * context's {@link org.javai.asciidoc.include.IncludeResolver} and parsed as a
 * self-contained block sequence sharing the attribute table of the including document.
 * The resulting nodes and diagnostics are re-anchored to the directive's span; each
 * diagnostic keeps its position in the included file as a labeled secondary span.
 */
public final class IncludeProcessor {

	private static final Logger logger = LoggerFactory.getLogger(IncludeProcessor.class);

	private static final Pattern URI = Pattern.compile("[A-Za-z][A-Za-z0-9+.-]*://.*");
	private static final Pattern LEVEL_OFFSET = Pattern.compile("[+-]?\\d{1,2}");

	private final ParserContext ctx;
	private final int levelOffset;

	/**
	 * @param levelOffset the level offset of the including file
	 */
	public IncludeProcessor(ParserContext ctx, int levelOffset) {
		this.ctx = ctx;
		this.levelOffset = levelOffset;
	}

	/**
	 * Includes the target of {@code directive}.
	 *
	 * @param allowsSections whether headings in the included content start sections
	 * @return the included blocks, empty if the include failed
	 */
	public List<Block> process(Token directive, boolean allowsSections) {
		Span span = directive.span();
		String target = ctx.substitute(directive.value(), span).strip();
		Map<String, String> attributes = AttributeListParser.parse(ctx.substitute(directive.attrlist(), span));
		boolean optional = AttributeListParser.hasOption(attributes, "optional");

		if (target.isEmpty()) {
			ctx.report(DiagnosticKind.UNEXPECTED_TOKEN, "include directive requires a target", span);
			return List.of();
		}
		if (!ctx.canEnterInclude()) {
			ctx.report(DiagnosticKind.INCLUDE_DEPTH_EXCEEDED,
					"include of " + target + " exceeds the maximum include depth of " + ctx.config().maxIncludeDepth(),
					span);
			return List.of();
		}
		if (URI.matcher(target).matches()) {
			if (ctx.config().safeMode()) {
				ctx.report(DiagnosticKind.INCLUDE_PATH_REJECTED,
						"URI include " + target + " is not allowed in safe mode", span);
			} else if (!optional) {
				ctx.report(DiagnosticKind.INCLUDE_NOT_FOUND, "cannot read URI include " + target, span);
			}
			return List.of();
		}

		Path path;
		try {
			path = ctx.currentDirectory().resolve(target).normalize();
		} catch (InvalidPathException e) {
			if (!optional) {
				ctx.report(DiagnosticKind.INCLUDE_NOT_FOUND, "invalid include path " + target + ": " + e.getReason(),
						span);
			}
			return List.of();
		}
		if (ctx.config().safeMode() && !path.startsWith(ctx.config().effectiveBaseDir())) {
			ctx.report(DiagnosticKind.INCLUDE_PATH_REJECTED,
					"include " + target + " resolves outside the base directory", span);
			return List.of();
		}

		String content;
		try {
			content = ctx.resolver().read(path);
		} catch (IOException e) {
			if (optional) {
				logger.debug("Skipping optional include {}: {}", path, e.getMessage());
			} else {
				ctx.report(DiagnosticKind.INCLUDE_NOT_FOUND, "include target not found: " + target, span);
			}
			return List.of();
		}
		logger.debug("Including {} at depth {}", path, ctx.includeDepth() + 1);
		ctx.registerSource(content.length());

		int recordIndex = ctx.includeCount();
		ctx.addInclude(new IncludeRecord(target, path, span));
		Diagnostics nested = new Diagnostics();
		Path directory = path.getParent() != null ? path.getParent() : ctx.currentDirectory();
		List<Block> blocks;
		ctx.enterInclude(directory);
		ctx.pushDiagnostics(nested);
		int floor = ctx.lockDelimited();
		try {
			List<Token> tokens = new Tokenizer(content).tokenize();
			BlockParser parser = new BlockParser(ctx, content, tokens, levelOffset(attributes.get("leveloffset")));
			blocks = parser.parseBlockSequence(allowsSections, true);
		} finally {
			ctx.unlockDelimited(floor);
			ctx.popDiagnostics();
			ctx.leaveInclude();
		}
		ctx.relocateIncludes(recordIndex + 1, span);

		LineIndex lines = new LineIndex(content);
		for (Diagnostic diagnostic : nested.list()) {
			ctx.report(relocate(diagnostic, target, lines, span));
		}
		return SpanRelocator.relocate(blocks, span);
	}

	/**
	 * {@code +N} and {@code -N} shift relative to the including file, {@code N} sets the offset.
	 */
	int levelOffset(String value) {
		if (value == null || !LEVEL_OFFSET.matcher(value.strip()).matches()) {
			return levelOffset;
		}
		String text = value.strip();
		int amount = Integer.parseInt(text.startsWith("+") ? text.substring(1) : text);
		return text.startsWith("+") || text.startsWith("-") ? levelOffset + amount : amount;
	}

	private static Diagnostic relocate(Diagnostic diagnostic, String target, LineIndex lines, Span span) {
		List<LabeledSpan> secondary = new ArrayList<>();
		secondary.add(new LabeledSpan(span, target + ":" + lines.position(diagnostic.primary().start())));
		for (LabeledSpan label : diagnostic.secondary()) {
			secondary.add(new LabeledSpan(span,
					label.label() + " (" + target + ":" + lines.position(label.span().start()) + ")"));
		}
		return new Diagnostic(diagnostic.kind(), diagnostic.severity(), "in " + target + ": " + diagnostic.message(),
				span, secondary);
	}
}
