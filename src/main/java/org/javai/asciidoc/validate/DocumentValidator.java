package org.javai.asciidoc.validate;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.asciidoc.ParserConfig;
import org.javai.asciidoc.ast.AstVisitor;
import org.javai.asciidoc.ast.AstWalker;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.ast.IncludeRecord;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.diag.LabeledSpan;
import org.javai.asciidoc.parse.ParserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a parsed document against rules that need the whole tree.
 * <ul>
 *   <li>every attribute reference names an attribute of the final attribute table</li>
 *   <li>sections are no deeper than the configured maximum and deeper than their parent</li>
 *   <li>in safe mode, every include record lies inside the base directory</li>
 *   <li>explicit block ids are unique</li>
 * </ul>
 * The document is not modified.
 */
public final class DocumentValidator {

	private static final Logger logger = LoggerFactory.getLogger(DocumentValidator.class);

	private final ParserConfig config;

	public DocumentValidator(ParserConfig config) {
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public List<Diagnostic> validate(Document document) {
		Objects.requireNonNull(document, "document must not be null");
		Diagnostics diagnostics = new Diagnostics();
		AstWalker.walk(document, new TreeChecks(document, diagnostics));
		if (config.safeMode()) {
			checkIncludes(document.includes(), diagnostics);
		}
		logger.debug("Validation found {} diagnostics", diagnostics.size());
		return diagnostics.list();
	}

	private void checkIncludes(List<IncludeRecord> includes, Diagnostics diagnostics) {
		Path baseDir = config.effectiveBaseDir();
		for (IncludeRecord include : includes) {
			if (!include.path().toAbsolutePath().normalize().startsWith(baseDir)) {
				diagnostics.report(DiagnosticKind.INCLUDE_PATH_REJECTED,
						"included file " + include.path() + " lies outside the base directory " + baseDir,
						include.span());
			}
		}
	}

	private final class TreeChecks implements AstVisitor {
		private final Document document;
		private final Diagnostics diagnostics;
		private final Deque<Integer> levels = new ArrayDeque<>();
		private final Map<String, Span> ids = new HashMap<>();

		TreeChecks(Document document, Diagnostics diagnostics) {
			this.document = document;
			this.diagnostics = diagnostics;
		}

		@Override
		public void visitSection(Block.Section section) {
			int level = section.level();
			if (level > config.maxSectionDepth()) {
				diagnostics.report(DiagnosticKind.SECTION_NESTING_VIOLATION,
						"section level " + level + " exceeds the maximum depth of " + config.maxSectionDepth(),
						section.span());
			}
			Integer parent = levels.peek();
			if (parent != null && level <= parent) {
				diagnostics.report(DiagnosticKind.SECTION_NESTING_VIOLATION,
						"section level " + level + " must be deeper than its parent level " + parent,
						section.span());
			}
			levels.push(level);
			checkId(section);
		}

		@Override
		public void leave(Object node) {
			if (node instanceof Block.Section) {
				levels.pop();
			}
		}

		@Override
		public void visitParagraph(Block.Paragraph paragraph) {
			checkId(paragraph);
		}

		@Override
		public void visitDelimited(Block.Delimited delimited) {
			checkId(delimited);
		}

		@Override
		public void visitList(Block.ListBlock list) {
			checkId(list);
		}

		@Override
		public void visitTable(Block.Table table) {
			checkId(table);
		}

		@Override
		public void visitBlockMacro(Block.BlockMacro macro) {
			checkId(macro);
		}

		@Override
		public void visitAttributeRef(Inline.AttributeRef ref) {
			if (!document.isDefined(ref.name()) && !ParserContext.isIntrinsic(ref.name())) {
				diagnostics.report(DiagnosticKind.UNDEFINED_ATTRIBUTE,
						"attribute '" + ref.name() + "' is not defined", ref.span());
			}
		}

		private void checkId(Block block) {
			String id = block.attributes().get("id");
			if (id == null) {
				return;
			}
			Span first = ids.putIfAbsent(id, block.span());
			if (first != null) {
				diagnostics.report(DiagnosticKind.DUPLICATE_ID, "duplicate id '" + id + "'", block.span(),
						new LabeledSpan(first, "first used here"));
			}
		}
	}
}
