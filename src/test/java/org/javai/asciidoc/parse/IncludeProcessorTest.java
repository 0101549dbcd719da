package org.javai.asciidoc.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.javai.asciidoc.ParserConfig;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.ast.IncludeRecord;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostic;
import org.javai.asciidoc.diag.DiagnosticKind;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.include.IncludeResolver;
import org.javai.asciidoc.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IncludeProcessorTest {

	private static final Path BASE = Path.of("/docs");

	@Mock
	private IncludeResolver resolver;

	private Diagnostics diagnostics;
	private ParserConfig.Builder config;

	@BeforeEach
	void setUp() {
		diagnostics = new Diagnostics();
		config = ParserConfig.builder().baseDir(BASE);
	}

	private ParserContext context() {
		return new ParserContext(config.build(), resolver, diagnostics);
	}

	private Document parse(String source) {
		return new BlockParser(context(), source).parseDocument();
	}

	@Test
	void includedBlocksTakeTheDirectiveSpan() throws IOException {
		when(resolver.read(BASE.resolve("part.adoc"))).thenReturn("Included *text*.\n");

		Document document = parse("Intro.\n\ninclude::part.adoc[]\n\nOutro.\n");

		Span directive = new Span(8, 28);
		assertThat(document.blocks()).hasSize(3);
		Block.Paragraph included = (Block.Paragraph) document.blocks().get(1);
		assertThat(Inline.plainText(included.content())).isEqualTo("Included text.");
		assertThat(included.span()).isEqualTo(directive);
		assertThat(included.content()).allSatisfy(inline -> assertThat(inline.span()).isEqualTo(directive));
		assertThat(document.includes()).containsExactly(
				new IncludeRecord("part.adoc", BASE.resolve("part.adoc"), directive));
		assertThat(diagnostics.isEmpty()).isTrue();
		verify(resolver).read(BASE.resolve("part.adoc"));
	}

	@Test
	void includedFileSharesAttributes() throws IOException {
		when(resolver.read(BASE.resolve("attrs.adoc"))).thenReturn(":product: Widget\n");

		Document document = parse("include::attrs.adoc[]\n\nUsing {product}.\n");

		Block.Paragraph paragraph = (Block.Paragraph) document.blocks().get(0);
		assertThat(Inline.plainText(paragraph.content())).isEqualTo("Using Widget.");
	}

	@Test
	void targetIsResolvedAgainstIncludingFile() throws IOException {
		when(resolver.read(BASE.resolve("chapters/one.adoc"))).thenReturn("include::shared.adoc[]\n");
		when(resolver.read(BASE.resolve("chapters/shared.adoc"))).thenReturn("Shared.\n");

		Document document = parse("include::chapters/one.adoc[]\n");

		assertThat(document.includes()).extracting(IncludeRecord::path)
				.containsExactly(BASE.resolve("chapters/one.adoc"), BASE.resolve("chapters/shared.adoc"));
		assertThat(document.includes()).extracting(IncludeRecord::span).containsOnly(new Span(0, 28));
	}

	@Nested
	@DisplayName("Level offset")
	class LevelOffset {

		@Test
		void relativeOffsetShiftsHeadings() throws IOException {
			when(resolver.read(BASE.resolve("ch.adoc"))).thenReturn("= Chapter\n\ntext\n");

			Document document = parse("include::ch.adoc[leveloffset=+1]\n");

			assertThat(document.blocks()).singleElement().isInstanceOfSatisfying(Block.Section.class, section -> {
				assertThat(section.level()).isEqualTo(2);
				assertThat(section.titleText()).isEqualTo("Chapter");
			});
		}

		@Test
		void offsetArithmetic() {
			IncludeProcessor processor = new IncludeProcessor(context(), 1);
			assertThat(processor.levelOffset("+2")).isEqualTo(3);
			assertThat(processor.levelOffset("-1")).isZero();
			assertThat(processor.levelOffset("2")).isEqualTo(2);
			assertThat(processor.levelOffset(null)).isEqualTo(1);
			assertThat(processor.levelOffset("deep")).isEqualTo(1);
		}

		@Test
		void includedSectionEndsEnclosingSection() throws IOException {
			when(resolver.read(BASE.resolve("b.adoc"))).thenReturn("== B\n\nbody\n");

			Document document = parse("= Doc\n\n== A\n\ninclude::b.adoc[]\n");

			assertThat(document.blocks()).hasSize(2);
			Block.Section a = (Block.Section) document.blocks().get(0);
			Block.Section b = (Block.Section) document.blocks().get(1);
			assertThat(a.blocks()).isEmpty();
			assertThat(b.titleText()).isEqualTo("B");
			assertThat(b.span()).isEqualTo(new Span(13, 30));
		}
	}

	@Nested
	@DisplayName("Failures")
	class Failures {

		@Test
		void missingTarget() throws IOException {
			when(resolver.read(any())).thenThrow(new NoSuchFileException("/docs/missing.adoc"));

			Document document = parse("include::missing.adoc[]\n");

			assertThat(document.blocks()).isEmpty();
			assertThat(document.includes()).isEmpty();
			assertThat(diagnostics.list()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.INCLUDE_NOT_FOUND);
				assertThat(d.message()).isEqualTo("include target not found: missing.adoc");
				assertThat(d.primary()).isEqualTo(new Span(0, 23));
			});
		}

		@Test
		void optionalTargetIsSkippedQuietly() throws IOException {
			when(resolver.read(any())).thenThrow(new NoSuchFileException("/docs/missing.adoc"));

			try (LogCaptorAppender appender = LogCaptorAppender.capture(IncludeProcessor.class)) {
				parse("include::missing.adoc[opts=optional]\n");

				assertThat(appender.hasMessageContaining("Skipping optional include")).isTrue();
			}
			assertThat(diagnostics.isEmpty()).isTrue();
		}

		@Test
		void depthLimit() throws IOException {
			config.maxIncludeDepth(2);
			when(resolver.read(BASE.resolve("loop.adoc"))).thenReturn("include::loop.adoc[]\n");

			Document document = parse("include::loop.adoc[]\n");

			assertThat(document.includes()).hasSize(2);
			assertThat(diagnostics.list()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.INCLUDE_DEPTH_EXCEEDED);
				assertThat(d.message()).isEqualTo(
						"in loop.adoc: in loop.adoc: include of loop.adoc exceeds the maximum include depth of 2");
				assertThat(d.primary()).isEqualTo(new Span(0, 20));
				assertThat(d.secondary()).hasSize(2);
				assertThat(d.secondary().get(0).label()).isEqualTo("loop.adoc:1:1");
			});
		}

		@Test
		void safeModeRejectsPathsOutsideBase() {
			config.safeMode(true);

			parse("include::../secret.adoc[]\n");

			assertThat(diagnostics.list()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.INCLUDE_PATH_REJECTED);
				assertThat(d.message()).isEqualTo("include ../secret.adoc resolves outside the base directory");
			});
			verifyNoInteractions(resolver);
		}

		@Test
		void uriIncludes() {
			config.safeMode(true);
			parse("include::https://example.org/a.adoc[]\n");
			config.safeMode(false);
			parse("include::https://example.org/b.adoc[]\n");

			assertThat(diagnostics.list()).extracting(Diagnostic::kind, Diagnostic::message).containsExactly(
					tuple(DiagnosticKind.INCLUDE_PATH_REJECTED,
							"URI include https://example.org/a.adoc is not allowed in safe mode"),
					tuple(DiagnosticKind.INCLUDE_NOT_FOUND,
							"cannot read URI include https://example.org/b.adoc"));
			verifyNoInteractions(resolver);
		}

		@Test
		void diagnosticsInIncludedFileAreRelocated() throws IOException {
			when(resolver.read(BASE.resolve("part.adoc"))).thenReturn("text\n\n+\n");

			parse("Intro.\n\ninclude::part.adoc[]\n");

			assertThat(diagnostics.list()).singleElement().satisfies(d -> {
				assertThat(d.kind()).isEqualTo(DiagnosticKind.UNEXPECTED_TOKEN);
				assertThat(d.message()).isEqualTo("in part.adoc: list continuation outside of a list item");
				assertThat(d.primary()).isEqualTo(new Span(8, 28));
				assertThat(d.secondary()).singleElement()
						.satisfies(s -> assertThat(s.label()).isEqualTo("part.adoc:3:1"));
			});
		}
	}

	@Test
	void includeIsLogged() throws IOException {
		when(resolver.read(BASE.resolve("part.adoc"))).thenReturn("Included.\n");

		try (LogCaptorAppender appender = LogCaptorAppender.capture(IncludeProcessor.class)) {
			parse("include::part.adoc[]\n");

			assertThat(appender.messages()).contains("Including /docs/part.adoc at depth 1");
		}
	}
}
