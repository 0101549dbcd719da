package org.javai.asciidoc.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import java.util.List;
import java.util.NoSuchElementException;
import org.javai.asciidoc.ast.Span;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TokenizerTest {

	private static List<Token> tokenize(String input) {
		return new Tokenizer(input).tokenize();
	}

	private static List<TokenKind> kinds(String input) {
		return tokenize(input).stream().map(Token::kind).toList();
	}

	@Test
	void emptyInputIsJustEof() {
		List<Token> tokens = tokenize("");
		assertThat(tokens).hasSize(1);
		assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.EOF);
		assertThat(tokens.get(0).span()).isEqualTo(Span.at(0));
	}

	@Test
	void nullInputIsTreatedAsEmpty() {
		assertThat(kinds(null)).containsExactly(TokenKind.EOF);
	}

	@Test
	void iteratorStopsAfterEof() {
		Tokenizer tokenizer = new Tokenizer("word");
		assertThat(tokenizer.next().kind()).isEqualTo(TokenKind.WORD);
		assertThat(tokenizer.next().kind()).isEqualTo(TokenKind.EOF);
		assertThat(tokenizer.hasNext()).isFalse();
		assertThatThrownBy(tokenizer::next).isInstanceOf(NoSuchElementException.class);
	}

	@Test
	void rejectsInvalidRange() {
		assertThatThrownBy(() -> new Tokenizer("abc", 2, 1))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid range");
	}

	@Nested
	@DisplayName("Line-level constructs")
	class LineLevel {

		@Test
		void headingCarriesLevel() {
			List<Token> tokens = tokenize("=== Install");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.HEADING);
			assertThat(tokens.get(0).length()).isEqualTo(3);
			assertThat(tokens.get(0).span()).isEqualTo(new Span(0, 3));
			assertThat(tokens.get(1).value()).isEqualTo("Install");
		}

		@Test
		void equalsWithoutTitleIsNotAHeading() {
			assertThat(kinds("==")).containsExactly(TokenKind.WORD, TokenKind.EOF);
		}

		@Test
		void delimitersKeepTheirLength() {
			List<Token> tokens = tokenize("----\n******");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.DELIMITER);
			assertThat(tokens.get(0).mark()).isEqualTo('-');
			assertThat(tokens.get(0).length()).isEqualTo(4);
			assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.DELIMITER);
			assertThat(tokens.get(2).mark()).isEqualTo('*');
			assertThat(tokens.get(2).length()).isEqualTo(6);
		}

		@Test
		void openBlockDelimiterIsTwoDashes() {
			List<Token> tokens = tokenize("--");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.DELIMITER);
			assertThat(tokens.get(0).length()).isEqualTo(2);
		}

		@Test
		void shortRunsAreNotDelimiters() {
			assertThat(tokenize("***").get(0).kind()).isNotEqualTo(TokenKind.DELIMITER);
		}

		@Test
		void tableDelimiters() {
			assertThat(kinds("|===\n!===\n!===\n|==="))
					.containsExactly(TokenKind.TABLE_DELIMITER, TokenKind.NEWLINE,
							TokenKind.NESTED_TABLE_DELIMITER, TokenKind.NEWLINE,
							TokenKind.NESTED_TABLE_DELIMITER, TokenKind.NEWLINE,
							TokenKind.TABLE_DELIMITER, TokenKind.EOF);
		}

		@Test
		void commentLine() {
			Token comment = tokenize("// note to self").get(0);
			assertThat(comment.kind()).isEqualTo(TokenKind.COMMENT);
			assertThat(comment.value()).isEqualTo("note to self");
		}

		@Test
		void attributeEntries() {
			List<Token> tokens = tokenize(":Product: Widget\n:toc:\n:draft!:\n:!beta:");
			assertThat(tokens).filteredOn(t -> t.is(TokenKind.ATTRIBUTE_ENTRY))
					.extracting(Token::name, Token::value)
					.containsExactly(
							tuple("product", "Widget"),
							tuple("toc", ""),
							tuple("draft", null),
							tuple("beta", null));
		}

		@Test
		void includeDirective() {
			Token directive = tokenize("include::parts/intro.adoc[leveloffset=+1]").get(0);
			assertThat(directive.isDirective("include")).isTrue();
			assertThat(directive.value()).isEqualTo("parts/intro.adoc");
			assertThat(directive.attrlist()).isEqualTo("leveloffset=+1");
		}

		@Test
		void singleLineIfdefIsFollowedByItsContent() {
			List<Token> tokens = tokenize("ifdef::draft[Draft *only*]");
			assertThat(tokens.get(0).isDirective("ifdef")).isTrue();
			assertThat(tokens.get(0).attrlist()).isEqualTo("Draft *only*");
			assertThat(tokens).extracting(Token::kind).containsExactly(TokenKind.DIRECTIVE, TokenKind.WORD,
					TokenKind.FORMAT_MARK, TokenKind.WORD, TokenKind.FORMAT_MARK, TokenKind.EOF);
		}

		@Test
		void blockMacro() {
			Token macro = tokenize("image::diagram.png[Diagram,300]").get(0);
			assertThat(macro.kind()).isEqualTo(TokenKind.BLOCK_MACRO);
			assertThat(macro.name()).isEqualTo("image");
			assertThat(macro.value()).isEqualTo("diagram.png");
			assertThat(macro.attrlist()).isEqualTo("Diagram,300");
		}

		@Test
		void blockAnchorAttributesAndTitle() {
			List<Token> tokens = tokenize("[[install,Installing]]\n[source,java]\n.Main class");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.BLOCK_ANCHOR);
			assertThat(tokens.get(0).value()).isEqualTo("install");
			assertThat(tokens.get(0).attrlist()).isEqualTo("Installing");
			assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.BLOCK_ATTRIBUTES);
			assertThat(tokens.get(2).attrlist()).isEqualTo("source,java");
			assertThat(tokens.get(4).kind()).isEqualTo(TokenKind.BLOCK_TITLE);
			assertThat(tokens.get(5).value()).isEqualTo("Main");
		}

		@Test
		void listMarkers() {
			String source = "* a\n** b\n- c\n. d\n1. e\nb. f\niv) g\n  *** h";
			List<Token> markers = tokenize(source).stream()
					.filter(t -> t.is(TokenKind.LIST_MARKER))
					.toList();
			assertThat(markers).extracting(Token::name)
					.containsExactly("*", "**", "-", ".", "1.", "a.", "i)", "***");
			assertThat(markers).extracting(Token::length)
					.containsExactly(1, 2, 1, 1, 1, 1, 1, 3);
			assertThat(markers.get(7).span().start()).isEqualTo(source.indexOf("***"));
		}

		@Test
		void listContinuation() {
			assertThat(kinds("* a\n+\n----")).containsExactly(TokenKind.LIST_MARKER, TokenKind.WORD,
					TokenKind.NEWLINE, TokenKind.LIST_CONTINUATION, TokenKind.NEWLINE, TokenKind.DELIMITER,
					TokenKind.EOF);
		}
	}

	@Nested
	@DisplayName("Line structure")
	class Lines {

		@Test
		void blankLinesCollapseIntoOneToken() {
			List<Token> tokens = tokenize("a\n\n  \n\nb");
			assertThat(tokens).extracting(Token::kind)
					.containsExactly(TokenKind.WORD, TokenKind.BLANK_LINE, TokenKind.WORD, TokenKind.EOF);
			assertThat(tokens.get(1).span()).isEqualTo(new Span(1, 7));
		}

		@Test
		void finalNewlineIsANewline() {
			assertThat(kinds("a\n")).containsExactly(TokenKind.WORD, TokenKind.NEWLINE, TokenKind.EOF);
		}

		@Test
		void leadingBlankLines() {
			assertThat(kinds("\n\nword")).containsExactly(TokenKind.BLANK_LINE, TokenKind.WORD, TokenKind.EOF);
		}

		@Test
		void carriageReturnsAreWhitespace() {
			assertThat(kinds("one\r\ntwo\r\n")).containsExactly(TokenKind.WORD, TokenKind.NEWLINE,
					TokenKind.WORD, TokenKind.NEWLINE, TokenKind.EOF);
		}
	}

	@Nested
	@DisplayName("Inline constructs")
	class InlineConstructs {

		@Test
		void whitespaceIsElided() {
			List<Token> tokens = tokenize("two  words");
			assertThat(tokens).extracting(Token::value).containsExactly("two", "words", "");
			assertThat(tokens.get(1).span()).isEqualTo(new Span(5, 10));
		}

		@Test
		void formattingMarks() {
			List<Token> tokens = tokenize("**bold** _it_");
			assertThat(tokens).extracting(Token::kind).containsExactly(TokenKind.FORMAT_MARK, TokenKind.WORD,
					TokenKind.FORMAT_MARK, TokenKind.FORMAT_MARK, TokenKind.WORD, TokenKind.FORMAT_MARK,
					TokenKind.EOF);
			assertThat(tokens.get(0).length()).isEqualTo(2);
			assertThat(tokens.get(3).length()).isEqualTo(1);
		}

		@Test
		void attributeReferenceIsThreeTokens() {
			List<Token> tokens = tokenize("v{version}!");
			assertThat(tokens).extracting(Token::kind).containsExactly(TokenKind.WORD,
					TokenKind.ATTRIBUTE_REF_OPEN, TokenKind.WORD, TokenKind.ATTRIBUTE_REF_CLOSE, TokenKind.WORD,
					TokenKind.EOF);
			assertThat(tokens.get(2).value()).isEqualTo("version");
		}

		@Test
		void braceWithoutNameIsText() {
			assertThat(kinds("{ not a ref }")).doesNotContain(TokenKind.ATTRIBUTE_REF_OPEN);
		}

		@Test
		void bareUrlDropsTrailingPunctuation() {
			List<Token> tokens = tokenize("See https://example.org/docs.");
			Token url = tokens.get(1);
			assertThat(url.kind()).isEqualTo(TokenKind.URL);
			assertThat(url.value()).isEqualTo("https://example.org/docs");
			assertThat(tokens.get(2).value()).isEqualTo(".");
		}

		@Test
		void urlInsideParentheses() {
			List<Token> tokens = tokenize("(https://example.org)");
			assertThat(tokens).extracting(Token::kind)
					.containsExactly(TokenKind.WORD, TokenKind.URL, TokenKind.WORD, TokenKind.EOF);
			assertThat(tokens.get(1).value()).isEqualTo("https://example.org");
		}

		@Test
		void urlWithLinkText() {
			Token link = tokenize("https://example.org[the site]").get(0);
			assertThat(link.kind()).isEqualTo(TokenKind.LINK);
			assertThat(link.value()).isEqualTo("https://example.org");
			assertThat(link.attrlist()).isEqualTo("the site");
		}

		@Test
		void inlineMacro() {
			Token macro = tokenize("Press kbd:[Ctrl+C] now").get(1);
			assertThat(macro.kind()).isEqualTo(TokenKind.INLINE_MACRO);
			assertThat(macro.name()).isEqualTo("kbd");
			assertThat(macro.value()).isEmpty();
			assertThat(macro.attrlist()).isEqualTo("Ctrl+C");
		}

		@Test
		void crossReference() {
			Token xref = tokenize("see <<install,Installing>>").get(1);
			assertThat(xref.kind()).isEqualTo(TokenKind.INLINE_MACRO);
			assertThat(xref.name()).isEqualTo("xref");
			assertThat(xref.value()).isEqualTo("install");
			assertThat(xref.attrlist()).isEqualTo("Installing");
		}

		@Test
		void lineBreakNeedsLeadingSpace() {
			assertThat(kinds("end +\nnext")).containsExactly(TokenKind.WORD, TokenKind.LINE_BREAK,
					TokenKind.NEWLINE, TokenKind.WORD, TokenKind.EOF);
			assertThat(kinds("C++")).containsExactly(TokenKind.WORD, TokenKind.EOF);
		}

		@Test
		void cellSeparatorsWithStyle() {
			List<Token> tokens = tokenize("a| cell | plain");
			assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.CELL_SEPARATOR);
			assertThat(tokens.get(0).name()).isEqualTo("a");
			assertThat(tokens.get(0).value()).isEqualTo("|");
			assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.CELL_SEPARATOR);
			assertThat(tokens.get(2).name()).isNull();
		}

		@Test
		void exclamationIsASeparatorOnlyInNestedTables() {
			assertThat(kinds("Wow!")).containsExactly(TokenKind.WORD, TokenKind.EOF);
			assertThat(kinds("!===\n! x\n!===")).containsSubsequence(TokenKind.CELL_SEPARATOR, TokenKind.WORD);
		}
	}

	@Nested
	@DisplayName("Invalid characters")
	class InvalidCharacters {

		@Test
		void controlCharactersBecomeLexErrors() {
			List<Token> tokens = tokenize("ab\u0000\u0001cd");
			assertThat(tokens).extracting(Token::kind)
					.containsExactly(TokenKind.WORD, TokenKind.LEX_ERROR, TokenKind.WORD, TokenKind.EOF);
			assertThat(tokens.get(1).value()).isEqualTo("\u0000\u0001");
		}

		@Test
		void replacementCharacterIsInvalid() {
			assertThat(kinds("\uFFFD")).containsExactly(TokenKind.LEX_ERROR, TokenKind.EOF);
		}

		@Test
		void unpairedSurrogateIsInvalidButPairIsText() {
			assertThat(kinds("x\uD800y")).contains(TokenKind.LEX_ERROR);
			assertThat(kinds("\uD83D\uDE00")).containsExactly(TokenKind.WORD, TokenKind.EOF);
		}

		@Test
		void tabsAreWhitespace() {
			assertThat(kinds("a\tb")).containsExactly(TokenKind.WORD, TokenKind.WORD, TokenKind.EOF);
		}
	}

	@Test
	void rangeTokenizationKeepsAbsoluteSpans() {
		String source = "| *bold* cell\n";
		List<Token> tokens = new Tokenizer(source, 2, 13).tokenize();
		assertThat(tokens).extracting(Token::kind).containsExactly(TokenKind.FORMAT_MARK, TokenKind.WORD,
				TokenKind.FORMAT_MARK, TokenKind.WORD, TokenKind.EOF);
		assertThat(tokens.get(1).span()).isEqualTo(new Span(3, 7));
		assertThat(tokens.get(4).span()).isEqualTo(Span.at(13));
	}

	@Test
	void tokenDescriptionsAreReadable() {
		assertThat(TokenKind.BLANK_LINE.description()).isEqualTo("blank line");
		assertThat(TokenKind.HEADING.isLineLevel()).isTrue();
		assertThat(TokenKind.WORD.isLineLevel()).isFalse();
		assertThat(TokenKind.EOF.isLineEnd()).isTrue();
	}
}
