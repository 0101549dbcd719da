package org.javai.asciidoc.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import org.javai.asciidoc.ParserConfig;
import org.javai.asciidoc.ast.Block;
import org.javai.asciidoc.ast.DelimitedKind;
import org.javai.asciidoc.ast.Document;
import org.javai.asciidoc.ast.Inline;
import org.javai.asciidoc.ast.ListItem;
import org.javai.asciidoc.ast.ListKind;
import org.javai.asciidoc.ast.OrderedStyle;
import org.javai.asciidoc.ast.Span;
import org.javai.asciidoc.diag.Diagnostics;
import org.javai.asciidoc.include.IncludeResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ListParserTest {

	private Diagnostics diagnostics;

	@BeforeEach
	void setUp() {
		diagnostics = new Diagnostics();
	}

	private Document parse(String source) {
		ParserContext ctx = new ParserContext(ParserConfig.defaults(), mock(IncludeResolver.class), diagnostics);
		return new BlockParser(ctx, source).parseDocument();
	}

	private Block.ListBlock firstList(String source) {
		return (Block.ListBlock) parse(source).blocks().get(0);
	}

	private static String text(ListItem item) {
		return Inline.plainText(item.content());
	}

	@Test
	void unorderedItems() {
		Block.ListBlock list = firstList("* one\n* two\n");

		assertThat(list.kind()).isEqualTo(ListKind.UNORDERED);
		assertThat(list.style()).isNull();
		assertThat(list.marker()).isEqualTo("*");
		assertThat(list.items()).extracting(ListParserTest::text).containsExactly("one", "two");
		assertThat(list.items().get(0).span()).isEqualTo(new Span(0, 5));
		assertThat(list.span()).isEqualTo(new Span(0, 11));
		assertThat(diagnostics.isEmpty()).isTrue();
	}

	@Test
	void deeperMarkerNestsInsidePreviousItem() {
		Block.ListBlock list = firstList("* one\n* two\n** nested\n* three\n");

		assertThat(list.items()).extracting(ListParserTest::text).containsExactly("one", "two", "three");
		ListItem two = list.items().get(1);
		assertThat(two.blocks()).singleElement().isInstanceOfSatisfying(Block.ListBlock.class, nested -> {
			assertThat(nested.marker()).isEqualTo("**");
			assertThat(nested.items()).extracting(ListParserTest::text).containsExactly("nested");
		});
		assertThat(two.span().end()).isEqualTo(21);
	}

	@Test
	void orderedListInsideUnorderedItem() {
		Block.ListBlock list = firstList("* a\n. one\n. two\n* b\n");

		assertThat(list.items()).hasSize(2);
		Block.ListBlock nested = (Block.ListBlock) list.items().get(0).blocks().get(0);
		assertThat(nested.kind()).isEqualTo(ListKind.ORDERED);
		assertThat(nested.style()).isEqualTo(OrderedStyle.ARABIC);
		assertThat(nested.items()).extracting(ListParserTest::text).containsExactly("one", "two");
	}

	@Test
	void orderedStyleFromMarker() {
		assertThat(firstList("1. first\n2. second\n").style()).isEqualTo(OrderedStyle.ARABIC);
		assertThat(firstList("b. x\nc. y\n").style()).isEqualTo(OrderedStyle.LOWER_ALPHA);
		assertThat(firstList("B. x\n").style()).isEqualTo(OrderedStyle.UPPER_ALPHA);
		assertThat(firstList("iv) x\n").style()).isEqualTo(OrderedStyle.LOWER_ROMAN);
		assertThat(firstList("IV) x\n").marker()).isEqualTo("IV)");
	}

	@Test
	void orderedStyleFromAttribute() {
		Block.ListBlock list = firstList("[upperroman]\n. x\n. y\n");
		assertThat(list.style()).isEqualTo(OrderedStyle.UPPER_ROMAN);
		assertThat(list.attributes()).containsEntry("style", "upperroman");
	}

	@Test
	void itemTextContinuesOnFollowingLines() {
		Block.ListBlock list = firstList("* first line\ncontinued\n* second");
		assertThat(list.items()).extracting(ListParserTest::text).containsExactly("first line\ncontinued", "second");
	}

	@Test
	void blankLineBetweenItemsKeepsOneList() {
		Document document = parse("* a\n\n* b\n\ntext\n");

		assertThat(document.blocks()).hasSize(2);
		Block.ListBlock list = (Block.ListBlock) document.blocks().get(0);
		assertThat(list.items()).extracting(ListParserTest::text).containsExactly("a", "b");
		assertThat(document.blocks().get(1)).isInstanceOf(Block.Paragraph.class);
	}

	@Test
	void continuationAttachesBlock() {
		Block.ListBlock list = firstList("* item\n+\n----\ncode\n----\n* next\n");

		assertThat(list.items()).hasSize(2);
		ListItem item = list.items().get(0);
		assertThat(item.blocks()).singleElement().isInstanceOfSatisfying(Block.Delimited.class, listing -> {
			assertThat(listing.kind()).isEqualTo(DelimitedKind.LISTING);
			assertThat(listing.text()).isEqualTo("code");
		});
		assertThat(item.span()).isEqualTo(new Span(0, 23));
		assertThat(diagnostics.isEmpty()).isTrue();
	}

	@Test
	void eachContinuationAttachesOneBlock() {
		Block.ListBlock list = firstList("* item\n+\nfirst\n+\nsecond\n");

		assertThat(list.items()).singleElement()
				.satisfies(item -> assertThat(item.blocks()).hasSize(2).allMatch(Block.Paragraph.class::isInstance));
	}
}
