package org.javai.asciidoc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class ParserConfigTest {

	@Test
	void defaults() {
		ParserConfig config = ParserConfig.defaults();

		assertThat(config.maxIncludeDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_INCLUDE_DEPTH);
		assertThat(config.maxSectionDepth()).isEqualTo(6);
		assertThat(config.maxBlockDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_BLOCK_DEPTH);
		assertThat(config.maxInlineDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_INLINE_DEPTH);
		assertThat(config.safeMode()).isFalse();
		assertThat(config.baseDir()).isNull();
		assertThat(config.attributes()).isEmpty();
		assertThat(config.effectiveBaseDir()).isEqualTo(Path.of("").toAbsolutePath().normalize());
	}

	@Test
	void limitsAreRangeChecked() {
		assertThatThrownBy(() -> ParserConfig.builder().maxIncludeDepth(-1).build())
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("maxIncludeDepth must be non-negative");
		assertThatThrownBy(() -> ParserConfig.builder().maxSectionDepth(7).build())
				.hasMessage("maxSectionDepth must be between 1 and 6");
		assertThatThrownBy(() -> ParserConfig.builder().maxSectionDepth(0).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> ParserConfig.builder().maxBlockDepth(0).build())
				.hasMessage("maxBlockDepth must be positive");
		assertThatThrownBy(() -> ParserConfig.builder().maxInlineDepth(0).build())
				.hasMessage("maxInlineDepth must be positive");
		assertThat(ParserConfig.builder().maxIncludeDepth(0).build().maxIncludeDepth()).isZero();
	}

	@Test
	void attributeNamesAreLowerCased() {
		ParserConfig config = ParserConfig.builder()
				.attribute("Product", "Widget")
				.attribute("draft", null)
				.build();

		assertThat(config.attributes()).containsEntry("product", "Widget").containsEntry("draft", null);
		assertThat(config.attributes()).doesNotContainKey("Product");
	}

	@Test
	void toBuilderCopiesEverything() {
		ParserConfig original = ParserConfig.builder()
				.maxIncludeDepth(3)
				.maxSectionDepth(4)
				.baseDir(Path.of("docs"))
				.safeMode(true)
				.maxBlockDepth(5)
				.maxInlineDepth(7)
				.attribute("product", "Widget")
				.build();

		assertThat(original.toBuilder().build()).isEqualTo(original);
		assertThat(original.toBuilder().safeMode(false).build().safeMode()).isFalse();
		assertThat(original.effectiveBaseDir()).isAbsolute().endsWithRaw(Path.of("docs"));
	}
}
