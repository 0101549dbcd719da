package org.javai.asciidoc.include;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemIncludeResolverTest {

	@TempDir
	Path dir;

	private final IncludeResolver resolver = new FileSystemIncludeResolver();

	@Test
	void readsUtf8() throws IOException {
		Path file = dir.resolve("part.adoc");
		Files.writeString(file, "Caf\u00e9 au lait\n", StandardCharsets.UTF_8);

		assertThat(resolver.read(file)).isEqualTo("Caf\u00e9 au lait\n");
	}

	@Test
	void malformedBytesBecomeReplacementCharacters() throws IOException {
		Path file = dir.resolve("broken.adoc");
		Files.write(file, new byte[] {'a', (byte) 0xC3, 'b'});

		assertThat(resolver.read(file)).isEqualTo("a\uFFFDb");
	}

	@Test
	void missingFile() {
		Path file = dir.resolve("missing.adoc");
		assertThatThrownBy(() -> resolver.read(file))
				.isInstanceOf(IOException.class)
				.hasMessage("Not a regular file: " + file);
	}

	@Test
	void directoryIsRejected() {
		assertThatThrownBy(() -> resolver.read(dir))
				.isInstanceOf(IOException.class)
				.hasMessageStartingWith("Not a regular file: ");
	}
}
