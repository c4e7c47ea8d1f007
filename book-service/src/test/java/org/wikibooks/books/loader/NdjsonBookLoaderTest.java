package org.wikibooks.books.loader;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.wikibooks.core.model.BookRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NdjsonBookLoaderTest {

	@TempDir
	Path tempDir;

	@Test
	public void testMalformedLinesAreSkippedAndOrderKept() throws Exception {
		Path file = tempDir.resolve("books.ndjson");
		Files.writeString(file, String.join("\n",
				"{\"name\": \"First\", \"author\": \"A\"}",
				"{not json at all",
				"{\"name\": \"Second\"}",
				"42",
				"[\"only-key\"]",
				"{\"name\": \"Third\"",
				"{\"name\": \"Fourth\"}"
		), StandardCharsets.UTF_8);

		LoadResult result = new NdjsonBookLoader(file).load();

		assertEquals(3, result.records().size());
		assertEquals(4, result.skippedLines());
		assertEquals(List.of("First", "Second", "Fourth"),
				result.records().stream().map(BookRecord::name).toList());

		System.out.println("Loader robustness test passed!");
	}

	@Test
	public void testLenientJsonLinesAreSkipped() throws Exception {
		Path file = tempDir.resolve("books.ndjson");
		Files.writeString(file, String.join("\n",
				"{\"name\": \"Valid\"}",
				"{name: Unquoted}",
				"{'name': 'PythonRepr'}",
				"{\"name\": \"Trailing\",}",
				"{\"name\": \"Twice\"} {\"name\": \"Again\"}"
		), StandardCharsets.UTF_8);

		LoadResult result = new NdjsonBookLoader(file).load();

		assertEquals(List.of("Valid"), result.records().stream().map(BookRecord::name).toList());
		assertEquals(4, result.skippedLines());
	}

	@Test
	public void testBlankLinesAreIgnoredWithoutCounting() throws Exception {
		Path file = tempDir.resolve("books.ndjson");
		Files.writeString(file, "\n{\"name\": \"Only\"}\n   \n\n", StandardCharsets.UTF_8);

		LoadResult result = new NdjsonBookLoader(file).load();

		assertEquals(1, result.records().size());
		assertEquals(0, result.skippedLines());
	}

	@Test
	public void testKeyedPairLinesUseSecondElement() throws Exception {
		Path file = tempDir.resolve("found_books_filtered.ndjson");
		Files.writeString(file,
				"[\"The_Hobbit\", {\"name\": \"The Hobbit\", \"author\": \"J.R.R. Tolkien\", \"pages\": 310}]\n",
				StandardCharsets.UTF_8);

		LoadResult result = new NdjsonBookLoader(file).load();

		BookRecord hobbit = result.records().get(0);
		assertEquals("The Hobbit", hobbit.name());
		assertEquals("J.R.R. Tolkien", hobbit.author());
		assertEquals("310", hobbit.pages());
	}

	@Test
	public void testFieldValuesAreKeptAsText() throws Exception {
		BookRecord record = NdjsonBookLoader.parseLine(
				"{\"name\": \"X\", \"pages\": 1216, \"isbn\": null, \"genre\": [\"Fantasy\", \"Adventure\"],"
						+ " \"release_date\": \"c. 1954\", \"media_type\": \"Print\", \"unknown\": \"ignored\"}");

		assertEquals("1216", record.pages());
		assertNull(record.isbn());
		assertNull(record.author());
		assertEquals("[\"Fantasy\",\"Adventure\"]", record.genre());
		assertEquals("c. 1954", record.releaseDate());
		assertEquals("Print", record.mediaType());
	}

	@Test
	public void testParseLineRejectsUnsupportedShapes() {
		assertThrows(BookFormatException.class, () -> NdjsonBookLoader.parseLine("\"just a string\""));
		assertThrows(BookFormatException.class, () -> NdjsonBookLoader.parseLine("[1, 2]"));
		assertThrows(BookFormatException.class, () -> NdjsonBookLoader.parseLine("{\"name\": "));
		assertThrows(BookFormatException.class, () -> NdjsonBookLoader.parseLine("{name: \"x\"}"));
		assertThrows(BookFormatException.class, () -> NdjsonBookLoader.parseLine("{\"name\": \"x\"} trailing"));
	}

	@Test
	public void testLeadingByteOrderMarkIsStripped() throws Exception {
		Path file = tempDir.resolve("bom.ndjson");
		Files.writeString(file, "\uFEFF{\"name\": \"Bom\"}\n", StandardCharsets.UTF_8);

		LoadResult result = new NdjsonBookLoader(file).load();

		assertEquals(1, result.records().size());
		assertEquals("Bom", result.records().get(0).name());
	}

	@Test
	public void testMissingFileYieldsEmptyCollection() throws Exception {
		LoadResult result = new NdjsonBookLoader(tempDir.resolve("absent.ndjson")).load();

		assertTrue(result.records().isEmpty());
		assertEquals(0, result.skippedLines());
	}

	@Test
	public void testEmptyFileYieldsEmptyCollection() throws Exception {
		Path file = tempDir.resolve("empty.ndjson");
		Files.createFile(file);

		assertTrue(new NdjsonBookLoader(file).load().records().isEmpty());
	}

	@Test
	public void testUnreadableSourceFails() {
		assertThrows(IOException.class, () -> new NdjsonBookLoader(tempDir).load());
	}
}
