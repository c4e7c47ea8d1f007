package org.wikibooks.books.loader;

import org.wikibooks.core.model.BookRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of reading the data source: the parsed records in file order and the number of lines skipped.
 */
public record LoadResult(Path source, List<BookRecord> records, int skippedLines) {

	public LoadResult {
		records = List.copyOf(records);
	}

	public static LoadResult empty(Path source) {
		return new LoadResult(source, List.of(), 0);
	}
}
