package org.wikibooks.books.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikibooks.core.model.BookField;
import org.wikibooks.core.model.BookRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Multi-field fuzzy matching over book records.
 *
 * <p>A record matches when, for every filter, the record's field contains the query as a case-insensitive
 * substring. Filters are combined with AND. A field the record does not have never matches. Numeric fields
 * are compared by their text, so {@code pages=10} also matches {@code 100} and {@code 110}.</p>
 */
public class FuzzySearchEngine {
	private static final Logger logger = LoggerFactory.getLogger(FuzzySearchEngine.class);

	/**
	 * Tests a single record against all filters.
	 */
	public boolean matches(BookRecord book, FilterSet filters) {
		return matchesNormalized(book, normalize(filters));
	}

	/**
	 * Returns the records of {@code books} that match every filter, in their original relative order.
	 * An empty filter set returns every record.
	 */
	public List<BookRecord> search(List<BookRecord> books, FilterSet filters) {
		if (filters.isEmpty()) {
			return books;
		}

		Map<BookField, String> needles = normalize(filters);
		List<BookRecord> matches = new ArrayList<>();
		for (BookRecord book : books) {
			if (matchesNormalized(book, needles)) {
				matches.add(book);
			}
		}

		logger.debug("{} of {} books matched {}", matches.size(), books.size(), filters);
		return matches;
	}

	private static boolean matchesNormalized(BookRecord book, Map<BookField, String> needles) {
		for (Map.Entry<BookField, String> entry : needles.entrySet()) {
			String value = book.get(entry.getKey());
			if (value == null || !lower(value).contains(entry.getValue())) {
				return false;
			}
		}
		return true;
	}

	private static Map<BookField, String> normalize(FilterSet filters) {
		Map<BookField, String> needles = new EnumMap<>(BookField.class);
		filters.criteria().forEach((field, query) -> needles.put(field, lower(query)));
		return needles;
	}

	private static String lower(String text) {
		return text.toLowerCase(Locale.ROOT);
	}
}
