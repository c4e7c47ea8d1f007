package org.wikibooks.books.search;

import org.junit.jupiter.api.Test;
import org.wikibooks.core.model.BookField;
import org.wikibooks.core.model.BookRecord;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.wikibooks.books.TestBooks.*;

public class FuzzySearchEngineTest {

	private final FuzzySearchEngine engine = new FuzzySearchEngine();

	@Test
	public void testMatchIsCaseInsensitiveSubstring() {
		FilterSet filters = FilterSet.of(Map.of(BookField.NAME, "harry"));

		assertTrue(engine.matches(HARRY_POTTER, filters));
		assertFalse(engine.matches(THE_HOBBIT, filters));
		assertTrue(engine.matches(HARRY_POTTER, FilterSet.of(Map.of(BookField.NAME, "SORCERER'S STONE"))));
	}

	@Test
	public void testAllFiltersMustMatch() {
		FilterSet filters = FilterSet.of(Map.of(
				BookField.AUTHOR, "tolkien",
				BookField.LANGUAGE, "english"
		));

		for (BookRecord book : sample()) {
			boolean expected = book.author() != null && book.author().toLowerCase().contains("tolkien")
					&& book.language() != null && book.language().toLowerCase().contains("english");
			assertEquals(expected, engine.matches(book, filters), book.toString());
		}

		FilterSet contradictory = FilterSet.of(Map.of(
				BookField.AUTHOR, "tolkien",
				BookField.LANGUAGE, "french"
		));
		assertTrue(engine.search(sample(), contradictory).isEmpty());
	}

	@Test
	public void testMissingFieldNeverMatches() {
		FilterSet filters = FilterSet.of(Map.of(BookField.ISBN, "978"));

		assertFalse(engine.matches(LORD_OF_THE_RINGS, filters));
		assertEquals(List.of(THE_HOBBIT), engine.search(sample(), filters));
	}

	@Test
	public void testSpaceIsARealSubstring() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of("name", List.of(" ")));

		List<BookRecord> matches = engine.search(sample(), filters);

		assertFalse(matches.contains(UNTITLED));
		assertEquals(List.of(HARRY_POTTER, THE_HOBBIT, LORD_OF_THE_RINGS, LE_PETIT_PRINCE), matches);
	}

	@Test
	public void testNumericFieldsMatchAsText() {
		FilterSet filters = FilterSet.of(Map.of(BookField.PAGES, "10"));

		List<BookRecord> matches = engine.search(sample(), filters);

		assertEquals(List.of(THE_HOBBIT, UNTITLED), matches);
	}

	@Test
	public void testEmptyFilterSetMatchesEverything() {
		assertEquals(sample(), engine.search(sample(), FilterSet.empty()));
		assertTrue(engine.matches(UNTITLED, FilterSet.empty()));
	}

	@Test
	public void testResultsKeepSourceOrder() {
		FilterSet filters = FilterSet.of(Map.of(BookField.GENRE, "FANTASY"));

		assertEquals(List.of(HARRY_POTTER, THE_HOBBIT, LORD_OF_THE_RINGS), engine.search(sample(), filters));
	}

	@Test
	public void testNonAsciiText() {
		FilterSet filters = FilterSet.of(Map.of(BookField.AUTHOR, "EXUPÉRY"));

		assertEquals(List.of(LE_PETIT_PRINCE), engine.search(sample(), filters));
	}
}
