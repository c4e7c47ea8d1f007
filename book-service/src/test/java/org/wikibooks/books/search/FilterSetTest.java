package org.wikibooks.books.search;

import org.junit.jupiter.api.Test;
import org.wikibooks.core.model.BookField;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FilterSetTest {

	@Test
	public void testUnknownParametersAreIgnored() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of(
				"author", List.of("tolkien"),
				"limit", List.of("10"),
				"page", List.of("2"),
				"title", List.of("hobbit")
		));

		assertEquals(Map.of(BookField.AUTHOR, "tolkien"), filters.criteria());
	}

	@Test
	public void testEmptyValuesAreDropped() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of(
				"name", List.of(""),
				"isbn", List.of()
		));

		assertTrue(filters.isEmpty());
		assertSame(FilterSet.empty(), filters);
	}

	@Test
	public void testWhitespaceValuesAreKept() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of("genre", List.of("  ")));

		assertFalse(filters.isEmpty());
		assertEquals("  ", filters.criteria().get(BookField.GENRE));
	}

	@Test
	public void testFirstValueWinsForRepeatedParameters() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of("language", List.of("english", "french")));

		assertEquals("english", filters.criteria().get(BookField.LANGUAGE));
	}

	@Test
	public void testCriteriaFollowFieldOrder() {
		FilterSet filters = FilterSet.fromQueryParams(Map.of(
				"isbn", List.of("978"),
				"name", List.of("the"),
				"pages", List.of("3")
		));

		assertEquals(List.of(BookField.NAME, BookField.PAGES, BookField.ISBN),
				List.copyOf(filters.criteria().keySet()));
		assertEquals(3, filters.size());
	}

	@Test
	public void testEquality() {
		FilterSet a = FilterSet.of(Map.of(BookField.NAME, "x"));
		FilterSet b = FilterSet.fromQueryParams(Map.of("name", List.of("x")));

		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
	}
}
