package org.wikibooks.books.search;

import org.wikibooks.core.model.BookField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Field filters of a search request, keyed by {@link BookField} in declaration order.
 *
 * <p>Only the nine known fields can appear. Empty query strings are dropped since they would match every
 * record anyway; whitespace is kept as a real substring.</p>
 */
public final class FilterSet {
	private static final FilterSet EMPTY = new FilterSet(new EnumMap<>(BookField.class));

	private final Map<BookField, String> criteria;

	private FilterSet(EnumMap<BookField, String> criteria) {
		this.criteria = Collections.unmodifiableMap(criteria);
	}

	public static FilterSet empty() {
		return EMPTY;
	}

	public static FilterSet of(Map<BookField, String> criteria) {
		EnumMap<BookField, String> copy = new EnumMap<>(BookField.class);
		criteria.forEach((field, query) -> {
			if (query != null && !query.isEmpty()) {
				copy.put(field, query);
			}
		});
		return copy.isEmpty() ? EMPTY : new FilterSet(copy);
	}

	/**
	 * Builds a filter set from raw query parameters. Unknown parameter names are ignored; when a parameter is
	 * repeated, its first value wins.
	 */
	public static FilterSet fromQueryParams(Map<String, List<String>> params) {
		EnumMap<BookField, String> criteria = new EnumMap<>(BookField.class);
		params.forEach((name, values) -> BookField.fromKey(name).ifPresent(field -> {
			if (values != null && !values.isEmpty()) {
				criteria.put(field, values.get(0));
			}
		}));
		return of(criteria);
	}

	public Map<BookField, String> criteria() {
		return criteria;
	}

	public boolean isEmpty() {
		return criteria.isEmpty();
	}

	public int size() {
		return criteria.size();
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof FilterSet other && criteria.equals(other.criteria);
	}

	@Override
	public int hashCode() {
		return criteria.hashCode();
	}

	@Override
	public String toString() {
		return "FilterSet" + criteria;
	}
}
