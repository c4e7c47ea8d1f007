package org.wikibooks.books.repository;

import org.wikibooks.core.model.BookRecord;

import java.util.List;

public interface BookRepository {
	/**
	 * All books in source order. The returned list is unmodifiable and stable for the process lifetime.
	 */
	List<BookRecord> findAll();

	/**
	 * Count total books in the store
	 */
	int count();
}
