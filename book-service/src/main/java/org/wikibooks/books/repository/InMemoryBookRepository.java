package org.wikibooks.books.repository;

import org.wikibooks.core.model.BookRecord;

import java.util.List;

/**
 * Read-only store over the collection loaded at startup. Safe for any number of concurrent readers.
 */
public class InMemoryBookRepository implements BookRepository {
	private final List<BookRecord> books;

	public InMemoryBookRepository(List<BookRecord> books) {
		this.books = List.copyOf(books);
	}

	@Override
	public List<BookRecord> findAll() {
		return books;
	}

	@Override
	public int count() {
		return books.size();
	}
}
