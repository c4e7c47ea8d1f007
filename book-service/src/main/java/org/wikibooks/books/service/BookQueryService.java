package org.wikibooks.books.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikibooks.books.model.BookPageResponse;
import org.wikibooks.books.pagination.PageRequest;
import org.wikibooks.books.pagination.Paginator;
import org.wikibooks.books.repository.BookRepository;
import org.wikibooks.books.search.FilterSet;
import org.wikibooks.books.search.FuzzySearchEngine;
import org.wikibooks.core.model.BookRecord;

import java.util.List;

/**
 * Answers listing and search queries against the book store.
 *
 * <p>Both operations read the repository's current collection on every call and never modify it, so
 * identical requests produce identical responses.</p>
 */
public class BookQueryService {
    private static final Logger logger = LoggerFactory.getLogger(BookQueryService.class);

    private final BookRepository repository;
    private final FuzzySearchEngine searchEngine;

    public BookQueryService(BookRepository repository, FuzzySearchEngine searchEngine) {
        this.repository = repository;
        this.searchEngine = searchEngine;
    }

    /**
     * One page of the full collection.
     */
    public BookPageResponse listAll(PageRequest request) {
        return page(repository.findAll(), request);
    }

    /**
     * One page of the books matching every filter. Without filters this is the same as {@link #listAll}.
     */
    public BookPageResponse search(FilterSet filters, PageRequest request) {
        if (filters.isEmpty()) {
            return listAll(request);
        }
        List<BookRecord> matches = searchEngine.search(repository.findAll(), filters);
        logger.debug("Search {} matched {} books", filters, matches.size());
        return page(matches, request);
    }

    public int totalBooks() {
        return repository.count();
    }

    private static BookPageResponse page(List<BookRecord> books, PageRequest request) {
        return BookPageResponse.of(Paginator.paginate(books, request), request);
    }
}
