package org.wikibooks.benchmarks;

import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.wikibooks.books.pagination.PageRequest;
import org.wikibooks.books.pagination.Paginator;
import org.wikibooks.books.repository.InMemoryBookRepository;
import org.wikibooks.books.search.FilterSet;
import org.wikibooks.books.search.FuzzySearchEngine;
import org.wikibooks.books.service.BookQueryService;
import org.wikibooks.core.model.BookField;
import org.wikibooks.core.model.BookRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Benchmarks for the query engine
 * Tests: single and multi-field fuzzy search, pagination, full search-then-page pipeline
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class BookQueryBenchmark {

	private static final String[] AUTHORS = {"J.R.R. Tolkien", "J.K. Rowling", "Jane Austen", "Leo Tolstoy",
			"Gabriel García Márquez", "Toni Morrison", "Haruki Murakami", "Chinua Achebe"};
	private static final String[] LANGUAGES = {"English", "French", "German", "Spanish", "Russian", "Japanese"};
	private static final String[] GENRES = {"Fantasy", "Science fiction", "Historical novel", "Mystery", "Poetry"};

	private List<BookRecord> books;
	private FuzzySearchEngine engine;
	private BookQueryService queryService;
	private FilterSet singleFilter;
	private FilterSet threeFilters;

	@Param({"10000", "100000"})
	private int datasetSize;

	@Setup(Level.Trial)
	public void setup() {
		Random random = new Random(42);
		books = new ArrayList<>(datasetSize);
		for (int i = 0; i < datasetSize; i++) {
			books.add(new BookRecord(
					"Book number " + i,
					AUTHORS[random.nextInt(AUTHORS.length)],
					LANGUAGES[random.nextInt(LANGUAGES.length)],
					GENRES[random.nextInt(GENRES.length)],
					"Publisher " + random.nextInt(200),
					String.valueOf(1800 + random.nextInt(225)),
					"Print",
					String.valueOf(50 + random.nextInt(1200)),
					"978-" + (1_000_000_000L + random.nextInt(900_000_000))
			));
		}

		engine = new FuzzySearchEngine();
		queryService = new BookQueryService(new InMemoryBookRepository(books), engine);
		singleFilter = FilterSet.of(Map.of(BookField.AUTHOR, "tolkien"));
		threeFilters = FilterSet.of(Map.of(
				BookField.AUTHOR, "j",
				BookField.LANGUAGE, "english",
				BookField.PAGES, "10"
		));

		System.out.println("=== Book Query Benchmark Setup (datasetSize=" + datasetSize + ") ===");
	}

	@Benchmark
	public void searchSingleField(Blackhole bh) {
		bh.consume(engine.search(books, singleFilter));
	}

	@Benchmark
	public void searchThreeFields(Blackhole bh) {
		bh.consume(engine.search(books, threeFilters));
	}

	@Benchmark
	public void paginateMiddlePage(Blackhole bh) {
		bh.consume(Paginator.paginate(books, new PageRequest(datasetSize / 200, 100)));
	}

	@Benchmark
	public void searchThenPage(Blackhole bh) {
		bh.consume(queryService.search(threeFilters, new PageRequest(2, 100)));
	}
}
