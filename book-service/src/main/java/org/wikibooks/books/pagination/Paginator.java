package org.wikibooks.books.pagination;

import java.util.List;

public final class Paginator {
	private Paginator() {}

	/**
	 * Cuts page {@code page} of size {@code limit} out of {@code items}.
	 *
	 * <p>Bounds are clamped to the sequence, so a page past the end yields an empty slice rather than an
	 * error. {@code totalPages} is {@code ceil(total / limit)}, and 0 for an empty sequence.</p>
	 */
	public static <T> PageSlice<T> paginate(List<T> items, PageRequest request) {
		int total = items.size();
		int limit = request.limit();

		long start = Math.min((long) (request.page() - 1) * limit, total);
		long end = Math.min(start + limit, total);
		int totalPages = (int) ((total + (long) limit - 1) / limit);

		return new PageSlice<>(List.copyOf(items.subList((int) start, (int) end)), total, totalPages);
	}
}
