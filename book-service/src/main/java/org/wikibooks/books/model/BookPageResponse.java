package org.wikibooks.books.model;

import com.google.gson.annotations.SerializedName;
import org.wikibooks.books.pagination.PageRequest;
import org.wikibooks.books.pagination.PageSlice;
import org.wikibooks.core.model.BookRecord;

import java.util.List;

public record BookPageResponse(
		List<BookRecord> data,
		int total,
		int page,
		int limit,
		@SerializedName("total_pages") int totalPages
) {
	public static BookPageResponse of(PageSlice<BookRecord> slice, PageRequest request) {
		return new BookPageResponse(
				slice.items(),
				slice.total(),
				request.page(),
				request.limit(),
				slice.totalPages()
		);
	}
}
