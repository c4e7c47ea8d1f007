package org.wikibooks.books.pagination;

import java.util.List;

/**
 * One page cut out of a larger sequence, with the size of that sequence and the resulting page count.
 */
public record PageSlice<T>(List<T> items, int total, int totalPages) {}
