package org.wikibooks.books.pagination;

/**
 * Validated page number (1-based) and page size.
 */
public record PageRequest(int page, int limit) {
	public static final int DEFAULT_PAGE = 1;

	public PageRequest {
		if (page < 1) {
			throw new IllegalArgumentException("page must be positive: " + page);
		}
		if (limit < 1) {
			throw new IllegalArgumentException("limit must be positive: " + limit);
		}
	}

	/**
	 * Parses raw query parameters. Missing, non-integer or non-positive values fall back to the defaults;
	 * a limit above {@code maxLimit} is clamped to it.
	 *
	 * @param rawPage the {@code page} parameter, may be {@code null}
	 * @param rawLimit the {@code limit} parameter, may be {@code null}
	 * @param defaultLimit page size used when {@code rawLimit} is unusable
	 * @param maxLimit largest page size served
	 */
	public static PageRequest parse(String rawPage, String rawLimit, int defaultLimit, int maxLimit) {
		int page = positiveOrDefault(rawPage, DEFAULT_PAGE);
		int limit = Math.min(positiveOrDefault(rawLimit, defaultLimit), maxLimit);
		return new PageRequest(page, limit);
	}

	private static int positiveOrDefault(String raw, int fallback) {
		if (raw == null || raw.isBlank()) {
			return fallback;
		}
		try {
			int value = Integer.parseInt(raw.trim());
			return value > 0 ? value : fallback;
		} catch (NumberFormatException e) {
			return fallback;
		}
	}
}
