package org.wikibooks.core.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of book fields that can be read from the data source and filtered on.
 *
 * <p>Each constant carries its external name (JSON key and query parameter) and an accessor, so callers
 * never look fields up by reflection.</p>
 */
public enum BookField {
    NAME("name", BookRecord::name),
    AUTHOR("author", BookRecord::author),
    LANGUAGE("language", BookRecord::language),
    GENRE("genre", BookRecord::genre),
    PUBLISHER("publisher", BookRecord::publisher),
    RELEASE_DATE("release_date", BookRecord::releaseDate),
    MEDIA_TYPE("media_type", BookRecord::mediaType),
    PAGES("pages", BookRecord::pages),
    ISBN("isbn", BookRecord::isbn);

    private static final Map<String, BookField> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BookField::key, Function.identity()));

    private final String key;
    private final Function<BookRecord, String> accessor;

    BookField(String key, Function<BookRecord, String> accessor) {
        this.key = key;
        this.accessor = accessor;
    }

    /** External name, used both as the JSON key and as the query parameter. */
    public String key() {
        return key;
    }

    public String valueOf(BookRecord record) {
        return accessor.apply(record);
    }

    /**
     * Resolves a field by its external name. Matching is exact; unknown names yield an empty result.
     */
    public static Optional<BookField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEY.get(key));
    }
}
