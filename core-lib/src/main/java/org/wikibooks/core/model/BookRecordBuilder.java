package org.wikibooks.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Collects field values by {@link BookField} and produces an immutable {@link BookRecord}.
 */
public final class BookRecordBuilder {
    private final Map<BookField, String> values = new EnumMap<>(BookField.class);

    public BookRecordBuilder set(BookField field, String value) {
        if (value == null) {
            values.remove(field);
        } else {
            values.put(field, value);
        }
        return this;
    }

    public BookRecord build() {
        return new BookRecord(
                values.get(BookField.NAME),
                values.get(BookField.AUTHOR),
                values.get(BookField.LANGUAGE),
                values.get(BookField.GENRE),
                values.get(BookField.PUBLISHER),
                values.get(BookField.RELEASE_DATE),
                values.get(BookField.MEDIA_TYPE),
                values.get(BookField.PAGES),
                values.get(BookField.ISBN)
        );
    }
}
