package org.wikibooks.core.model;

import com.google.gson.annotations.SerializedName;
import org.jetbrains.annotations.NotNull;

import java.io.Serial;
import java.io.Serializable;

/**
 * One book entry extracted from Wikipedia.
 *
 * <p>Every field is optional and kept as opaque text; numeric values such as {@code pages} are stored in
 * their textual form so they can be matched like any other field.</p>
 */
public record BookRecord(
        String name,
        String author,
        String language,
        String genre,
        String publisher,
        @SerializedName("release_date") String releaseDate,
        @SerializedName("media_type") String mediaType,
        String pages,
        String isbn
) implements Serializable {

    /**
     * Returns the value of the given field, or {@code null} when the source did not provide it.
     */
    public String get(BookField field) {
        return field.valueOf(this);
    }

    @NotNull
    @Override
    public String toString() {
        return String.format("BookRecord{name='%s', author='%s', lang='%s', isbn='%s'}",
                name, author, language, isbn);
    }

    @Serial
    private static final long serialVersionUID = 1L;
}
