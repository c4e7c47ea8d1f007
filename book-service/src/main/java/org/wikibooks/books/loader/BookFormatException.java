package org.wikibooks.books.loader;

import java.io.IOException;

/**
 * Thrown when a data source line is not a book entry in one of the accepted shapes.
 */
public class BookFormatException extends IOException {
    public BookFormatException(String message) {
        super(message);
    }

    public BookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
