package org.wikibooks.books;

import org.wikibooks.books.bootstrap.BookBootstrap;

public class BookServiceApp {
    public static void main(String[] args) {
        BookBootstrap.run();
    }
}
