package org.wikibooks.books.model;

public record ErrorResponse(String error) {}
