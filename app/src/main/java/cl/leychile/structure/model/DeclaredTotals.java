package cl.leychile.structure.model;

import java.util.OptionalInt;

/**
 * Counts a corpus annotates a document with ({@code total_articulos}, {@code total_titulos}, ...).
 */
public record DeclaredTotals(OptionalInt articles, OptionalInt titles, OptionalInt books, OptionalInt chapters) {

    public DeclaredTotals {
        articles = articles == null ? OptionalInt.empty() : articles;
        titles = titles == null ? OptionalInt.empty() : titles;
        books = books == null ? OptionalInt.empty() : books;
        chapters = chapters == null ? OptionalInt.empty() : chapters;
    }

    public static DeclaredTotals none() {
        return new DeclaredTotals(OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty(), OptionalInt.empty());
    }

    public boolean isEmpty() {
        return articles.isEmpty() && titles.isEmpty() && books.isEmpty() && chapters.isEmpty();
    }
}
