package cl.leychile.structure.classify;

/**
 * Structural role of a single normalized line.
 */
public enum LineType {
    BLANK,
    DIVISION_HEADER,
    ARTICLE_HEADER,
    INCISO,
    LETTER,
    CONTENT;

    public boolean isHeader() {
        return this == DIVISION_HEADER || this == ARTICLE_HEADER;
    }

    public boolean isItemMarker() {
        return this == INCISO || this == LETTER;
    }
}
