package cl.leychile.structure.model;

/**
 * Structural levels of a legal text, ordered by precedence.
 */
public enum NodeKind {
    BOOK(6, "Libro"),
    TITLE(5, "Título"),
    CHAPTER(4, "Capítulo"),
    PARAGRAPH_DIVISION(3, "Párrafo"),
    SECTION(2, "Sección"),
    ARTICLE(1, "Artículo");

    private final int level;
    private final String displayName;

    NodeKind(int level, String displayName) {
        this.level = level;
        this.displayName = displayName;
    }

    public int level() {
        return level;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isDivision() {
        return this != ARTICLE;
    }

    /**
     * Whether a node of this kind may contain a node of {@code child} kind.
     */
    public boolean mayContain(NodeKind child) {
        return isDivision() && child.level < level;
    }
}
