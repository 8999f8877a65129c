package cl.leychile.structure.model;

/**
 * Kinds of content found inside an article.
 */
public enum ContentItemType {
    PARAGRAPH,
    INCISO,
    LETTER
}
