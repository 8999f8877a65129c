package cl.leychile.structure.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A paragraph, numbered inciso or lettered item of an article, holding its source text.
 */
public record ContentItem(ContentItemType type, Optional<String> marker, String text) {

    public ContentItem {
        Objects.requireNonNull(type, "type");
        marker = marker == null ? Optional.empty() : marker;
        Objects.requireNonNull(text, "text");
        if (type == ContentItemType.PARAGRAPH && marker.isPresent()) {
            throw new IllegalArgumentException("Paragraphs carry no marker");
        }
        if (type != ContentItemType.PARAGRAPH && marker.isEmpty()) {
            throw new IllegalArgumentException(type + " items require a marker");
        }
    }

    public static ContentItem paragraph(String text) {
        return new ContentItem(ContentItemType.PARAGRAPH, Optional.empty(), text);
    }

    public static ContentItem inciso(String number, String text) {
        return new ContentItem(ContentItemType.INCISO, Optional.of(number), text);
    }

    public static ContentItem letter(String letter, String text) {
        return new ContentItem(ContentItemType.LETTER, Optional.of(letter), text);
    }
}
