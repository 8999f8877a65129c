package cl.leychile.structure.segment;

import cl.leychile.structure.classify.ClassifiedLine;
import cl.leychile.structure.classify.DefaultLineClassifier;
import cl.leychile.structure.classify.LineClassifier;
import cl.leychile.structure.classify.LineRules;
import cl.leychile.structure.classify.LineType;
import cl.leychile.structure.model.ContentItem;
import cl.leychile.structure.model.ContentItemType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cuts the buffered lines of an article into paragraphs, incisos and lettered items.
 */
public class ArticleSegmenter {

    private final SegmentationPolicy policy;
    private final LineClassifier markerClassifier;

    public ArticleSegmenter() {
        this(SegmentationPolicy.STRUCTURED);
    }

    public ArticleSegmenter(SegmentationPolicy policy) {
        this(policy, new DefaultLineClassifier(LineRules.markerRules()));
    }

    ArticleSegmenter(SegmentationPolicy policy, LineClassifier markerClassifier) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.markerClassifier = Objects.requireNonNull(markerClassifier, "markerClassifier");
    }

    public SegmentationPolicy policy() {
        return policy;
    }

    public List<ContentItem> segment(List<String> rawLines) {
        if (rawLines == null || rawLines.isEmpty()) {
            return List.of();
        }
        if (policy == SegmentationPolicy.SINGLE_PARAGRAPH) {
            String text = join(rawLines);
            return text.isEmpty() ? List.of() : List.of(ContentItem.paragraph(text));
        }

        List<ContentItem> items = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();
        PendingItem pending = null;
        for (int i = 0; i < rawLines.size(); i++) {
            ClassifiedLine line = markerClassifier.classify(i, rawLines.get(i));
            if (line.type() == LineType.BLANK) {
                if (pending == null) {
                    flushParagraph(paragraph, items);
                }
                continue;
            }
            if (line.type().isItemMarker()) {
                flushParagraph(paragraph, items);
                if (pending != null) {
                    items.add(pending.toItem());
                }
                pending = new PendingItem(line.type(), line.number().orElseThrow());
                if (!line.remainder().isEmpty()) {
                    pending.lines.add(line.remainder());
                }
                continue;
            }
            if (pending != null) {
                pending.lines.add(line.text());
            } else {
                paragraph.add(line.text());
            }
        }
        if (pending != null) {
            items.add(pending.toItem());
        }
        flushParagraph(paragraph, items);
        return items;
    }

    private static void flushParagraph(List<String> paragraph, List<ContentItem> items) {
        if (paragraph.isEmpty()) {
            return;
        }
        items.add(ContentItem.paragraph(join(paragraph)));
        paragraph.clear();
    }

    private static String join(List<String> lines) {
        StringBuilder builder = new StringBuilder();
        for (String line : lines) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(stripped);
        }
        return builder.toString();
    }

    private static final class PendingItem {

        private final LineType type;
        private final String marker;
        private final List<String> lines = new ArrayList<>();

        PendingItem(LineType type, String marker) {
            this.type = type;
            this.marker = marker;
        }

        ContentItem toItem() {
            ContentItemType itemType = type == LineType.INCISO ? ContentItemType.INCISO : ContentItemType.LETTER;
            return new ContentItem(itemType, Optional.of(marker), join(lines));
        }
    }
}
