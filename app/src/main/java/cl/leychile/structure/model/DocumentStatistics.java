package cl.leychile.structure.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Node counts of a document tree.
 */
public record DocumentStatistics(int articles, int books, int titles, int chapters, int paragraphDivisions,
                                 int sections) {

    public static DocumentStatistics of(List<StructuralNode> roots) {
        Map<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
        for (StructuralNode root : roots) {
            for (StructuralNode node : root.flatten()) {
                counts.merge(node.kind(), 1, Integer::sum);
            }
        }
        return new DocumentStatistics(
                counts.getOrDefault(NodeKind.ARTICLE, 0),
                counts.getOrDefault(NodeKind.BOOK, 0),
                counts.getOrDefault(NodeKind.TITLE, 0),
                counts.getOrDefault(NodeKind.CHAPTER, 0),
                counts.getOrDefault(NodeKind.PARAGRAPH_DIVISION, 0),
                counts.getOrDefault(NodeKind.SECTION, 0));
    }

    public int divisions() {
        return books + titles + chapters + paragraphDivisions + sections;
    }
}
