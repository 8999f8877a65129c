package cl.leychile.structure.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable division or article of a parsed document.
 *
 * <p>Children hold no reference to their parent; ancestry is the {@link #contextPath()} snapshot
 * taken when the node was opened. Only articles carry an epigraph, raw lines, content and references.
 */
public record StructuralNode(
        String id,
        NodeKind kind,
        String originalLabel,
        Optional<String> number,
        Optional<String> epigraph,
        List<String> contextPath,
        List<StructuralNode> children,
        List<String> description,
        List<String> rawLines,
        List<ContentItem> content,
        List<Reference> references
) {

    public StructuralNode {
        id = requireNonBlank(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(originalLabel, "originalLabel");
        number = number == null ? Optional.empty() : number;
        epigraph = epigraph == null ? Optional.empty() : epigraph;
        contextPath = contextPath == null ? List.of() : List.copyOf(contextPath);
        children = children == null ? List.of() : List.copyOf(children);
        description = description == null ? List.of() : List.copyOf(description);
        rawLines = rawLines == null ? List.of() : List.copyOf(rawLines);
        content = content == null ? List.of() : List.copyOf(content);
        references = references == null ? List.of() : List.copyOf(references);
        if (kind == NodeKind.ARTICLE) {
            if (!children.isEmpty()) {
                throw new IllegalArgumentException("Articles cannot own structural children");
            }
            if (number.isEmpty()) {
                throw new IllegalArgumentException("Articles require a number");
            }
        } else if (epigraph.isPresent() || !rawLines.isEmpty() || !content.isEmpty() || !references.isEmpty()) {
            throw new IllegalArgumentException("Only articles own content");
        }
    }

    public static StructuralNode division(String id, NodeKind kind, String label, String number,
                                          List<String> contextPath, List<StructuralNode> children,
                                          List<String> description) {
        if (!kind.isDivision()) {
            throw new IllegalArgumentException("Not a division kind: " + kind);
        }
        return new StructuralNode(id, kind, label, Optional.ofNullable(number), Optional.empty(), contextPath,
                children, description, List.of(), List.of(), List.of());
    }

    public static StructuralNode article(String id, String label, String number,
                                         List<String> contextPath, List<String> rawLines) {
        return new StructuralNode(id, NodeKind.ARTICLE, label, Optional.of(number), Optional.empty(), contextPath,
                List.of(), List.of(), rawLines, List.of(), List.of());
    }

    public boolean isArticle() {
        return kind == NodeKind.ARTICLE;
    }

    /**
     * Attaches the segmented content of an article.
     *
     * @param articleEpigraph heading phrase that opens the article text ("Objeto"), if any
     */
    public StructuralNode withArticleContent(Optional<String> articleEpigraph, List<ContentItem> items,
                                             List<Reference> refs) {
        if (!isArticle()) {
            throw new IllegalStateException("Content can only be attached to articles: " + id);
        }
        return new StructuralNode(id, kind, originalLabel, number, articleEpigraph, contextPath, children,
                description, rawLines, items, refs);
    }

    public StructuralNode withChildren(List<StructuralNode> newChildren) {
        return new StructuralNode(id, kind, originalLabel, number, epigraph, contextPath, newChildren,
                description, rawLines, content, references);
    }

    /**
     * Ancestor labels joined the way the serializer prints them in {@code contexto}.
     */
    public String contextLabel() {
        return String.join(" > ", contextPath);
    }

    /**
     * Concatenation of all content items, falling back to the raw lines before segmentation.
     */
    public String flattenedText() {
        if (!content.isEmpty()) {
            return content.stream().map(ContentItem::text).collect(Collectors.joining(" "));
        }
        return rawLines.stream().filter(line -> !line.isBlank()).collect(Collectors.joining(" "));
    }

    /**
     * Depth-first, document-order list of this node and all its descendants.
     */
    public List<StructuralNode> flatten() {
        List<StructuralNode> nodes = new ArrayList<>();
        collect(this, nodes);
        return nodes;
    }

    private static void collect(StructuralNode node, List<StructuralNode> sink) {
        sink.add(node);
        for (StructuralNode child : node.children) {
            collect(child, sink);
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
