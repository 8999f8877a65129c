package cl.leychile.structure.model;

import java.util.Objects;

/**
 * Directed edge between two documents.
 *
 * <p>Identity is {@code (source, target, kind)}; {@code targetResolved} only marks whether the
 * target was known to the corpus when the edge was recorded.
 */
public record RelationshipEdge(String sourceDocumentId,
                               String targetDocumentId,
                               RelationKind kind,
                               boolean targetResolved) {

    public RelationshipEdge {
        Objects.requireNonNull(sourceDocumentId, "sourceDocumentId");
        Objects.requireNonNull(targetDocumentId, "targetDocumentId");
        Objects.requireNonNull(kind, "kind");
        if (sourceDocumentId.equals(targetDocumentId)) {
            throw new IllegalArgumentException("A document cannot relate to itself: " + sourceDocumentId);
        }
    }

    public RelationshipEdge resolved(boolean resolved) {
        return new RelationshipEdge(sourceDocumentId, targetDocumentId, kind, resolved);
    }

    public boolean touches(String documentId) {
        return sourceDocumentId.equals(documentId) || targetDocumentId.equals(documentId);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RelationshipEdge edge)) {
            return false;
        }
        return sourceDocumentId.equals(edge.sourceDocumentId)
                && targetDocumentId.equals(edge.targetDocumentId)
                && kind == edge.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceDocumentId, targetDocumentId, kind);
    }
}
