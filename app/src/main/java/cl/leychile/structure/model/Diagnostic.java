package cl.leychile.structure.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Structured finding attached to a node (or to the whole document when {@code nodeId} is empty).
 */
public record Diagnostic(Optional<String> nodeId, String rule, Severity severity, String reason) {

    public static final String STRUCTURE_INVERSION = "STRUCTURE_INVERSION";
    public static final String DUPLICATE_ARTICLE_NUMBER = "DUPLICATE_ARTICLE_NUMBER";
    public static final String UNRESOLVED_TARGET = "UNRESOLVED_TARGET";
    public static final String EMPTY_BODY = "EMPTY_BODY";
    public static final String CONFORMANCE_ARTICLES = "CONFORMANCE_ARTICLES";
    public static final String CONFORMANCE_TITLES = "CONFORMANCE_TITLES";
    public static final String CONFORMANCE_BOOKS = "CONFORMANCE_BOOKS";
    public static final String CONFORMANCE_CHAPTERS = "CONFORMANCE_CHAPTERS";

    public Diagnostic {
        nodeId = nodeId == null ? Optional.empty() : nodeId;
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(reason, "reason");
    }

    public static Diagnostic forNode(String nodeId, String rule, Severity severity, String reason) {
        return new Diagnostic(Optional.of(nodeId), rule, severity, reason);
    }

    public static Diagnostic forDocument(String rule, Severity severity, String reason) {
        return new Diagnostic(Optional.empty(), rule, severity, reason);
    }

    public static Diagnostic unresolvedTarget(RelationshipEdge edge) {
        return forDocument(UNRESOLVED_TARGET, Severity.INFO,
                edge.kind().label() + " " + edge.targetDocumentId() + ": target not present in corpus");
    }

    public boolean isUnresolvedTarget() {
        return UNRESOLVED_TARGET.equals(rule);
    }

    @Override
    public String toString() {
        return severity + " " + rule + nodeId.map(id -> " [node " + id + "]").orElse("") + ": " + reason;
    }
}
