package cl.leychile.structure.engine;

import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.DocumentMetadata;
import cl.leychile.structure.model.DocumentStatistics;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.StructuralNode;
import cl.leychile.structure.model.VigencyUpdate;
import cl.leychile.structure.sections.PreambleSections;
import cl.leychile.structure.sections.Signatory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Result of parsing one document: its tree, metadata and the relationships it declares.
 *
 * @param documentId caller supplied id
 * @param canonicalIds ids under which other documents may name this one, {@code documentId} included
 * @param declaredNormType norm type declared by the caller
 * @param metadata identification data read from the preamble
 * @param preamble preamble sections
 * @param closing closing formula lines
 * @param signatory authority signing the document, when the closing names one
 * @param nodes root nodes in document order
 * @param edges relationships towards other documents
 * @param vigencyUpdates vigency changes this document imposes on others
 * @param diagnostics structural and relationship findings
 */
public record ParsedDocument(String documentId,
                             Set<String> canonicalIds,
                             String declaredNormType,
                             DocumentMetadata metadata,
                             PreambleSections preamble,
                             List<String> closing,
                             Optional<Signatory> signatory,
                             List<StructuralNode> nodes,
                             List<RelationshipEdge> edges,
                             List<VigencyUpdate> vigencyUpdates,
                             List<Diagnostic> diagnostics) {

    public ParsedDocument {
        Objects.requireNonNull(documentId, "documentId");
        canonicalIds = canonicalIds == null ? Set.of(documentId) : Set.copyOf(canonicalIds);
        Objects.requireNonNull(declaredNormType, "declaredNormType");
        Objects.requireNonNull(metadata, "metadata");
        preamble = preamble == null ? PreambleSections.empty() : preamble;
        closing = closing == null ? List.of() : List.copyOf(closing);
        signatory = signatory == null ? Optional.empty() : signatory;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        vigencyUpdates = vigencyUpdates == null ? List.of() : List.copyOf(vigencyUpdates);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public DocumentStatistics statistics() {
        return DocumentStatistics.of(nodes);
    }

    /**
     * Every article of the tree in document order.
     */
    public List<StructuralNode> articles() {
        List<StructuralNode> articles = new ArrayList<>();
        for (StructuralNode root : nodes) {
            for (StructuralNode node : root.flatten()) {
                if (node.isArticle()) {
                    articles.add(node);
                }
            }
        }
        return articles;
    }
}
