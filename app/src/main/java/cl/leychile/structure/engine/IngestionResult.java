package cl.leychile.structure.engine;

import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.RelationshipEdge;
import java.util.List;
import java.util.Objects;

/**
 * A parsed document after its relationships were applied to the store.
 *
 * @param document parsed document
 * @param storedEdges edges as recorded, with {@code targetResolved} evaluated at apply time
 * @param newEdges number of edges the store did not hold before
 * @param diagnostics document diagnostics with unresolved targets re-evaluated at apply time
 * @param conformance mismatches against the declared totals
 */
public record IngestionResult(ParsedDocument document,
                              List<RelationshipEdge> storedEdges,
                              int newEdges,
                              List<Diagnostic> diagnostics,
                              List<Diagnostic> conformance) {

    public IngestionResult {
        Objects.requireNonNull(document, "document");
        storedEdges = storedEdges == null ? List.of() : List.copyOf(storedEdges);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        conformance = conformance == null ? List.of() : List.copyOf(conformance);
    }

    public String documentId() {
        return document.documentId();
    }
}
