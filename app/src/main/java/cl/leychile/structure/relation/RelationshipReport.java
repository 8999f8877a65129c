package cl.leychile.structure.relation;

import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyUpdate;
import java.util.List;

/**
 * Edges and vigency updates a document declares, plus diagnostics about their targets.
 */
public record RelationshipReport(List<RelationshipEdge> edges,
                                 List<VigencyUpdate> vigencyUpdates,
                                 List<Diagnostic> diagnostics) {

    public RelationshipReport {
        edges = edges == null ? List.of() : List.copyOf(edges);
        vigencyUpdates = vigencyUpdates == null ? List.of() : List.copyOf(vigencyUpdates);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static RelationshipReport empty() {
        return new RelationshipReport(List.of(), List.of(), List.of());
    }
}
