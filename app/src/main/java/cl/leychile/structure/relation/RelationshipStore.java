package cl.leychile.structure.relation;

import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyState;
import cl.leychile.structure.model.VigencyUpdate;
import java.util.List;

/**
 * Corpus-wide record of documents, their vigency and the edges between them.
 *
 * <p>Implementations must serialize mutations that touch the same target document.
 */
public interface RelationshipStore {

    void registerDocument(String documentId);

    boolean isKnown(String documentId);

    /**
     * Applies a vigency change. A state never moves back to a weaker one.
     */
    void upsertVigency(VigencyUpdate update);

    /**
     * Records an edge; returns {@code false} when an equal edge was already present.
     */
    boolean addEdge(RelationshipEdge edge);

    /**
     * Edges in which the document is either source or target.
     */
    List<RelationshipEdge> getEdges(String documentId);

    VigencyState vigencyOf(String documentId);

    List<String> vigencyNotes(String documentId);
}
