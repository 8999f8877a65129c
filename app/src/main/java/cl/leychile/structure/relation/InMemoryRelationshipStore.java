package cl.leychile.structure.relation;

import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyState;
import cl.leychile.structure.model.VigencyUpdate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe store keeping everything in memory. Mutations are serialized per target document
 * through {@link ConcurrentHashMap#compute}.
 */
public class InMemoryRelationshipStore implements RelationshipStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryRelationshipStore.class);

    private final Map<String, DocumentEntry> documents = new ConcurrentHashMap<>();
    private final Map<String, Set<RelationshipEdge>> edgesByTarget = new ConcurrentHashMap<>();

    @Override
    public void registerDocument(String documentId) {
        Objects.requireNonNull(documentId, "documentId");
        documents.compute(documentId, (id, entry) -> entry == null ? DocumentEntry.registered() : entry.markKnown());
    }

    @Override
    public boolean isKnown(String documentId) {
        DocumentEntry entry = documents.get(documentId);
        return entry != null && entry.known();
    }

    @Override
    public void upsertVigency(VigencyUpdate update) {
        Objects.requireNonNull(update, "update");
        DocumentEntry updated = documents.compute(update.targetDocumentId(),
                (id, entry) -> (entry == null ? DocumentEntry.unregistered() : entry).apply(update));
        LOGGER.debug("Vigency of {} is now {} (declared by {})",
                update.targetDocumentId(), updated.state(), update.sourceDocumentId());
    }

    @Override
    public boolean addEdge(RelationshipEdge edge) {
        Objects.requireNonNull(edge, "edge");
        boolean[] added = new boolean[1];
        edgesByTarget.compute(edge.targetDocumentId(), (target, edges) -> {
            Set<RelationshipEdge> next = edges == null ? new LinkedHashSet<>() : edges;
            added[0] = next.add(edge);
            if (!added[0]) {
                refreshResolution(next, edge);
            }
            return next;
        });
        return added[0];
    }

    /**
     * Swaps the stored copy of {@code edge} for the new one when only the resolved flag differs,
     * keeping the insertion order of the other edges.
     */
    private static void refreshResolution(Set<RelationshipEdge> edges, RelationshipEdge edge) {
        boolean stale = false;
        for (RelationshipEdge stored : edges) {
            if (stored.equals(edge) && stored.targetResolved() != edge.targetResolved()) {
                stale = true;
                break;
            }
        }
        if (!stale) {
            return;
        }
        List<RelationshipEdge> ordered = new ArrayList<>(edges);
        ordered.set(ordered.indexOf(edge), edge);
        edges.clear();
        edges.addAll(ordered);
    }

    @Override
    public List<RelationshipEdge> getEdges(String documentId) {
        List<RelationshipEdge> result = new ArrayList<>();
        for (String target : edgesByTarget.keySet()) {
            edgesByTarget.computeIfPresent(target, (key, edges) -> {
                for (RelationshipEdge edge : edges) {
                    if (edge.touches(documentId)) {
                        result.add(edge);
                    }
                }
                return edges;
            });
        }
        return result;
    }

    @Override
    public VigencyState vigencyOf(String documentId) {
        DocumentEntry entry = documents.get(documentId);
        return entry == null ? VigencyState.VIGENTE : entry.state();
    }

    @Override
    public List<String> vigencyNotes(String documentId) {
        DocumentEntry entry = documents.get(documentId);
        return entry == null ? List.of() : entry.notes();
    }

    private record DocumentEntry(boolean known, VigencyState state, List<String> notes) {

        static DocumentEntry registered() {
            return new DocumentEntry(true, VigencyState.VIGENTE, List.of());
        }

        static DocumentEntry unregistered() {
            return new DocumentEntry(false, VigencyState.VIGENTE, List.of());
        }

        DocumentEntry markKnown() {
            return new DocumentEntry(true, state, notes);
        }

        DocumentEntry apply(VigencyUpdate update) {
            List<String> merged = notes;
            if (update.note().isPresent() && !notes.contains(update.note().get())) {
                merged = new ArrayList<>(notes);
                merged.add(update.note().get());
            }
            return new DocumentEntry(known, state.merge(update.newState()), List.copyOf(merged));
        }
    }
}
