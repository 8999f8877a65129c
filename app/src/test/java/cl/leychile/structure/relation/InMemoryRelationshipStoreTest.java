package cl.leychile.structure.relation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import cl.leychile.structure.model.RelationKind;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyState;
import cl.leychile.structure.model.VigencyUpdate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemoryRelationshipStoreTest {

    private final InMemoryRelationshipStore store = new InMemoryRelationshipStore();

    @Test
    void unknownDocumentsAreVigentAndUnknown() {
        assertThat(store.isKnown("Ley-20720")).isFalse();
        assertThat(store.vigencyOf("Ley-20720")).isEqualTo(VigencyState.VIGENTE);
        assertThat(store.vigencyNotes("Ley-20720")).isEmpty();
    }

    @Test
    void vigencyNeverDowngradesAndNotesAccumulate() {
        store.registerDocument("Instructivo-3-2018");
        store.upsertVigency(new VigencyUpdate("Instructivo-3-2018", VigencyState.DEROGADO, "ResEx-6597",
                Optional.of("Continúan vigentes los procedimientos en curso")));
        store.upsertVigency(new VigencyUpdate("Instructivo-3-2018", VigencyState.PARCIAL, "ResEx-7000",
                Optional.of("Salvo el artículo 4")));

        assertThat(store.vigencyOf("Instructivo-3-2018")).isEqualTo(VigencyState.DEROGADO);
        assertThat(store.vigencyNotes("Instructivo-3-2018"))
                .containsExactly("Continúan vigentes los procedimientos en curso", "Salvo el artículo 4");
        assertThat(store.isKnown("Instructivo-3-2018")).isTrue();
    }

    @Test
    void vigencyOfUnregisteredTargetDoesNotMakeItKnown() {
        store.upsertVigency(new VigencyUpdate("Circular-7-2015", VigencyState.PARCIAL, "ResEx-6597", Optional.empty()));

        assertThat(store.vigencyOf("Circular-7-2015")).isEqualTo(VigencyState.PARCIAL);
        assertThat(store.isKnown("Circular-7-2015")).isFalse();

        store.registerDocument("Circular-7-2015");

        assertThat(store.isKnown("Circular-7-2015")).isTrue();
        assertThat(store.vigencyOf("Circular-7-2015")).isEqualTo(VigencyState.PARCIAL);
    }

    @Test
    void edgesAreDeduplicatedOnSourceTargetAndKind() {
        RelationshipEdge unresolved = new RelationshipEdge("ResEx-6597", "Ley-20720", RelationKind.CITES, false);

        assertThat(store.addEdge(unresolved)).isTrue();
        assertThat(store.addEdge(unresolved.resolved(true))).isFalse();
        assertThat(store.addEdge(new RelationshipEdge("ResEx-6597", "Ley-20720", RelationKind.MODIFIES, true))).isTrue();
    }

    @Test
    void reAddingEdgeRefreshesResolvedFlagInPlace() {
        RelationshipEdge derogation = new RelationshipEdge("ResEx-6597", "Instructivo-3-2018",
                RelationKind.DEROGATES, false);
        RelationshipEdge citation = new RelationshipEdge("NCG-14", "Instructivo-3-2018", RelationKind.CITES, true);
        store.addEdge(derogation);
        store.addEdge(citation);

        store.registerDocument("Instructivo-3-2018");
        boolean added = store.addEdge(derogation.resolved(true));

        assertThat(added).isFalse();
        assertThat(store.getEdges("Instructivo-3-2018"))
                .extracting(RelationshipEdge::sourceDocumentId, RelationshipEdge::targetResolved)
                .containsExactly(tuple("ResEx-6597", true), tuple("NCG-14", true));
    }

    @Test
    void getEdgesReturnsBothDirections() {
        store.addEdge(new RelationshipEdge("ResEx-6597", "Instructivo-3-2018", RelationKind.DEROGATES, true));
        store.addEdge(new RelationshipEdge("Instructivo-3-2018", "Ley-20720", RelationKind.CITES, true));
        store.addEdge(new RelationshipEdge("NCG-14", "Ley-20720", RelationKind.CITES, true));

        assertThat(store.getEdges("Instructivo-3-2018"))
                .extracting(RelationshipEdge::sourceDocumentId, RelationshipEdge::targetDocumentId)
                .containsExactlyInAnyOrder(
                        tuple("ResEx-6597", "Instructivo-3-2018"),
                        tuple("Instructivo-3-2018", "Ley-20720"));
        assertThat(store.getEdges("Ley-20720")).hasSize(2);
        assertThat(store.getEdges("DFL-1-2005")).isEmpty();
    }

    @Test
    void concurrentWritersOnSameTargetKeepEveryDistinctEdge() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        AtomicInteger added = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < 8; writer++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        RelationshipEdge edge = new RelationshipEdge("Doc-" + i, "Ley-20720", RelationKind.CITES, true);
                        if (store.addEdge(edge)) {
                            added.incrementAndGet();
                        }
                        store.upsertVigency(new VigencyUpdate("Ley-20720",
                                i % 2 == 0 ? VigencyState.PARCIAL : VigencyState.VIGENTE, "Doc-" + i, Optional.empty()));
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(added.get()).isEqualTo(200);
        assertThat(store.getEdges("Ley-20720")).hasSize(200);
        assertThat(store.vigencyOf("Ley-20720")).isEqualTo(VigencyState.PARCIAL);
    }
}
