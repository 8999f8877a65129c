package cl.leychile.structure.engine;

import cl.leychile.structure.model.DeclaredTotals;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.DocumentInput;
import cl.leychile.structure.model.RelationshipEdge;
import cl.leychile.structure.model.VigencyUpdate;
import cl.leychile.structure.relation.RelationshipStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses documents and applies the relationships they declare to a {@link RelationshipStore}.
 */
public class NormIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(NormIngestionService.class);

    private final NormStructureEngine engine;
    private final RelationshipStore store;
    private final ConformanceValidator validator;

    public NormIngestionService(NormStructureEngine engine, RelationshipStore store, ConformanceValidator validator) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public RelationshipStore store() {
        return store;
    }

    public ParsedDocument parse(DocumentInput input) {
        return engine.parse(input, store::isKnown);
    }

    /**
     * Registers every id of the document so that later edges towards it resolve.
     */
    public void register(ParsedDocument document) {
        for (String id : document.canonicalIds()) {
            store.registerDocument(id);
        }
    }

    public IngestionResult ingest(DocumentInput input) {
        ParsedDocument document = parse(input);
        register(document);
        return apply(document, input.declaredTotals());
    }

    /**
     * Records the document's edges and vigency updates. Target resolution is re-evaluated against
     * the store, since targets may have been registered after the document was parsed.
     */
    public IngestionResult apply(ParsedDocument document, DeclaredTotals declaredTotals) {
        Objects.requireNonNull(document, "document");
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Diagnostic diagnostic : document.diagnostics()) {
            if (!diagnostic.isUnresolvedTarget()) {
                diagnostics.add(diagnostic);
            }
        }
        List<RelationshipEdge> stored = new ArrayList<>(document.edges().size());
        int added = 0;
        for (RelationshipEdge edge : document.edges()) {
            RelationshipEdge resolved = edge.resolved(store.isKnown(edge.targetDocumentId()));
            if (store.addEdge(resolved)) {
                added++;
            }
            if (!resolved.targetResolved()) {
                diagnostics.add(Diagnostic.unresolvedTarget(resolved));
            }
            stored.add(resolved);
        }
        for (VigencyUpdate update : document.vigencyUpdates()) {
            store.upsertVigency(update);
            LOGGER.info("{} sets {} to {}", update.sourceDocumentId(), update.targetDocumentId(), update.newState());
        }
        List<Diagnostic> conformance = validator.validate(document, declaredTotals);
        for (Diagnostic mismatch : conformance) {
            LOGGER.warn("{}: {}", document.documentId(), mismatch);
        }
        return new IngestionResult(document, stored, added, diagnostics, conformance);
    }
}
