package cl.leychile.structure.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of a batch run: ingested documents in input order and the ids of documents that failed.
 */
public record BatchOutcome(List<IngestionResult> results, List<String> failedDocuments) {

    public BatchOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failedDocuments = List.copyOf(Objects.requireNonNull(failedDocuments, "failedDocuments"));
    }

    public int processedDocuments() {
        return results.size();
    }

    public List<String> processedDocumentIds() {
        if (results.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(results.size());
        for (IngestionResult result : results) {
            ids.add(result.documentId());
        }
        return ids;
    }
}
