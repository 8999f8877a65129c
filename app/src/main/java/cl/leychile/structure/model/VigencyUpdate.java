package cl.leychile.structure.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Scheduled change of a target document's vigency, declared by another document.
 */
public record VigencyUpdate(String targetDocumentId,
                            VigencyState newState,
                            String sourceDocumentId,
                            Optional<String> note) {

    public VigencyUpdate {
        Objects.requireNonNull(targetDocumentId, "targetDocumentId");
        Objects.requireNonNull(newState, "newState");
        Objects.requireNonNull(sourceDocumentId, "sourceDocumentId");
        note = note == null ? Optional.empty() : note;
        if (targetDocumentId.equals(sourceDocumentId)) {
            throw new IllegalArgumentException("A document cannot change its own vigency");
        }
    }
}
