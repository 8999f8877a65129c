package cl.leychile.structure.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Already materialized text of one legal document plus what the caller declares about it.
 */
public record DocumentInput(String documentId,
                            String declaredNormType,
                            String text,
                            Optional<String> source,
                            DeclaredTotals declaredTotals) {

    public DocumentInput {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        Objects.requireNonNull(declaredNormType, "declaredNormType");
        Objects.requireNonNull(text, "text");
        source = source == null ? Optional.empty() : source;
        declaredTotals = declaredTotals == null ? DeclaredTotals.none() : declaredTotals;
    }

    public static DocumentInput of(String documentId, String declaredNormType, String text) {
        return new DocumentInput(documentId, declaredNormType, text, Optional.empty(), DeclaredTotals.none());
    }
}
