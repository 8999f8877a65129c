package cl.leychile.structure.engine;

import cl.leychile.structure.model.DeclaredTotals;
import cl.leychile.structure.model.Diagnostic;
import cl.leychile.structure.model.DocumentStatistics;
import cl.leychile.structure.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Compares counted nodes against the totals a corpus declares for a document.
 */
public class ConformanceValidator {

    public List<Diagnostic> validate(ParsedDocument document, DeclaredTotals declared) {
        Objects.requireNonNull(document, "document");
        if (declared == null || declared.isEmpty()) {
            return List.of();
        }
        DocumentStatistics statistics = document.statistics();
        List<Diagnostic> mismatches = new ArrayList<>();
        check(mismatches, Diagnostic.CONFORMANCE_ARTICLES, "articles", declared.articles(), statistics.articles());
        check(mismatches, Diagnostic.CONFORMANCE_TITLES, "titles", declared.titles(), statistics.titles());
        check(mismatches, Diagnostic.CONFORMANCE_BOOKS, "books", declared.books(), statistics.books());
        check(mismatches, Diagnostic.CONFORMANCE_CHAPTERS, "chapters", declared.chapters(), statistics.chapters());
        return mismatches;
    }

    private void check(List<Diagnostic> sink, String rule, String label, OptionalInt declared, int counted) {
        if (declared.isPresent() && declared.getAsInt() != counted) {
            sink.add(Diagnostic.forDocument(rule, Severity.ERROR,
                    "Declared " + declared.getAsInt() + " " + label + " but found " + counted));
        }
    }
}
