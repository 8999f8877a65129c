package cl.leychile.structure.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Identification data of a norm. Fields not explicit in the source text stay empty.
 */
public record DocumentMetadata(
        Optional<String> normType,
        Optional<String> number,
        List<String> organisms,
        List<String> subjects,
        List<String> commonNames,
        DocumentDates dates,
        String source,
        Optional<String> sourceNumber,
        Optional<String> matter
) {

    public DocumentMetadata {
        normType = normType == null ? Optional.empty() : normType;
        number = number == null ? Optional.empty() : number;
        organisms = organisms == null ? List.of() : List.copyOf(organisms);
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        commonNames = commonNames == null ? List.of() : List.copyOf(commonNames);
        dates = dates == null ? DocumentDates.empty() : dates;
        Objects.requireNonNull(source, "source");
        sourceNumber = sourceNumber == null ? Optional.empty() : sourceNumber;
        matter = matter == null ? Optional.empty() : matter;
    }
}
