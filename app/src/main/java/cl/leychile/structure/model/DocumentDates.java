package cl.leychile.structure.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Dates found in a preamble. Any of them may be absent.
 */
public record DocumentDates(Optional<LocalDate> promulgation,
                            Optional<LocalDate> publication,
                            Optional<LocalDate> version) {

    public DocumentDates {
        promulgation = promulgation == null ? Optional.empty() : promulgation;
        publication = publication == null ? Optional.empty() : publication;
        version = version == null ? Optional.empty() : version;
    }

    public static DocumentDates empty() {
        return new DocumentDates(Optional.empty(), Optional.empty(), Optional.empty());
    }
}
