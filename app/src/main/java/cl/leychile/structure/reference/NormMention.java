package cl.leychile.structure.reference;

import cl.leychile.structure.model.NormType;
import java.util.Objects;
import java.util.Optional;

/**
 * A norm named in running text, e.g. {@code Instructivo N° 3 de 2018}.
 *
 * @param type kind of norm
 * @param number number as written, dots included
 * @param year year given next to the number, if any
 * @param start offset of the mention in the scanned text
 * @param end offset just past the mention
 */
public record NormMention(NormType type, String number, Optional<String> year, int start, int end) {

    public NormMention {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(number, "number");
        year = year == null ? Optional.empty() : year;
    }

    /**
     * Canonical target id. Law numbers are unique, so laws never carry the year.
     */
    public String documentId() {
        return type.documentId(number, type == NormType.LEY ? null : year.orElse(null));
    }

    /**
     * Short name used as the target norm of an article reference, e.g. {@code Ley 18046}.
     */
    public String label() {
        return type.idPrefix() + " " + number.replace(".", "");
    }
}
