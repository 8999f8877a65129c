package cl.leychile.structure.metadata;

import cl.leychile.structure.model.NormType;
import java.util.Objects;

/**
 * Norm type and number read from a heading line, e.g. {@code LEY NÚM. 20.720}.
 */
public record NormHeading(NormType type, String number) {

    public NormHeading {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(number, "number");
    }
}
