package cl.leychile.structure.sections;

import cl.leychile.structure.classify.ClassifiedLine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A classified document cut into preamble, articulated body and closing formula.
 */
public record DocumentSections(PreambleSections preamble, List<ClassifiedLine> body, List<String> closing) {

    public DocumentSections {
        Objects.requireNonNull(preamble, "preamble");
        body = body == null ? List.of() : List.copyOf(body);
        closing = closing == null ? List.of() : List.copyOf(closing);
    }

    public boolean hasBody() {
        return !body.isEmpty();
    }

    public Optional<Signatory> signatory() {
        return Signatory.find(closing);
    }
}
