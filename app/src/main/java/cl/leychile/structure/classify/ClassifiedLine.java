package cl.leychile.structure.classify;

import cl.leychile.structure.model.NodeKind;
import java.util.Objects;
import java.util.Optional;

/**
 * A normalized line together with the rule that classified it and the groups that rule captured.
 *
 * @param lineNumber zero-based position in the normalized document
 * @param text the normalized line, verbatim
 * @param type structural role
 * @param rule name of the matching rule, {@code "blank"} or {@code "content"} for the fallbacks
 * @param kind division or article kind for header lines
 * @param number normalized numeral, article number, inciso number or letter
 * @param remainder text following the captured header or marker
 */
public record ClassifiedLine(int lineNumber,
                             String text,
                             LineType type,
                             String rule,
                             Optional<NodeKind> kind,
                             Optional<String> number,
                             String remainder) {

    public ClassifiedLine {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("lineNumber must not be negative");
        }
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(rule, "rule");
        kind = kind == null ? Optional.empty() : kind;
        number = number == null ? Optional.empty() : number;
        remainder = remainder == null ? "" : remainder;
    }

    public static ClassifiedLine blank(int lineNumber, String text) {
        return new ClassifiedLine(lineNumber, text, LineType.BLANK, "blank", Optional.empty(), Optional.empty(), "");
    }

    public static ClassifiedLine content(int lineNumber, String text) {
        return new ClassifiedLine(lineNumber, text, LineType.CONTENT, "content", Optional.empty(), Optional.empty(), text);
    }

    public boolean isHeader() {
        return type.isHeader();
    }
}
