package cl.leychile.structure.classify;

import java.util.Objects;

/**
 * Groups captured by a {@link LineRule}: the normalized number and the remaining text.
 */
public record RuleMatch(String number, String remainder) {

    public RuleMatch {
        Objects.requireNonNull(number, "number");
        Objects.requireNonNull(remainder, "remainder");
    }
}
