package cl.leychile.structure.classify;

import cl.leychile.structure.model.NodeKind;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of an ordered classification table.
 *
 * @param name stable rule name, reported in diagnostics
 * @param type line type assigned on match
 * @param kind node kind for header rules
 * @param pattern anchored pattern tried with {@link Matcher#lookingAt()}
 * @param caseNormalized whether the pattern runs against the upper-cased line instead of the original
 * @param numberExtractor builds the normalized number from the match
 */
public record LineRule(String name,
                       LineType type,
                       Optional<NodeKind> kind,
                       Pattern pattern,
                       boolean caseNormalized,
                       Function<Matcher, String> numberExtractor) {

    private static final Pattern HEADER_SEPARATORS = Pattern.compile("^[\\s.:,;\\-–—º°ª]+");

    public LineRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        kind = kind == null ? Optional.empty() : kind;
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(numberExtractor, "numberExtractor");
        if (type.isHeader() && kind.isEmpty()) {
            throw new IllegalArgumentException("Header rule " + name + " requires a node kind");
        }
    }

    public Optional<RuleMatch> apply(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }
        String subject = caseNormalized ? line.toUpperCase(Locale.ROOT) : line;
        Matcher matcher = pattern.matcher(subject);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        // upper-casing may change the length of a few non-Spanish characters
        String base = subject.length() == line.length() ? line : subject;
        String remainder = base.substring(matcher.end());
        remainder = type.isHeader()
                ? HEADER_SEPARATORS.matcher(remainder).replaceFirst("")
                : remainder.strip();
        return Optional.of(new RuleMatch(numberExtractor.apply(matcher), remainder.strip()));
    }
}
