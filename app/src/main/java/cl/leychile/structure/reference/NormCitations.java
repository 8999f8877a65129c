package cl.leychile.structure.reference;

import cl.leychile.structure.model.NormType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds explicit mentions of numbered norms (laws, decrees, NCGs, instructivos, ...) in text.
 */
public final class NormCitations {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String LABEL = "\\s*(?:N(?:[°º]|\\.|ros?\\.?|[°º]s)?\\s*|N[úu]m(?:ero|\\.)?\\s*)?";
    private static final String NUMBER = "(?<num>\\d{1,3}(?:\\.\\d{3})+|\\d+)(?:\\s*/\\s*(?<slashYear>\\d{2,4}))?";
    private static final String YEAR = "(?:\\s*,?\\s+(?:de|del)\\s+(?:\\d{1,2}\\s+de\\s+\\p{L}+\\s+de(?:l)?\\s+)?(?:año\\s+)?(?<year>\\d{4})(?!\\d))?";

    private static final List<MentionRule> RULES = List.of(
            rule(NormType.DFL, "(?:Decreto\\s+con\\s+Fuerza\\s+de\\s+Ley|D\\.\\s?F\\.\\s?L\\.?|DFL)"),
            rule(NormType.DECRETO_LEY, "(?:Decreto\\s+Ley|D\\.\\s?L\\.|DL)"),
            rule(NormType.DECRETO_SUPREMO, "(?:Decreto\\s+Supremo|D\\.\\s?S\\.|DS)"),
            rule(NormType.DECRETO, "Decreto"),
            rule(NormType.LEY, "Ley"),
            rule(NormType.NCG, "(?:Norma\\s+de\\s+Car[áa]cter\\s+General|NCG)"),
            rule(NormType.INSTRUCTIVO, "Instructivo(?:\\s+(?:SUPERIR|SIR))?"),
            rule(NormType.CIRCULAR, "Circular"),
            rule(NormType.RESOLUCION_EXENTA, "Resoluci[óo]n\\s+Exenta"));

    private NormCitations() {
    }

    /**
     * Non-overlapping mentions in order of appearance; at one position the longest mention wins.
     */
    public static List<NormMention> findAll(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<NormMention> candidates = new ArrayList<>();
        for (MentionRule rule : RULES) {
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                candidates.add(toMention(rule.type(), matcher));
            }
        }
        candidates.sort(Comparator.comparingInt(NormMention::start)
                .thenComparing(Comparator.comparingInt(NormMention::end).reversed()));
        List<NormMention> mentions = new ArrayList<>();
        int covered = -1;
        for (NormMention candidate : candidates) {
            if (candidate.start() >= covered) {
                mentions.add(candidate);
                covered = candidate.end();
            }
        }
        return mentions;
    }

    /**
     * The mention starting exactly at {@code offset}, if any.
     */
    public static Optional<NormMention> at(String text, int offset) {
        for (NormMention mention : findAll(text)) {
            if (mention.start() == offset) {
                return Optional.of(mention);
            }
            if (mention.start() > offset) {
                break;
            }
        }
        return Optional.empty();
    }

    private static NormMention toMention(NormType type, Matcher matcher) {
        String year = matcher.group("slashYear") != null ? matcher.group("slashYear") : matcher.group("year");
        if (year != null && year.length() == 2) {
            year = null;
        }
        return new NormMention(type, matcher.group("num"), Optional.ofNullable(year), matcher.start(), matcher.end());
    }

    private static MentionRule rule(NormType type, String name) {
        return new MentionRule(type, Pattern.compile("(?<![\\p{L}.])" + name + "(?!\\p{L})" + LABEL + NUMBER + YEAR, FLAGS));
    }

    private record MentionRule(NormType type, Pattern pattern) {
    }
}
