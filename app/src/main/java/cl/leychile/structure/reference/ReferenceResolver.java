package cl.leychile.structure.reference;

import cl.leychile.structure.classify.ArticleNumbers;
import cl.leychile.structure.model.Reference;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts explicit article references from article text.
 *
 * <p>A reference without a recognizable target norm points at the same document. A reference whose
 * target is an administrative instrument or an institution, or a named norm that cannot be
 * identified, produces nothing.
 */
public class ReferenceResolver {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    private static final String LETTER = "(?:\\s*[-–]?\\s*(?-i:[A-ZÑ])(?![\\p{L}°º]))";
    private static final String TRANSITORY = "(?:\\s+transitori[oa](?!\\p{L}))";
    private static final String NUM = "(?:\\d+(?:\\s*[º°])?(?:\\s*(?:" + ArticleNumbers.LATIN_SUFFIX + ")(?!\\p{L}))?"
            + LETTER + "?|(?:" + ArticleNumbers.ORDINAL_WORD + ")(?!\\p{L}))" + TRANSITORY + "?";
    private static final String SEPARATOR = "(?:\\s*,\\s*(?:y\\s+)?|\\s+[yeo]\\s+)";

    private static final Pattern ARTICLE_MENTION = Pattern.compile(
            "(?<!\\p{L})(?:art[íi]culos?|arts?\\.)\\s*(?<list>" + NUM + "(?:" + SEPARATOR + NUM + ")*)"
                    + "(?<plural>\\s+transitori[oa]s(?!\\p{L}))?"
                    + "(?<following>\\s+y\\s+siguientes)?", FLAGS);
    private static final Pattern NUMBER_PART = Pattern.compile(
            "(?:(?<num>\\d+)(?:\\s*[º°])?(?:\\s*(?<suffix>" + ArticleNumbers.LATIN_SUFFIX + ")(?!\\p{L}))?"
                    + "(?:\\s*[-–]?\\s*(?<letter>(?-i:[A-ZÑ]))(?![\\p{L}°º]))?"
                    + "|(?<word>" + ArticleNumbers.ORDINAL_WORD + ")(?!\\p{L}))"
                    + "(?<transitory>" + TRANSITORY + ")?", FLAGS);

    private static final Pattern CONNECTOR = Pattern.compile("^\\s*,?\\s*(?:de\\s+la|de\\s+las|de\\s+los|del|de)\\s+", FLAGS);
    private static final Pattern SELF_TARGET = Pattern.compile(
            "^(?:(?:la\\s+|el\\s+)?(?:presente|esta|este|mism[oa])\\s+(?:ley|norma|resoluci[óo]n|instructivo|circular"
                    + "|decreto|reglamento|c[óo]digo|cuerpo\\s+legal))(?!\\p{L})", FLAGS);
    private static final Pattern EXCLUDED_TARGET = Pattern.compile(
            "^(?:oficio|circular|memor[áa]ndum|carta|dictamen|superintendencia|ministerio|servicio|contralor[íi]a"
                    + "|direcci[óo]n|tesorer[íi]a|tribunal|corte)(?!\\p{L})", FLAGS);
    private static final Pattern CODE_TARGET = Pattern.compile(
            "^C[óo]digo(?:\\s+(?:de\\s+|del\\s+)?\\p{Lu}\\p{L}*)+");
    private static final Pattern NAMED_TARGET = Pattern.compile("^\\p{Lu}");

    public List<Reference> resolve(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<Reference> references = new LinkedHashSet<>();
        Matcher matcher = ARTICLE_MENTION.matcher(text);
        while (matcher.find()) {
            Optional<String> target = target(text, matcher.end());
            if (target.isEmpty()) {
                continue;
            }
            List<String> numbers = numbers(matcher.group("list"), matcher.group("plural") != null);
            if (matcher.group("following") != null) {
                numbers = numbers.subList(0, 1);
            }
            for (String number : numbers) {
                references.add(new Reference(number, target.get()));
            }
        }
        return List.copyOf(references);
    }

    /**
     * Target norm of a reference ending at {@code offset}; empty when the reference must be dropped.
     */
    private Optional<String> target(String text, int offset) {
        String tail = text.substring(offset);
        Matcher connector = CONNECTOR.matcher(tail);
        if (!connector.find()) {
            return Optional.of(Reference.SELF);
        }
        String named = tail.substring(connector.end());
        if (SELF_TARGET.matcher(named).lookingAt()) {
            return Optional.of(Reference.SELF);
        }
        if (EXCLUDED_TARGET.matcher(named).lookingAt()) {
            return Optional.empty();
        }
        Matcher code = CODE_TARGET.matcher(named);
        if (code.lookingAt()) {
            return Optional.of("Código" + code.group().substring("Código".length()));
        }
        Optional<NormMention> mention = NormCitations.at(text, offset + connector.end());
        if (mention.isPresent()) {
            return Optional.of(mention.get().label());
        }
        if (NAMED_TARGET.matcher(named).lookingAt()) {
            return Optional.empty();
        }
        return Optional.of(Reference.SELF);
    }

    /**
     * Normalized numbers of an enumeration, the way the line classifier numbers article headers.
     *
     * @param allTransitory whether a plural "transitorios" closes the enumeration
     */
    private List<String> numbers(String list, boolean allTransitory) {
        List<String> numbers = new ArrayList<>();
        Matcher part = NUMBER_PART.matcher(list);
        while (part.find()) {
            boolean transitory = allTransitory || part.group("transitory") != null;
            if (part.group("word") != null) {
                numbers.add(ArticleNumbers.ordinal(part.group("word"), transitory));
            } else {
                numbers.add(ArticleNumbers.normalize(part.group("num"), part.group("suffix"), part.group("letter"),
                        transitory));
            }
        }
        return numbers;
    }
}
