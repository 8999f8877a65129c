package cl.leychile.structure.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Short heading phrase that opens an article ("Artículo 1.- Objeto. Esta ley ...").
 *
 * <p>The phrase must start with a capital, end at the first period, hold at most six words and not
 * open like a sentence ("El", "La", "Se", ...). It is only taken when article text follows it,
 * either on the same line or on later lines.
 *
 * @param text the epigraph without its final period
 * @param bodyLines the article lines that remain once the epigraph is removed
 */
public record ArticleEpigraph(String text, List<String> bodyLines) {

    private static final int MAX_WORDS = 6;
    private static final Pattern EPIGRAPH = Pattern.compile(
            "^(?<epigraph>\\p{Lu}[^.;:()]{0,79}?)\\.(?:\\s+(?<rest>\\S.*))?$");
    private static final Pattern WORDS = Pattern.compile("\\s+");
    private static final Set<String> SENTENCE_OPENERS = Set.of(
            "el", "la", "los", "las", "lo", "un", "una", "este", "esta", "estos", "estas", "ese", "esa",
            "dicho", "dicha", "se", "en", "para", "por", "con", "sin", "a", "al", "de", "del", "que", "cuando",
            "si", "su", "sus", "no", "todo", "toda", "todos", "todas", "cada", "sobre");

    public ArticleEpigraph {
        Objects.requireNonNull(text, "text");
        bodyLines = bodyLines == null ? List.of() : List.copyOf(bodyLines);
    }

    public static Optional<ArticleEpigraph> extract(List<String> rawLines) {
        if (rawLines == null || rawLines.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = EPIGRAPH.matcher(rawLines.get(0).strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String epigraph = matcher.group("epigraph").strip();
        if (!looksLikeHeading(epigraph)) {
            return Optional.empty();
        }
        List<String> remaining = new ArrayList<>();
        String rest = matcher.group("rest");
        if (rest != null) {
            remaining.add(rest.strip());
        }
        List<String> following = rawLines.subList(1, rawLines.size());
        int start = 0;
        while (remaining.isEmpty() && start < following.size() && following.get(start).isBlank()) {
            start++;
        }
        remaining.addAll(following.subList(start, following.size()));
        if (remaining.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ArticleEpigraph(epigraph, remaining));
    }

    private static boolean looksLikeHeading(String epigraph) {
        String[] words = WORDS.split(epigraph);
        if (words.length > MAX_WORDS) {
            return false;
        }
        return !SENTENCE_OPENERS.contains(words[0].toLowerCase(Locale.ROOT));
    }
}
