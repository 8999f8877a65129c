package cl.leychile.structure.relation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits legal prose into sentences on semicolons and sentence-final periods.
 *
 * <p>Consecutive lines are joined first, so a sentence wrapped over several lines stays whole. A
 * line ending in a period, semicolon or colon always closes its paragraph. Periods inside numbers
 * ({@code 18.046}), abbreviations written in capitals ({@code D.F.L.}) and the usual
 * {@code Art.}/{@code Nro.} abbreviations do not end a sentence.
 */
final class Sentences {

    private static final Pattern BOUNDARY = Pattern.compile(
            ";|(?<![Aa]rt|[Aa]rts|[Ii]nc|[Nn]ro|[Nn]ros|[Nn]úm)(?<=[\\p{Ll}\\d)\"”])\\.(?=\\s|$)");
    private static final Pattern PARAGRAPH_END = Pattern.compile("[.;:]$");

    private Sentences() {
    }

    static List<String> split(List<String> lines) {
        List<String> sentences = new ArrayList<>();
        for (String paragraph : paragraphs(lines)) {
            for (String part : BOUNDARY.split(paragraph)) {
                String sentence = part.strip();
                if (!sentence.isEmpty()) {
                    sentences.add(sentence);
                }
            }
        }
        return sentences;
    }

    static List<String> paragraphs(List<String> lines) {
        List<String> paragraphs = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String raw : lines) {
            String line = raw == null ? "" : raw.strip();
            if (line.isEmpty()) {
                flush(current, paragraphs);
                continue;
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(line);
            if (PARAGRAPH_END.matcher(line).find()) {
                flush(current, paragraphs);
            }
        }
        flush(current, paragraphs);
        return paragraphs;
    }

    private static void flush(StringBuilder current, List<String> paragraphs) {
        if (current.length() > 0) {
            paragraphs.add(current.toString());
            current.setLength(0);
        }
    }
}
