package cl.leychile.structure.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Brings plain or markdown legal text into the line form the classifier expects.
 */
public class TextNormalizer {

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern SPACE_LIKE = Pattern.compile("[\\t\\u00A0\\u2007\\u202F\\u000B\\f]");
    private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}\\p{Cf}&&[^\\n]]");
    private static final Pattern SPACE_RUNS = Pattern.compile(" {2,}");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,6}\\s+");
    private static final Pattern MARKDOWN_QUOTE = Pattern.compile("^(?:>\\s?)+");
    private static final Pattern MARKDOWN_STRONG = Pattern.compile("^(\\*\\*|__)(.+?)\\1$");

    public List<String> normalize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String unified = LINE_BREAKS.matcher(text).replaceAll("\n");
        String[] rawLines = unified.split("\n", -1);
        List<String> lines = new ArrayList<>(rawLines.length);
        for (String raw : rawLines) {
            lines.add(normalizeLine(raw));
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    public String normalizeLine(String raw) {
        if (raw == null) {
            return "";
        }
        String line = SPACE_LIKE.matcher(raw).replaceAll(" ");
        line = CONTROL.matcher(line).replaceAll("");
        line = SPACE_RUNS.matcher(line).replaceAll(" ").strip();
        line = MARKDOWN_QUOTE.matcher(line).replaceFirst("");
        line = MARKDOWN_HEADING.matcher(line).replaceFirst("");
        var strong = MARKDOWN_STRONG.matcher(line);
        if (strong.matches()) {
            line = strong.group(2);
        }
        return line.strip();
    }
}
