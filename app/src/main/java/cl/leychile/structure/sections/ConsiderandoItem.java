package cl.leychile.structure.sections;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One numbered recital of a CONSIDERANDO section ("1° Que, el artículo 54 ...").
 *
 * @param number the recital number as written
 * @param text the recital without its number prefix
 */
public record ConsiderandoItem(int number, String text) {

    private static final Pattern NUMBERED = Pattern.compile(
            "^(?<number>\\d{1,3})\\s*[.°º]+-?\\s+(?<text>(?:[Qq]ue|Asimismo)(?:[,\\s].*|$))");

    public ConsiderandoItem {
        if (number < 1) {
            throw new IllegalArgumentException("number must be positive: " + number);
        }
        Objects.requireNonNull(text, "text");
    }

    /**
     * Groups the lines of a CONSIDERANDO section into recitals. Lines before the first numbered
     * recital are dropped; an unnumbered section becomes a single recital number 1.
     */
    static List<ConsiderandoItem> parse(List<String> lines) {
        List<ConsiderandoItem> items = new ArrayList<>();
        StringBuilder unnumbered = new StringBuilder();
        Integer current = null;
        StringBuilder text = new StringBuilder();
        for (String line : lines) {
            Matcher matcher = NUMBERED.matcher(line.strip());
            if (matcher.matches()) {
                if (current != null) {
                    items.add(new ConsiderandoItem(current, text.toString()));
                }
                current = Integer.parseInt(matcher.group("number"));
                text.setLength(0);
                text.append(matcher.group("text").strip());
            } else if (current != null) {
                append(text, line);
            } else {
                append(unnumbered, line);
            }
        }
        if (current != null) {
            items.add(new ConsiderandoItem(current, text.toString()));
        } else if (unnumbered.length() > 0) {
            items.add(new ConsiderandoItem(1, unnumbered.toString()));
        }
        return items;
    }

    private static void append(StringBuilder builder, String line) {
        String stripped = line.strip();
        if (stripped.isEmpty()) {
            return;
        }
        if (builder.length() > 0) {
            builder.append(' ');
        }
        builder.append(stripped);
    }
}
