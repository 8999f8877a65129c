package cl.leychile.structure.classify;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes article numerals: digits, Latin ordinal suffixes, trailing letters and transitory markers.
 */
public final class ArticleNumbers {

    /**
     * Latin ordinal suffixes, longest first so alternations never stop at a prefix.
     */
    public static final String LATIN_SUFFIX = "terdecies|duodecies|undecies|decies|quinquies|sexies|septies"
            + "|octies|novies|nonies|qu[áa]ter|bis|ter";

    public static final String ORDINAL_WORD = "d[ée]cimo\\s+(?:primero|segundo|tercero|cuarto|quinto|sexto"
            + "|s[ée]ptimo|octavo|noveno)|primero|segundo|tercero|cuarto|quinto|sexto|s[ée]ptimo|octavo|noveno"
            + "|d[ée]cimo|und[ée]cimo|duod[ée]cimo|[úu]nico|final";

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern SPACES = Pattern.compile("\\s+");

    private ArticleNumbers() {
    }

    /**
     * Builds the normalized number, e.g. {@code ("3", "bis", null, false)} gives {@code "3 BIS"}.
     */
    public static String normalize(String numeral, String suffix, String letter, boolean transitory) {
        StringBuilder builder = new StringBuilder(numeral.strip());
        if (suffix != null && !suffix.isBlank()) {
            builder.append(' ').append(stripAccents(suffix.strip()).toUpperCase(Locale.ROOT));
        }
        if (letter != null && !letter.isBlank()) {
            builder.append(' ').append(letter.strip().toUpperCase(Locale.ROOT));
        }
        if (transitory) {
            builder.append(" TRANSITORIO");
        }
        return builder.toString();
    }

    /**
     * Upper-cases a textual ordinal keeping its accents ({@code "único"} gives {@code "ÚNICO"}).
     */
    public static String ordinal(String word, boolean transitory) {
        String normalized = SPACES.matcher(word.strip()).replaceAll(" ").toUpperCase(Locale.ROOT);
        return transitory ? normalized + " TRANSITORIO" : normalized;
    }

    public static String stripAccents(String value) {
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        return Normalizer.normalize(DIACRITICS.matcher(decomposed).replaceAll(""), Normalizer.Form.NFC);
    }
}
