package cl.leychile.structure.sections;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Authority that signs a norm, read from its closing lines.
 *
 * @param name the signer's name as printed, usually in capitals
 * @param title the signer's office in upper case, empty when the closing does not state it
 */
public record Signatory(String name, String title) {

    private static final String OFFICE = "(?iu:superintendent[ea]|ministr[oa]|subsecretari[oa]|fiscal|director[a]?"
            + "|president[ea]|contralor[a]?|jef[ea]|secretari[oa]|intendente)";
    private static final Pattern NAME_LINE = Pattern.compile("^[A-ZÁÉÍÓÚÑ][A-ZÁÉÍÓÚÑ.\\s]{5,}$");
    private static final Pattern TITLE_LINE = Pattern.compile("(?<!\\p{L})" + OFFICE + "(?!\\p{L})");
    private static final Pattern NAME_AND_TITLE = Pattern.compile(
            "^(?<name>[A-ZÁÉÍÓÚÑ][A-ZÁÉÍÓÚÑ.\\s]{5,}?)\\s+(?<title>" + OFFICE + "\\s.+)$");
    private static final Pattern CLOSING_WORDS = Pattern.compile(
            "AN[OÓ]TESE|PUBL[IÍ]QUESE|NOTIF[IÍ]QUESE|ARCH[IÍ]VESE|DISTRIBUCI[OÓ]N|RESUELVO|D[EÉ]JASE|DISP[OÓ]NGASE"
                    + "|REG[IÍ]STRESE|COMUN[IÍ]QUESE|DER[OÓ]GUENSE|DER[OÓ]GASE|T[OÓ]MESE");

    public Signatory {
        Objects.requireNonNull(name, "name");
        title = title == null ? "" : title;
    }

    /**
     * Looks for a capitalized name followed by an office line, then for name and office on one
     * line, then for a bare capitalized name.
     */
    public static Optional<Signatory> find(List<String> closing) {
        if (closing == null || closing.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i + 1 < closing.size(); i++) {
            String line = closing.get(i).strip();
            String next = closing.get(i + 1).strip();
            if (isName(line) && TITLE_LINE.matcher(next).find()) {
                return Optional.of(new Signatory(line, upper(next)));
            }
        }
        for (String line : closing) {
            Matcher matcher = NAME_AND_TITLE.matcher(line.strip());
            if (matcher.matches() && !CLOSING_WORDS.matcher(matcher.group("name")).find()) {
                return Optional.of(new Signatory(matcher.group("name").strip(), upper(matcher.group("title"))));
            }
        }
        for (int i = 0; i < closing.size(); i++) {
            String line = closing.get(i).strip();
            if (isName(line) && line.length() > 10 && line.split("\\s+").length >= 2) {
                String title = i + 1 < closing.size() ? upper(closing.get(i + 1)) : "";
                return Optional.of(new Signatory(line, title));
            }
        }
        return Optional.empty();
    }

    private static boolean isName(String line) {
        return NAME_LINE.matcher(line).matches() && !CLOSING_WORDS.matcher(line).find();
    }

    private static String upper(String value) {
        return value.strip().toUpperCase(Locale.ROOT);
    }
}
