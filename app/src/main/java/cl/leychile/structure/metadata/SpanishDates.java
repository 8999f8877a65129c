package cl.leychile.structure.metadata;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dates written as {@code 9 de enero de 2014} (optionally preceded by {@code Santiago,}).
 */
public final class SpanishDates {

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("enero", 1),
            Map.entry("febrero", 2),
            Map.entry("marzo", 3),
            Map.entry("abril", 4),
            Map.entry("mayo", 5),
            Map.entry("junio", 6),
            Map.entry("julio", 7),
            Map.entry("agosto", 8),
            Map.entry("septiembre", 9),
            Map.entry("setiembre", 9),
            Map.entry("octubre", 10),
            Map.entry("noviembre", 11),
            Map.entry("diciembre", 12));

    private static final Pattern DATE = Pattern.compile(
            "(?<day>\\d{1,2})\\s*(?:º|°)?\\s+(?:de\\s+)?(?<month>\\p{L}+)\\s+(?:de(?:l)?\\s+)?(?:año\\s+)?(?<year>\\d{4})",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private SpanishDates() {
    }

    /**
     * Valid dates in order of appearance. Unknown month names and impossible dates are skipped.
     */
    public static List<LocalDate> findAll(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<LocalDate> dates = new ArrayList<>();
        Matcher matcher = DATE.matcher(text);
        while (matcher.find()) {
            Integer month = MONTHS.get(matcher.group("month").toLowerCase(Locale.ROOT));
            if (month == null) {
                continue;
            }
            YearMonth yearMonth = YearMonth.of(Integer.parseInt(matcher.group("year")), month);
            int day = Integer.parseInt(matcher.group("day"));
            if (yearMonth.isValidDay(day)) {
                dates.add(yearMonth.atDay(day));
            }
        }
        return dates;
    }
}
