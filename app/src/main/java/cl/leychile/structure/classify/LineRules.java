package cl.leychile.structure.classify;

import cl.leychile.structure.model.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered classification tables. The first rule that matches a line wins, so the list order is the
 * priority order: division headers, article headers, inciso markers, letter markers.
 */
public final class LineRules {

    private static final String DIVISION_ORDINAL = "PRIMER[OA]|SEGUND[OA]|TERCER[OA]|CUART[OA]|QUINT[OA]|SEXT[OA]"
            + "|S[ÉE]PTIM[OA]|OCTAV[OA]|NOVEN[OA]|UND[ÉE]CIM[OA]|DUOD[ÉE]CIM[OA]|D[ÉE]CIM[OA]|[ÚU]NIC[OA]"
            + "|PRELIMINAR|FINAL";
    private static final String DIVISION_NUMERAL = "(?<numeral>" + DIVISION_ORDINAL + "|[IVXLCDM]+|\\d+)\\s*[º°ª]?";
    private static final String BOUNDARY = "(?=$|[\\s.:,;\\-–—)])";

    private static final String ARTICLE_PREFIX = "^(?:Art[íi]culo|ART[ÍI]CULO|Art\\.|ART\\.)\\s*";
    private static final String LATIN = "(?iu:" + ArticleNumbers.LATIN_SUFFIX + ")(?!\\p{L})";
    private static final String TRANSITORY = "(?iu:transitori[oa])(?!\\p{L})";

    private static final List<LineRule> DIVISION_RULES = List.of(
            division("division.book", NodeKind.BOOK, "^LIBRO\\s+"),
            division("division.title", NodeKind.TITLE, "^T[ÍI]TULO\\s+"),
            division("division.chapter", NodeKind.CHAPTER, "^CAP[ÍI]TULO\\s+"),
            division("division.paragraph", NodeKind.PARAGRAPH_DIVISION, "^P[ÁA]RRAFO\\s+"),
            new LineRule("division.paragraph-sign", LineType.DIVISION_HEADER, Optional.of(NodeKind.PARAGRAPH_DIVISION),
                    Pattern.compile("^§\\s*(?<numeral>[IVXLCDM]+|\\d+)\\s*[º°]?" + BOUNDARY),
                    true, LineRules::divisionNumeral),
            division("division.section", NodeKind.SECTION, "^SECCI[ÓO]N\\s+"));

    private static final List<LineRule> ARTICLE_RULES = List.of(
            article("article.ordinal",
                    ARTICLE_PREFIX + "(?<word>(?iu:" + ArticleNumbers.ORDINAL_WORD + "))(?!\\p{L})"
                            + "(?<transitory>\\s+" + TRANSITORY + ")?",
                    matcher -> ArticleNumbers.ordinal(matcher.group("word"), matcher.group("transitory") != null)),
            article("article.numbered-transitory",
                    ARTICLE_PREFIX + "(?<num>\\d+)\\s*[º°]?\\s*(?:(?<suffix>" + LATIN + ")\\s*[º°]?\\s*)?" + TRANSITORY,
                    matcher -> ArticleNumbers.normalize(matcher.group("num"), matcher.group("suffix"), null, true)),
            article("article.transitory",
                    ARTICLE_PREFIX + TRANSITORY,
                    matcher -> "TRANSITORIO"),
            article("article.letter",
                    ARTICLE_PREFIX + "(?<num>\\d+)\\s*[º°]?\\s*[\\-–—]?\\s*(?<letter>[A-ZÑ])\\s*[º°]?\\s*(?=[.\\-–—])",
                    matcher -> ArticleNumbers.normalize(matcher.group("num"), null, matcher.group("letter"), false)),
            article("article.numbered",
                    ARTICLE_PREFIX + "(?<num>\\d+)(?!\\d)\\s*[º°]?\\s*(?:(?<suffix>" + LATIN + "))?",
                    matcher -> ArticleNumbers.normalize(matcher.group("num"), matcher.group("suffix"), null, false)));

    private static final List<LineRule> MARKER_RULES = List.of(
            new LineRule("inciso.parenthesis", LineType.INCISO, Optional.empty(),
                    Pattern.compile("^(?<num>\\d{1,3})\\s*[°º]?\\s*\\)"),
                    false, matcher -> matcher.group("num")),
            new LineRule("inciso.period", LineType.INCISO, Optional.empty(),
                    Pattern.compile("^(?<num>\\d{1,3})\\s*[°º]?\\.[\\-–]?(?=\\s|$)"),
                    false, matcher -> matcher.group("num")),
            new LineRule("letter.parenthesis", LineType.LETTER, Optional.empty(),
                    Pattern.compile("^(?<letter>[a-zñáéíóú])\\)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                    false, matcher -> matcher.group("letter").toLowerCase(Locale.ROOT)));

    private static final List<LineRule> BODY_RULES = concat(DIVISION_RULES, ARTICLE_RULES, MARKER_RULES);

    private LineRules() {
    }

    /**
     * Full body table in priority order.
     */
    public static List<LineRule> defaultRules() {
        return BODY_RULES;
    }

    public static List<LineRule> divisionRules() {
        return DIVISION_RULES;
    }

    public static List<LineRule> articleRules() {
        return ARTICLE_RULES;
    }

    /**
     * Inciso and letter rules, shared with the article segmenter.
     */
    public static List<LineRule> markerRules() {
        return MARKER_RULES;
    }

    private static LineRule division(String name, NodeKind kind, String keyword) {
        Pattern pattern = Pattern.compile(keyword + DIVISION_NUMERAL + BOUNDARY);
        return new LineRule(name, LineType.DIVISION_HEADER, Optional.of(kind), pattern, true, LineRules::divisionNumeral);
    }

    private static LineRule article(String name, String regex, Function<Matcher, String> numberExtractor) {
        return new LineRule(name, LineType.ARTICLE_HEADER, Optional.of(NodeKind.ARTICLE), Pattern.compile(regex),
                false, numberExtractor);
    }

    private static String divisionNumeral(Matcher matcher) {
        return matcher.group("numeral").toUpperCase(Locale.ROOT);
    }

    @SafeVarargs
    private static List<LineRule> concat(List<LineRule>... tables) {
        List<LineRule> all = new ArrayList<>();
        for (List<LineRule> table : tables) {
            all.addAll(table);
        }
        return List.copyOf(all);
    }
}
