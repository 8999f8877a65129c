package cl.leychile.structure.metadata;

import cl.leychile.structure.model.DocumentDates;
import cl.leychile.structure.model.DocumentMetadata;
import cl.leychile.structure.model.NormType;
import cl.leychile.structure.sections.PreambleSections;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads identification metadata from the preamble of a norm.
 *
 * <p>Only what the text states explicitly is extracted; every field the preamble is silent about
 * stays empty.
 */
public class MetadataExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final String NUMBER_LABEL = "(?:N[°º.]*|N[ÚU]M\\.?|N[ÚU]MERO)?\\s*";

    private static final List<HeadingRule> HEADING_RULES = List.of(
            new HeadingRule(NormType.LEY, "^LEY\\s+" + NUMBER_LABEL + "(?<num>\\d[\\d.]*)"),
            new HeadingRule(NormType.DFL,
                    "^(?:DECRETO\\s+CON\\s+FUERZA\\s+DE\\s+LEY|D\\.\\s?F\\.\\s?L\\.?|DFL)\\s*" + NUMBER_LABEL
                            + "(?<num>\\d[\\d.]*(?:[-/]\\d+)?)"),
            new HeadingRule(NormType.DECRETO_LEY,
                    "^(?:DECRETO\\s+LEY|D\\.\\s?L\\.?|DL)\\s+" + NUMBER_LABEL + "(?<num>\\d[\\d.]*)"),
            new HeadingRule(NormType.DECRETO_SUPREMO,
                    "^(?:DECRETO\\s+SUPREMO|D\\.\\s?S\\.?)\\s+" + NUMBER_LABEL + "(?<num>\\d[\\d.]*)"),
            new HeadingRule(NormType.DECRETO, "^DECRETO\\s+" + NUMBER_LABEL + "(?<num>\\d[\\d.]*)"),
            new HeadingRule(NormType.NCG,
                    "^(?:NORMA\\s+DE\\s+CAR[ÁA]CTER\\s+GENERAL|N\\.?C\\.?G\\.?)\\s+" + NUMBER_LABEL + "(?<num>\\d+)"),
            new HeadingRule(NormType.INSTRUCTIVO,
                    "^INSTRUCTIVO\\s+(?:SUPERIR\\s+|SIR\\s+)?" + NUMBER_LABEL + "(?<num>\\d+)"),
            new HeadingRule(NormType.CIRCULAR, "^CIRCULAR\\s+" + NUMBER_LABEL + "(?<num>\\d+)"),
            new HeadingRule(NormType.RESOLUCION_EXENTA,
                    "^RESOLUCI[ÓO]N\\s+EXENTA\\s+" + NUMBER_LABEL + "(?<num>\\d+)"));

    private static final Pattern RESOLUCION_EXENTA = Pattern.compile(
            "RESOLUCI[ÓO]N\\s+EXENTA\\s+N[.°º]*\\s*(?<num>\\d+)", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern ORGANISM = Pattern.compile(
            "^(?:MINISTERIO|SUBSECRETAR[ÍI]A|SUPERINTENDENCIA|CONTRALOR[ÍI]A|SERVICIO|DIRECCI[ÓO]N)\\b");
    private static final Pattern MATTER = Pattern.compile(
            "^(?:MAT|REF)\\.?\\s*:\\.?\\s*(?<text>.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PUBLICATION_CUE = Pattern.compile(
            "publica|diario\\s+oficial", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern VERSION_CUE = Pattern.compile(
            "versi[óo]n|[úu]ltima\\s+modificaci[óo]n", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern COMMON_NAME = Pattern.compile(
            "(?:conocid[oa]\\s+como|denominad[oa])\\s+[\"“«](?<name>[^\"”»]+)[\"”»]",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final int MAX_ORGANISM_LENGTH = 120;

    private final SubjectVocabulary vocabulary;
    private final String defaultSource;

    public MetadataExtractor(SubjectVocabulary vocabulary, String defaultSource) {
        this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
        this.defaultSource = Objects.requireNonNull(defaultSource, "defaultSource");
    }

    public DocumentMetadata extract(PreambleSections preamble, String declaredNormType, Optional<String> declaredSource) {
        Objects.requireNonNull(preamble, "preamble");
        List<String> header = preamble.header();

        Optional<NormHeading> heading = findHeading(header);
        if (heading.isEmpty()) {
            heading = findHeading(preamble.resuelvo());
        }
        Optional<String> normType = heading.map(found -> found.type().displayName());
        if (normType.isEmpty() && declaredNormType != null && !declaredNormType.isBlank()) {
            normType = Optional.of(declaredNormType.strip());
        }
        Optional<String> number = heading.map(NormHeading::number);
        Optional<String> sourceNumber = findResolucionExenta(preamble.allLines());
        Optional<String> matter = findMatter(header);

        List<String> subjectTexts = new ArrayList<>();
        matter.ifPresent(subjectTexts::add);
        subjectTexts.addAll(titleLines(header));

        DocumentMetadata metadata = new DocumentMetadata(
                normType,
                number,
                findOrganisms(header),
                vocabulary.match(subjectTexts),
                findCommonNames(preamble.allLines()),
                findDates(header),
                declaredSource.filter(source -> !source.isBlank()).orElse(defaultSource),
                sourceNumber,
                matter);
        LOGGER.debug("Extracted metadata: type={}, number={}, organisms={}, subjects={}",
                metadata.normType().orElse("-"), metadata.number().orElse("-"),
                metadata.organisms().size(), metadata.subjects().size());
        return metadata;
    }

    /**
     * First heading line matching the ordered norm-type rules, rule order taking priority over line order.
     */
    public Optional<NormHeading> findHeading(List<String> lines) {
        for (HeadingRule rule : HEADING_RULES) {
            for (String line : lines) {
                Matcher matcher = rule.pattern().matcher(line.strip().toUpperCase(Locale.ROOT));
                if (matcher.lookingAt()) {
                    String number = matcher.group("num");
                    if (number.endsWith(".")) {
                        number = number.substring(0, number.length() - 1);
                    }
                    return Optional.of(new NormHeading(rule.type(), number));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> findResolucionExenta(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = RESOLUCION_EXENTA.matcher(line);
            if (matcher.find()) {
                return Optional.of(matcher.group("num"));
            }
        }
        return Optional.empty();
    }

    private List<String> findOrganisms(List<String> header) {
        Set<String> organisms = new LinkedHashSet<>();
        for (String line : header) {
            String stripped = line.strip();
            if (stripped.length() <= MAX_ORGANISM_LENGTH
                    && ORGANISM.matcher(stripped.toUpperCase(Locale.ROOT)).lookingAt()) {
                organisms.add(stripped);
            }
        }
        return List.copyOf(organisms);
    }

    private Optional<String> findMatter(List<String> header) {
        for (int i = 0; i < header.size(); i++) {
            Matcher matcher = MATTER.matcher(header.get(i).strip());
            if (!matcher.matches()) {
                continue;
            }
            StringBuilder matter = new StringBuilder(matcher.group("text").strip());
            for (int j = i + 1; j < header.size(); j++) {
                String next = header.get(j).strip();
                if (endsMatter(next)) {
                    break;
                }
                if (matter.length() > 0) {
                    matter.append(' ');
                }
                matter.append(next);
            }
            return matter.length() == 0 ? Optional.empty() : Optional.of(matter.toString());
        }
        return Optional.empty();
    }

    private boolean endsMatter(String line) {
        String upper = line.toUpperCase(Locale.ROOT);
        return MATTER.matcher(line).matches()
                || ORGANISM.matcher(upper).lookingAt()
                || !SpanishDates.findAll(line).isEmpty()
                || findHeading(List.of(line)).isPresent();
    }

    private List<String> titleLines(List<String> header) {
        List<String> titles = new ArrayList<>();
        for (String line : header) {
            String stripped = line.strip();
            if (stripped.chars().anyMatch(Character::isLetter) && stripped.equals(stripped.toUpperCase(Locale.ROOT))) {
                titles.add(stripped);
            }
        }
        return titles;
    }

    private List<String> findCommonNames(List<String> lines) {
        Set<String> names = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher matcher = COMMON_NAME.matcher(line);
            while (matcher.find()) {
                names.add(matcher.group("name").strip());
            }
        }
        return List.copyOf(names);
    }

    private DocumentDates findDates(List<String> header) {
        LocalDate promulgation = null;
        LocalDate publication = null;
        LocalDate version = null;
        for (String line : header) {
            List<LocalDate> dates = SpanishDates.findAll(line);
            if (dates.isEmpty()) {
                continue;
            }
            LocalDate first = dates.get(0);
            if (PUBLICATION_CUE.matcher(line).find()) {
                publication = publication == null ? first : publication;
            } else if (VERSION_CUE.matcher(line).find()) {
                version = version == null ? first : version;
            } else if (promulgation == null) {
                promulgation = first;
            }
        }
        return new DocumentDates(Optional.ofNullable(promulgation), Optional.ofNullable(publication),
                Optional.ofNullable(version));
    }

    private record HeadingRule(NormType type, Pattern pattern) {

        HeadingRule(NormType type, String regex) {
            this(type, Pattern.compile(regex));
        }
    }
}
