package cl.leychile.structure.sections;

import cl.leychile.structure.classify.ClassifiedLine;
import cl.leychile.structure.classify.LineType;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits classified lines into preamble sections, body and closing.
 *
 * <p>The body starts at the first division or article header. The closing starts at the first line
 * after the last header carrying a closing formula (ANÓTESE, PUBLÍQUESE, ...) or a roman-numbered
 * resolutive directive, and runs to the end of the text. A formula inside an article followed by
 * further headers stays in the body.
 */
public class DocumentSectionSplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentSectionSplitter.class);

    private static final Pattern SECTION_MARKER = Pattern.compile(
            "^(?<marker>VISTOS?|CONSIDERANDO|RESUELVO)(?![\\p{L}])\\s*:?\\s*(?<rest>.*)$");
    private static final Pattern CLOSING_FORMULA = Pattern.compile(
            "^(?:AN[ÓO]TESE|REG[ÍI]STRESE|COMUN[ÍI]QUESE|PUBL[ÍI]QUESE|NOTIF[ÍI]QUESE|ARCH[ÍI]VESE)(?![\\p{L}])");
    private static final Pattern RESOLUTIVE_DIRECTIVE = Pattern.compile(
            "^[IVX]+\\.\\s*(?:NOTIF[ÍI]QUESE|PUBL[ÍI]QUESE|DER[ÓO]GUENSE|DER[ÓO]GASE|DISP[ÓO]NGASE|AN[ÓO]TESE"
                    + "|REG[ÍI]STRESE|COMUN[ÍI]QUESE|ARCH[ÍI]VESE)");

    public DocumentSections split(List<ClassifiedLine> lines) {
        if (lines == null || lines.isEmpty()) {
            return new DocumentSections(PreambleSections.empty(), List.of(), List.of());
        }
        int bodyStart = firstHeader(lines);
        int closingStart = bodyStart < 0 ? lines.size() : closingStart(lines, lastHeader(lines));
        int preambleEnd = bodyStart < 0 ? lines.size() : bodyStart;

        PreambleSections preamble = splitPreamble(lines.subList(0, preambleEnd));
        List<ClassifiedLine> body = bodyStart < 0 ? List.of() : lines.subList(bodyStart, closingStart);
        List<String> closing = new ArrayList<>();
        for (ClassifiedLine line : lines.subList(closingStart, lines.size())) {
            if (line.type() != LineType.BLANK) {
                closing.add(line.text());
            }
        }
        LOGGER.debug("Split {} lines: preamble={}, body={}, closing={}",
                lines.size(), preambleEnd, body.size(), closing.size());
        return new DocumentSections(preamble, body, closing);
    }

    private int firstHeader(List<ClassifiedLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).isHeader()) {
                return i;
            }
        }
        return -1;
    }

    private int lastHeader(List<ClassifiedLine> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).isHeader()) {
                return i;
            }
        }
        return -1;
    }

    private int closingStart(List<ClassifiedLine> lines, int lastHeader) {
        for (int i = lastHeader + 1; i < lines.size(); i++) {
            ClassifiedLine line = lines.get(i);
            if (line.type() != LineType.CONTENT) {
                continue;
            }
            String upper = line.text().toUpperCase(Locale.ROOT);
            if (CLOSING_FORMULA.matcher(upper).find() || RESOLUTIVE_DIRECTIVE.matcher(upper).find()) {
                return i;
            }
        }
        return lines.size();
    }

    private PreambleSections splitPreamble(List<ClassifiedLine> lines) {
        Map<PreambleSection, List<String>> sections = new EnumMap<>(PreambleSection.class);
        for (PreambleSection section : PreambleSection.values()) {
            sections.put(section, new ArrayList<>());
        }
        PreambleSection current = PreambleSection.HEADER;
        for (ClassifiedLine line : lines) {
            if (line.type() == LineType.BLANK) {
                continue;
            }
            Matcher marker = SECTION_MARKER.matcher(line.text());
            if (marker.matches()) {
                current = sectionOf(marker.group("marker"));
                String rest = marker.group("rest").strip();
                if (!rest.isEmpty()) {
                    sections.get(current).add(rest);
                }
                continue;
            }
            sections.get(current).add(line.text());
        }
        return new PreambleSections(
                sections.get(PreambleSection.HEADER),
                sections.get(PreambleSection.VISTOS),
                sections.get(PreambleSection.CONSIDERANDO),
                sections.get(PreambleSection.RESUELVO));
    }

    private PreambleSection sectionOf(String marker) {
        if (marker.startsWith("VISTO")) {
            return PreambleSection.VISTOS;
        }
        return PreambleSection.valueOf(marker);
    }
}
