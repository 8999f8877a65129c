package cl.leychile.structure.sections;

import java.util.ArrayList;
import java.util.List;

/**
 * Named blocks of the text that precedes the articulated body.
 *
 * @param header lines before the first section marker (organism, number, date, MAT./REF.)
 * @param vistos lines of the VISTOS section
 * @param considerando lines of the CONSIDERANDO section
 * @param resuelvo lines of the RESUELVO section
 */
public record PreambleSections(List<String> header,
                               List<String> vistos,
                               List<String> considerando,
                               List<String> resuelvo) {

    public PreambleSections {
        header = header == null ? List.of() : List.copyOf(header);
        vistos = vistos == null ? List.of() : List.copyOf(vistos);
        considerando = considerando == null ? List.of() : List.copyOf(considerando);
        resuelvo = resuelvo == null ? List.of() : List.copyOf(resuelvo);
    }

    public static PreambleSections empty() {
        return new PreambleSections(List.of(), List.of(), List.of(), List.of());
    }

    /**
     * All preamble lines in document order.
     */
    public List<String> allLines() {
        List<String> lines = new ArrayList<>(header.size() + vistos.size() + considerando.size() + resuelvo.size());
        lines.addAll(header);
        lines.addAll(vistos);
        lines.addAll(considerando);
        lines.addAll(resuelvo);
        return lines;
    }

    /**
     * Numbered recitals of the CONSIDERANDO section.
     */
    public List<ConsiderandoItem> considerandoItems() {
        return ConsiderandoItem.parse(considerando);
    }

    public boolean isEmpty() {
        return header.isEmpty() && vistos.isEmpty() && considerando.isEmpty() && resuelvo.isEmpty();
    }
}
