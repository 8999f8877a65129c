package cl.leychile.structure.sections;

/**
 * Marker-delimited blocks of a preamble.
 */
public enum PreambleSection {
    HEADER,
    VISTOS,
    CONSIDERANDO,
    RESUELVO;

    /**
     * Whether sentences of this section that carry no resolutive verb count as citations.
     */
    public boolean citesByDefault() {
        return this == VISTOS || this == CONSIDERANDO;
    }
}
