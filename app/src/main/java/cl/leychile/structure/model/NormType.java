package cl.leychile.structure.model;

/**
 * Kinds of norms the engine can identify, with the prefix used in canonical document ids.
 */
public enum NormType {
    LEY("Ley", "Ley"),
    DFL("Decreto con Fuerza de Ley", "DFL"),
    DECRETO_LEY("Decreto Ley", "DL"),
    DECRETO_SUPREMO("Decreto Supremo", "DS"),
    DECRETO("Decreto", "Decreto"),
    NCG("Norma de Carácter General", "NCG"),
    INSTRUCTIVO("Instructivo", "Instructivo"),
    CIRCULAR("Circular", "Circular"),
    RESOLUCION_EXENTA("Resolución Exenta", "ResEx");

    private final String displayName;
    private final String idPrefix;

    NormType(String displayName, String idPrefix) {
        this.displayName = displayName;
        this.idPrefix = idPrefix;
    }

    public String displayName() {
        return displayName;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Canonical document id such as {@code Ley-20720} or {@code Instructivo-3-2018}.
     * Dots and spaces are dropped from the number; the year is optional.
     */
    public String documentId(String number, String year) {
        String compact = number.replace(".", "").replace(" ", "").replace('/', '-');
        StringBuilder id = new StringBuilder(idPrefix).append('-').append(compact);
        if (year != null && !year.isBlank()) {
            id.append('-').append(year.strip());
        }
        return id.toString();
    }
}
