package cl.leychile.structure.model;

/**
 * Directed relationship a document declares towards another norm.
 */
public enum RelationKind {
    DEROGATES("deroga"),
    MODIFIES("modifica"),
    CITES("cita");

    private final String label;

    RelationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
