package cl.leychile.structure.model;

/**
 * Legal force of a norm. Ordered from weakest to strongest effect of a derogation.
 */
public enum VigencyState {
    VIGENTE,
    PARCIAL,
    DEROGADO;

    /**
     * The stronger of both states; a norm is never revived by a later partial derogation.
     */
    public VigencyState merge(VigencyState other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
