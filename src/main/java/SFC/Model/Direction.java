package SFC.Model;

public enum Direction {
    /** The candidate must exhibit every behavior of the original. */
    CONTAINMENT,
    /** Containment in both directions. */
    EQUIVALENCE
}
