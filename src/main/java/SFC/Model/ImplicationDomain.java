package SFC.Model;

/**
 * Integer range over which guard implication is decided by enumeration.
 * @param min - smallest value tried for every variable
 * @param max - largest value tried for every variable
 * @param maxAssignments - cap on the number of enumerated assignments
 */
public record ImplicationDomain(int min, int max, long maxAssignments) {
    public static final int DEFAULT_MIN = -2;
    public static final int DEFAULT_MAX = 4;
    public static final long DEFAULT_MAX_ASSIGNMENTS = 250_000L;

    public ImplicationDomain {
        if (max < min) {
            throw new IllegalArgumentException("Empty implication domain [" + min + ", " + max + "]");
        }
        if (maxAssignments < 1) {
            throw new IllegalArgumentException("maxAssignments must be positive: " + maxAssignments);
        }
    }

    public static ImplicationDomain defaults() {
        return new ImplicationDomain(DEFAULT_MIN, DEFAULT_MAX, DEFAULT_MAX_ASSIGNMENTS);
    }
}
