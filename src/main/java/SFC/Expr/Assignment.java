package SFC.Expr;

/**
 * A single {@code variable := value} statement of a step action.
 */
public record Assignment(String variable, Expr value) {

    @Override
    public String toString() {
        return variable + " := " + value;
    }
}
