package SFC.Chart;

import SFC.Expr.Expr;

/**
 * Guarded edge between two steps; {@code index} is the declaration position.
 */
public record ChartTransition(int index, String source, String target, Expr guard) {

    @Override
    public String toString() {
        return source + " -> " + target + " [" + guard + "]";
    }
}
