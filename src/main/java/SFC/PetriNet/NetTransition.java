package SFC.PetriNet;

import java.util.Locale;

import it.unimi.dsi.fastutil.ints.IntList;
import SFC.Expr.Action;
import SFC.Expr.Expr;

/**
 * Net transition with unit arc weights. Guard and action are metadata carried over from the
 * chart for comparison; firing only moves tokens.
 * @param chartTransition - declaration index of the originating chart transition
 */
public record NetTransition(
    int index,
    String name,
    IntList preset,
    IntList postset,
    int chartTransition,
    String sourceStep,
    String targetStep,
    Expr guard,
    Action action,
    Role role
) {

    /**
     * STEP: the whole chart transition. GUARD and ACTION: the two halves of a serialized
     * chart transition; the ACTION half is bookkeeping and never observable.
     */
    public enum Role { STEP, GUARD, ACTION }

    public boolean isBookkeeping() {
        return role == Role.ACTION;
    }

    /** Label used in witnesses, e.g. {@code Check -> Multiply [i <= n]}. */
    public String describe() {
        String text = sourceStep + " -> " + targetStep + " [" + guard + "]";
        return role == Role.STEP ? text : text + " (" + role.name().toLowerCase(Locale.ROOT) + ")";
    }

    @Override
    public String toString() {
        return name;
    }
}
