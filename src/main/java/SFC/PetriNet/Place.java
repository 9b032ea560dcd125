package SFC.PetriNet;

import SFC.Expr.Action;

/**
 * A place of the translated net.
 * @param index - position in {@link PetriNet#places()}
 * @param name - step name for step places, a generated name for auxiliary places
 * @param kind - step-active condition or translation bookkeeping
 * @param step - originating step (for auxiliary places, the step whose action it serializes)
 * @param action - the action executed on entry; empty for auxiliary places
 */
public record Place(int index, String name, Kind kind, String step, Action action) {

    public enum Kind { STEP, AUXILIARY }

    public boolean isStep() {
        return kind == Kind.STEP;
    }

    @Override
    public String toString() {
        return name;
    }
}
