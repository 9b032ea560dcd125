package SFC.PetriNet;

/**
 * Non-fatal findings attached to a successfully built net.
 */
public sealed interface Diagnostic {

    String message();

    /** A step whose place is not reachable from the initial marking. */
    record DisconnectedStep(String step) implements Diagnostic {
        @Override
        public String message() {
            return "Step '" + step + "' is not reachable from the initial step";
        }
    }
}
