package SFC.PetriNet;

import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import SFC.Expr.Action;

/**
 * Place/transition net translated from a chart. Immutable; all accessors are read-only
 * and sufficient for exporting the net to another representation.
 */
public final class PetriNet {
    private final List<Place> places;
    private final List<NetTransition> transitions;
    private final Marking initialMarking;
    private final Set<String> variables;
    private final List<Diagnostic> diagnostics;
    // step places only; auxiliary names may coincide with step names
    private final Map<String, Place> stepsByName;
    // consumers[p] = transitions with p in their preset, in index order
    private final IntList[] consumers;

    PetriNet(List<Place> places, List<NetTransition> transitions, Marking initialMarking,
             Set<String> variables, List<Diagnostic> diagnostics) {
        this.places = List.copyOf(places);
        this.transitions = List.copyOf(transitions);
        this.initialMarking = initialMarking;
        this.variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
        this.diagnostics = List.copyOf(diagnostics);

        Map<String, Place> byName = new HashMap<>();
        for (Place p : this.places) {
            if (p.isStep() && byName.put(p.name(), p) != null) {
                throw new IllegalArgumentException("Duplicate step place: " + p.name());
            }
        }
        this.stepsByName = Collections.unmodifiableMap(byName);

        IntArrayList[] cons = new IntArrayList[this.places.size()];
        for (int p = 0; p < cons.length; p++) {
            cons[p] = new IntArrayList();
        }
        for (NetTransition t : this.transitions) {
            for (int p : t.preset()) {
                cons[p].add(t.index());
            }
        }
        this.consumers = new IntList[cons.length];
        for (int p = 0; p < cons.length; p++) {
            this.consumers[p] = IntLists.unmodifiable(cons[p]);
        }
    }

    public List<Place> places() {
        return places;
    }

    public List<NetTransition> transitions() {
        return transitions;
    }

    public Marking initialMarking() {
        return initialMarking;
    }

    public Set<String> variables() {
        return variables;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean isEmpty() {
        return places.isEmpty();
    }

    public Place place(int index) {
        return places.get(index);
    }

    /** The step place of a step name. */
    public Place place(String name) {
        Place p = stepsByName.get(name);
        if (p == null) {
            throw new IllegalArgumentException("Unknown step place: " + name);
        }
        return p;
    }

    public NetTransition transition(int index) {
        return transitions.get(index);
    }

    /** Names of the places that stand for chart steps. */
    public Set<String> stepNames() {
        Set<String> out = new LinkedHashSet<>();
        for (Place p : places) {
            if (p.isStep()) {
                out.add(p.name());
            }
        }
        return out;
    }

    /** The action of the step marked initially; it runs before any transition fires. */
    public Action initialAction() {
        Action action = Action.NONE;
        BitSet init = initialMarking.toBitSet();
        for (int p = init.nextSetBit(0); p >= 0; p = init.nextSetBit(p + 1)) {
            if (places.get(p).isStep()) {
                action = places.get(p).action();
            }
        }
        return action;
    }

    /** Transitions consuming from place {@code p}. */
    public IntList consumers(int p) {
        return consumers[p];
    }

    public boolean isEnabled(BitSet marking, int t) {
        for (int p : transitions.get(t).preset()) {
            if (!marking.get(p)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Enabled transitions of a marking, in index order.
     */
    public IntList enabled(BitSet marking) {
        BitSet candidates = new BitSet();
        for (int p = marking.nextSetBit(0); p >= 0; p = marking.nextSetBit(p + 1)) {
            for (int t : consumers[p]) {
                candidates.set(t);
            }
        }
        IntList out = new IntArrayList();
        for (int t = candidates.nextSetBit(0); t >= 0; t = candidates.nextSetBit(t + 1)) {
            if (isEnabled(marking, t)) {
                out.add(t);
            }
        }
        return out;
    }

    /**
     * Fire an enabled transition.
     * @return the successor marking; the argument is not modified
     * @throws IllegalStateException - if the transition is not enabled or firing breaks 1-safety
     */
    public BitSet fire(BitSet marking, int t) {
        NetTransition nt = transitions.get(t);
        if (!isEnabled(marking, t)) {
            throw new IllegalStateException("Transition " + nt.name() + " is not enabled in " + marking);
        }
        BitSet succ = (BitSet) marking.clone();
        for (int p : nt.preset()) {
            succ.clear(p);
        }
        for (int p : nt.postset()) {
            if (succ.get(p)) {
                throw new IllegalStateException(
                    "Net is not 1-safe: firing " + nt.name() + " puts a second token on " + places.get(p).name());
            }
            succ.set(p);
        }
        return succ;
    }

    /** Place names of a marking, for messages. */
    public String describe(BitSet marking) {
        StringBuilder sb = new StringBuilder("{");
        for (int p = marking.nextSetBit(0); p >= 0; p = marking.nextSetBit(p + 1)) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(places.get(p).name());
        }
        return sb.append('}').toString();
    }

    @Override
    public String toString() {
        return "PetriNet(" + places.size() + " places, " + transitions.size() + " transitions, initial="
            + describe(initialMarking.toBitSet()) + ")";
    }
}
