package SFC.PetriNet;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.IntLists;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.util.automaton.fsa.NFAs;
import SFC.Chart.ChartTransition;
import SFC.Chart.SequentialFunctionChart;
import SFC.Chart.Step;
import SFC.Expr.Action;
import SFC.Expr.Expr;

/**
 * Structural translation of a chart into a 1-safe Petri net.
 * Every step becomes a place; every chart transition moves the single token from the source
 * step's place to the target step's place. Competing transitions of a step share its place.
 */
public final class PetriNetBuilder {

    private PetriNetBuilder() {}

    public static PetriNet build(SequentialFunctionChart sfc) {
        return build(sfc, BuildOptions.defaults());
    }

    /**
     * Translate a chart.
     * @param sfc - validated chart
     * @param options - translation options
     * @return a fresh net; unreachable steps are reported as {@link Diagnostic.DisconnectedStep}
     */
    public static PetriNet build(SequentialFunctionChart sfc, BuildOptions options) {
        final List<Place> places = new ArrayList<>();
        final Map<String, Integer> stepPlace = new HashMap<>();
        for (Step s : sfc.steps()) {
            stepPlace.put(s.name(), places.size());
            places.add(new Place(places.size(), s.name(), Place.Kind.STEP, s.name(), s.action()));
        }

        final List<NetTransition> transitions = new ArrayList<>();
        for (ChartTransition ct : sfc.transitions()) {
            final int src = stepPlace.get(ct.source());
            final int tgt = stepPlace.get(ct.target());
            final Action entryAction = sfc.action(ct.target());
            if (!options.serializeActions()) {
                transitions.add(new NetTransition(transitions.size(), "t" + ct.index(),
                    IntLists.singleton(src), IntLists.singleton(tgt),
                    ct.index(), ct.source(), ct.target(), ct.guard(), entryAction, NetTransition.Role.STEP));
                continue;
            }
            // guard fires into an auxiliary place, the action follows as bookkeeping
            final int aux = places.size();
            places.add(new Place(aux, ct.source() + "->" + ct.target() + "#" + ct.index(),
                Place.Kind.AUXILIARY, ct.target(), Action.NONE));
            transitions.add(new NetTransition(transitions.size(), "t" + ct.index() + ".guard",
                IntLists.singleton(src), IntLists.singleton(aux),
                ct.index(), ct.source(), ct.target(), ct.guard(), entryAction, NetTransition.Role.GUARD));
            transitions.add(new NetTransition(transitions.size(), "t" + ct.index() + ".action",
                IntLists.singleton(aux), IntLists.singleton(tgt),
                ct.index(), ct.source(), ct.target(), Expr.TRUE, entryAction, NetTransition.Role.ACTION));
        }

        final Marking initial = Marking.of(stepPlace.get(sfc.initialStep()));
        final List<Diagnostic> diagnostics = disconnectedSteps(sfc, stepPlace);
        return new PetriNet(places, transitions, initial, sfc.variables(), diagnostics);
    }

    /*
    Reachability of step places on the step graph. The net is a state machine, so a step place
    can be marked iff its step is reachable in the chart.
     */
    private static List<Diagnostic> disconnectedSteps(SequentialFunctionChart sfc, Map<String, Integer> stepPlace) {
        final List<Diagnostic> out = new ArrayList<>();
        final List<ChartTransition> chartTransitions = sfc.transitions();
        if (chartTransitions.isEmpty()) {
            for (Step s : sfc.steps()) {
                if (!s.name().equals(sfc.initialStep())) {
                    out.add(new Diagnostic.DisconnectedStep(s.name()));
                }
            }
            return out;
        }

        final Alphabet<Integer> alphabet = Alphabets.integers(0, chartTransitions.size() - 1);
        final CompactNFA<Integer> stepGraph = new CompactNFA<>(alphabet, sfc.steps().size());
        for (Step s : sfc.steps()) {
            stepGraph.addState(true);
        }
        final int init = stepPlace.get(sfc.initialStep());
        stepGraph.setInitial(init, true);
        for (ChartTransition ct : chartTransitions) {
            final int src = stepPlace.get(ct.source());
            final int tgt = stepPlace.get(ct.target());
            stepGraph.addTransition(src, ct.index(), tgt);
        }

        final Set<Integer> reachable = NFAs.accessibleStates(stepGraph, alphabet);
        for (Step s : sfc.steps()) {
            if (!reachable.contains(stepPlace.get(s.name()))) {
                out.add(new Diagnostic.DisconnectedStep(s.name()));
            }
        }
        return out;
    }

    /** Place index for a step of a net built by this class. */
    public static int stepPlace(PetriNet net, String step) {
        return net.place(step).index();
    }
}
