package SFC.Containment;

import java.util.List;

/**
 * Evidence of a divergence: a firing sequence of the compared-from net, starting at a cut point,
 * whose last firing the other net cannot match.
 * @param segment - index of the segment, equal to the cut point's order
 * @param cutPoint - name of the cut point the sequence starts from
 * @param trace - firings of the compared-from net, described as {@code source -> target [guard]}
 * @param reason - what was expected and what the other net offered
 */
public record Witness(int segment, String cutPoint, List<String> trace, String reason) {

    public Witness {
        trace = List.copyOf(trace);
    }

    @Override
    public String toString() {
        return "segment " + segment + " (" + cutPoint + "): " + String.join(", ", trace) + ": " + reason;
    }
}
