package SFC.CutPoints;

import SFC.PetriNet.Marking;
import SFC.PetriNet.Place;

/**
 * A phase boundary of a net: a marking every complete run passes through.
 * @param order - position in dominance order, starting at 0 for the initial marking
 * @param place - the place representing the boundary
 * @param marking - the dominating marking
 * @param loopHead - whether the marking is re-entered at the start of each loop iteration
 */
public record CutPoint(int order, Place place, Marking marking, boolean loopHead) {

    public String name() {
        return place.name();
    }

    @Override
    public String toString() {
        return order + ":" + place.name() + (loopHead ? "*" : "");
    }
}
