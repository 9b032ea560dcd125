package SFC.Containment;

import SFC.CutPoints.CutPoint;
import SFC.Reachability.ReachabilityGraph;

/**
 * Behavior of a net from one cut point up to the next cut-point marking reached, or termination.
 */
record Segment(int index, CutPoint cutPoint, ReachabilityGraph graph) {}
