package SFC.Chart;

import SFC.Expr.Action;

/**
 * A named step and the action executed when it becomes active.
 */
public record Step(int index, String name, Action action) {}
