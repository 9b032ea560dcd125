package SFC.Expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import SFC.Model.ImplicationDomain;

/**
 * Decides {@code premise => conclusion} for guards.
 * Outside the trivial cases, every assignment of the free variables is evaluated. Each variable
 * ranges over the bounded domain together with every integer constant {@code c} of either guard
 * and its neighbours {@code c - 1} and {@code c + 1}, so comparisons against constants outside the
 * domain are decided at their boundary.
 * Instances memoize their answers and may be shared between segment tasks.
 */
public final class GuardImplication {
    private final ImplicationDomain domain;
    private final Map<Pair, Boolean> memo = new ConcurrentHashMap<>();

    private record Pair(Expr premise, Expr conclusion) {}

    public GuardImplication(ImplicationDomain domain) {
        this.domain = domain;
    }

    public boolean implies(Expr premise, Expr conclusion) {
        if (premise.equals(conclusion) || conclusion.isTrue() || premise.isFalse()) {
            return true;
        }
        return memo.computeIfAbsent(new Pair(premise, conclusion), p -> enumerate(p.premise(), p.conclusion()));
    }

    /**
     * @throws ImplicationLimitExceededException - if the assignment space is larger than the domain's cap
     */
    private boolean enumerate(Expr premise, Expr conclusion) {
        TreeSet<String> names = new TreeSet<>();
        premise.collectVariables(names);
        conclusion.collectVariables(names);
        List<String> vars = new ArrayList<>(names);
        final int[] candidates = candidateValues(premise, conclusion);

        long space = 1;
        for (int k = 0; k < vars.size(); k++) {
            space *= candidates.length;
            if (space > domain.maxAssignments()) {
                throw new ImplicationLimitExceededException(premise, conclusion, space, domain.maxAssignments());
            }
        }

        // positions into candidates, one per variable
        final int[] positions = new int[vars.size()];
        final Map<String, Integer> env = new HashMap<>();
        while (true) {
            for (int k = 0; k < positions.length; k++) {
                env.put(vars.get(k), candidates[positions[k]]);
            }
            if (premise.holds(env) && !conclusion.holds(env)) {
                return false;
            }
            // odometer increment
            int k = 0;
            while (k < positions.length && positions[k] == candidates.length - 1) {
                positions[k] = 0;
                k++;
            }
            if (k == positions.length) {
                return true;
            }
            positions[k]++;
        }
    }

    private int[] candidateValues(Expr premise, Expr conclusion) {
        TreeSet<Integer> values = new TreeSet<>();
        for (int v = domain.min(); v <= domain.max(); v++) {
            values.add(v);
            if (v == Integer.MAX_VALUE) {
                break;
            }
        }
        TreeSet<Integer> constants = new TreeSet<>();
        collectConstants(premise, constants);
        collectConstants(conclusion, constants);
        for (int c : constants) {
            values.add(c);
            if (c > Integer.MIN_VALUE) {
                values.add(c - 1);
            }
            if (c < Integer.MAX_VALUE) {
                values.add(c + 1);
            }
        }
        return values.stream().mapToInt(Integer::intValue).toArray();
    }

    private static void collectConstants(Expr e, TreeSet<Integer> out) {
        if (e instanceof Expr.Literal l) {
            if (!l.bool()) {
                out.add(l.value());
            }
        } else if (e instanceof Expr.Unary u) {
            collectConstants(u.operand(), out);
        } else if (e instanceof Expr.Binary b) {
            collectConstants(b.left(), out);
            collectConstants(b.right(), out);
        }
    }
}
