package SFC.Expr;

import java.util.Map;
import java.util.Set;

/**
 * Guard and right-hand-side expressions of a chart.
 * Values are integers; boolean results are 0/1 and any non-zero value counts as true.
 */
public sealed interface Expr permits Expr.Literal, Expr.Variable, Expr.Unary, Expr.Binary {

    Literal TRUE = new Literal(1, true);
    Literal FALSE = new Literal(0, true);

    int eval(Map<String, Integer> env);

    void collectVariables(Set<String> out);

    default boolean holds(Map<String, Integer> env) {
        return eval(env) != 0;
    }

    default boolean isTrue() {
        return this instanceof Literal l && l.value() != 0;
    }

    default boolean isFalse() {
        return this instanceof Literal l && l.value() == 0;
    }

    /**
     * Conjunction that drops literal truths and duplicate conjuncts, so repeated
     * conjoining of the same guards stays finite.
     */
    static Expr and(Expr left, Expr right) {
        if (left.isTrue() || left.equals(right)) {
            return right;
        }
        if (right.isTrue()) {
            return left;
        }
        if (left.isFalse() || right.isFalse()) {
            return FALSE;
        }
        if (containsConjunct(left, right)) {
            return left;
        }
        return new Binary(Op.AND, left, right);
    }

    private static boolean containsConjunct(Expr conjunction, Expr conjunct) {
        if (conjunction.equals(conjunct)) {
            return true;
        }
        if (conjunction instanceof Binary b && b.op() == Op.AND) {
            return containsConjunct(b.left(), conjunct) || containsConjunct(b.right(), conjunct);
        }
        return false;
    }

    enum Op {
        OR("or", 1), AND("and", 2),
        EQ("==", 3), NE("!=", 3), LT("<", 3), LE("<=", 3), GT(">", 3), GE(">=", 3),
        ADD("+", 4), SUB("-", 4),
        MUL("*", 5), DIV("/", 5), MOD("%", 5),
        NOT("not", 6), NEG("-", 6);

        final String symbol;
        final int precedence;

        Op(String symbol, int precedence) {
            this.symbol = symbol;
            this.precedence = precedence;
        }
    }

    /** Integer or boolean constant. */
    record Literal(int value, boolean bool) implements Expr {
        @Override
        public int eval(Map<String, Integer> env) {
            return value;
        }

        @Override
        public void collectVariables(Set<String> out) {}

        @Override
        public String toString() {
            if (bool) {
                return value != 0 ? "True" : "False";
            }
            return String.valueOf(value);
        }
    }

    record Variable(String name) implements Expr {
        @Override
        public int eval(Map<String, Integer> env) {
            Integer value = env.get(name);
            if (value == null) {
                throw new IllegalArgumentException("Unbound variable: " + name);
            }
            return value;
        }

        @Override
        public void collectVariables(Set<String> out) {
            out.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record Unary(Op op, Expr operand) implements Expr {
        @Override
        public int eval(Map<String, Integer> env) {
            int v = operand.eval(env);
            return switch (op) {
                case NOT -> v == 0 ? 1 : 0;
                case NEG -> -v;
                default -> throw new IllegalStateException("Not a unary operator: " + op);
            };
        }

        @Override
        public void collectVariables(Set<String> out) {
            operand.collectVariables(out);
        }

        @Override
        public String toString() {
            String inner = operand instanceof Binary ? "(" + operand + ")" : operand.toString();
            return op == Op.NOT ? "not " + inner : "-" + inner;
        }
    }

    record Binary(Op op, Expr left, Expr right) implements Expr {
        @Override
        public int eval(Map<String, Integer> env) {
            // short-circuit so that the right operand may be unbound when irrelevant
            if (op == Op.AND) {
                return left.eval(env) != 0 && right.eval(env) != 0 ? 1 : 0;
            }
            if (op == Op.OR) {
                return left.eval(env) != 0 || right.eval(env) != 0 ? 1 : 0;
            }
            int l = left.eval(env);
            int r = right.eval(env);
            return switch (op) {
                case EQ -> l == r ? 1 : 0;
                case NE -> l != r ? 1 : 0;
                case LT -> l < r ? 1 : 0;
                case LE -> l <= r ? 1 : 0;
                case GT -> l > r ? 1 : 0;
                case GE -> l >= r ? 1 : 0;
                case ADD -> l + r;
                case SUB -> l - r;
                case MUL -> l * r;
                // total division keeps guard evaluation defined everywhere
                case DIV -> r == 0 ? 0 : l / r;
                case MOD -> r == 0 ? 0 : l % r;
                default -> throw new IllegalStateException("Not a binary operator: " + op);
            };
        }

        @Override
        public void collectVariables(Set<String> out) {
            left.collectVariables(out);
            right.collectVariables(out);
        }

        @Override
        public String toString() {
            return wrap(left, false) + " " + op.symbol + " " + wrap(right, true);
        }

        private String wrap(Expr child, boolean rightSide) {
            if (child instanceof Binary b
                && (b.op.precedence < op.precedence || (rightSide && b.op.precedence == op.precedence))) {
                return "(" + b + ")";
            }
            return child.toString();
        }
    }
}
