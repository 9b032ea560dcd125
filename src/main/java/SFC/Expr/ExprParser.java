package SFC.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for chart guards and step actions.
 * <pre>
 * action  := [ assign { ';' assign } [ ';' ] ]
 * assign  := IDENT ':=' expr
 * expr    := and { ('or' | '||') and }
 * and     := not { ('and' | '&&') not }
 * not     := ('not' | '!') not | cmp
 * cmp     := sum [ ('<' | '<=' | '>' | '>=' | '==' | '=' | '!=' | '&lt;&gt;') sum ]
 * sum     := term { ('+' | '-') term }
 * term    := unary { ('*' | '/' | '%') unary }
 * unary   := '-' unary | primary
 * primary := INT | 'True' | 'False' | IDENT | '(' expr ')'
 * </pre>
 */
public final class ExprParser {

    private enum Kind { INT, IDENT, SYMBOL, END }

    private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(":=", "<=", ">=", "==", "!=", "<>", "&&", "||");

    private record Token(Kind kind, String text, int position) {}

    private final String text;
    private final List<Token> tokens;
    private int pos;

    private ExprParser(String text) throws ExprSyntaxException {
        this.text = text;
        this.tokens = tokenize(text);
        this.pos = 0;
    }

    /**
     * Parse a guard. Blank text is the constant {@code True}.
     */
    public static Expr parseGuard(String text) throws ExprSyntaxException {
        if (text == null || text.isBlank()) {
            return Expr.TRUE;
        }
        ExprParser parser = new ExprParser(text);
        Expr e = parser.expr();
        parser.expect(Kind.END, null);
        return e;
    }

    /**
     * Parse a step action. Blank text is the empty action.
     */
    public static Action parseAction(String text) throws ExprSyntaxException {
        if (text == null || text.isBlank()) {
            return Action.NONE;
        }
        ExprParser parser = new ExprParser(text);
        List<Assignment> assignments = new ArrayList<>();
        while (parser.peek().kind != Kind.END) {
            if (parser.accept(";")) {
                continue; // tolerate empty statements
            }
            Token target = parser.expect(Kind.IDENT, null);
            parser.expect(Kind.SYMBOL, ":=");
            assignments.add(new Assignment(target.text, parser.expr()));
            if (parser.peek().kind != Kind.END) {
                parser.expect(Kind.SYMBOL, ";");
            }
        }
        return new Action(assignments);
    }

    private Expr expr() throws ExprSyntaxException {
        Expr left = and();
        while (acceptKeyword("or") || accept("||")) {
            left = new Expr.Binary(Expr.Op.OR, left, and());
        }
        return left;
    }

    private Expr and() throws ExprSyntaxException {
        Expr left = not();
        while (acceptKeyword("and") || accept("&&")) {
            left = new Expr.Binary(Expr.Op.AND, left, not());
        }
        return left;
    }

    private Expr not() throws ExprSyntaxException {
        if (acceptKeyword("not") || accept("!")) {
            return new Expr.Unary(Expr.Op.NOT, not());
        }
        return comparison();
    }

    private Expr comparison() throws ExprSyntaxException {
        Expr left = sum();
        Token t = peek();
        if (t.kind == Kind.SYMBOL) {
            Expr.Op op = switch (t.text) {
                case "<" -> Expr.Op.LT;
                case "<=" -> Expr.Op.LE;
                case ">" -> Expr.Op.GT;
                case ">=" -> Expr.Op.GE;
                case "==", "=" -> Expr.Op.EQ;
                case "!=", "<>" -> Expr.Op.NE;
                default -> null;
            };
            if (op != null) {
                pos++;
                return new Expr.Binary(op, left, sum());
            }
        }
        return left;
    }

    private Expr sum() throws ExprSyntaxException {
        Expr left = term();
        while (true) {
            if (accept("+")) {
                left = new Expr.Binary(Expr.Op.ADD, left, term());
            } else if (accept("-")) {
                left = new Expr.Binary(Expr.Op.SUB, left, term());
            } else {
                return left;
            }
        }
    }

    private Expr term() throws ExprSyntaxException {
        Expr left = unary();
        while (true) {
            if (accept("*")) {
                left = new Expr.Binary(Expr.Op.MUL, left, unary());
            } else if (accept("/")) {
                left = new Expr.Binary(Expr.Op.DIV, left, unary());
            } else if (accept("%")) {
                left = new Expr.Binary(Expr.Op.MOD, left, unary());
            } else {
                return left;
            }
        }
    }

    private Expr unary() throws ExprSyntaxException {
        if (accept("-")) {
            Expr operand = unary();
            if (operand instanceof Expr.Literal l && !l.bool()) {
                return new Expr.Literal(-l.value(), false);
            }
            return new Expr.Unary(Expr.Op.NEG, operand);
        }
        return primary();
    }

    private Expr primary() throws ExprSyntaxException {
        Token t = peek();
        if (t.kind == Kind.INT) {
            pos++;
            try {
                return new Expr.Literal(Integer.parseInt(t.text), false);
            } catch (NumberFormatException e) {
                throw new ExprSyntaxException("Integer literal out of range", text, t.position);
            }
        }
        if (t.kind == Kind.IDENT) {
            pos++;
            String lower = t.text.toLowerCase(Locale.ROOT);
            if (lower.equals("true")) {
                return Expr.TRUE;
            }
            if (lower.equals("false")) {
                return Expr.FALSE;
            }
            if (isKeyword(lower)) {
                throw new ExprSyntaxException("Unexpected keyword '" + t.text + "'", text, t.position);
            }
            return new Expr.Variable(t.text);
        }
        if (accept("(")) {
            Expr inner = expr();
            expect(Kind.SYMBOL, ")");
            return inner;
        }
        if (t.kind == Kind.END) {
            throw new ExprSyntaxException("Unexpected end of expression", text, t.position);
        }
        throw new ExprSyntaxException("Unexpected '" + t.text + "'", text, t.position);
    }

    private static boolean isKeyword(String lower) {
        return lower.equals("and") || lower.equals("or") || lower.equals("not");
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private boolean accept(String symbol) {
        Token t = peek();
        if (t.kind == Kind.SYMBOL && t.text.equals(symbol)) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        Token t = peek();
        if (t.kind == Kind.IDENT && t.text.equalsIgnoreCase(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private Token expect(Kind kind, String symbol) throws ExprSyntaxException {
        Token t = peek();
        if (t.kind != kind || (symbol != null && !t.text.equals(symbol))) {
            String wanted = symbol != null ? "'" + symbol + "'" : kind.name().toLowerCase(Locale.ROOT);
            String found = t.kind == Kind.END ? "end of input" : "'" + t.text + "'";
            throw new ExprSyntaxException("Expected " + wanted + " but found " + found, text, t.position);
        }
        pos++;
        return t;
    }

    private static List<Token> tokenize(String text) throws ExprSyntaxException {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                int start = i;
                while (i < n && Character.isDigit(text.charAt(i))) {
                    i++;
                }
                out.add(new Token(Kind.INT, text.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_'
                    || text.charAt(i) == '.')) {
                    i++;
                }
                out.add(new Token(Kind.IDENT, text.substring(start, i), start));
            } else {
                String two = i + 1 < n ? text.substring(i, i + 2) : "";
                if (TWO_CHAR_SYMBOLS.contains(two)) {
                    out.add(new Token(Kind.SYMBOL, two, i));
                    i += 2;
                    continue;
                }
                if ("<>=!+-*/%();".indexOf(c) < 0) {
                    throw new ExprSyntaxException("Unexpected character '" + c + "'", text, i);
                }
                out.add(new Token(Kind.SYMBOL, String.valueOf(c), i));
                i++;
            }
        }
        out.add(new Token(Kind.END, "", n));
        return out;
    }
}
