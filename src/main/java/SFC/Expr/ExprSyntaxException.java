package SFC.Expr;

/**
 * Raised when guard or action text cannot be parsed.
 */
public class ExprSyntaxException extends Exception {
    private final String text;
    private final int position;

    public ExprSyntaxException(String message, String text, int position) {
        super(message + " at position " + position + " in '" + text + "'");
        this.text = text;
        this.position = position;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }
}
