package dumb.hilbert;

/** Unknown constructor or rule, arity mismatch, sort mismatch or an undeclared constant. */
public class TypingError extends LogicException {
    public TypingError(String context, String detail) {
        super(Kind.TYPING, context, detail);
    }

    public TypingError(String context, String detail, Throwable cause) {
        super(Kind.TYPING, context, detail, cause);
    }
}
