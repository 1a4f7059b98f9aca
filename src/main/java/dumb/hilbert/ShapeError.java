package dumb.hilbert;

/** A rule's structural precondition did not hold, e.g. the antecedent of Modus Ponens. */
public class ShapeError extends LogicException {
    public ShapeError(String context, String detail) {
        super(Kind.SHAPE, context, detail);
    }
}
