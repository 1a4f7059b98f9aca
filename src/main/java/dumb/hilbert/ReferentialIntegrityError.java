package dumb.hilbert;

/** A proof step cited a formula that was not produced by the same proof builder. */
public class ReferentialIntegrityError extends LogicException {
    public ReferentialIntegrityError(String context, String detail) {
        super(Kind.REFERENTIAL_INTEGRITY, context, detail);
    }
}
