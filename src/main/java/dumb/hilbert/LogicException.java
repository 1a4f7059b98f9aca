package dumb.hilbert;

import static java.util.Objects.requireNonNull;

/**
 * Base of every failure raised while compiling formulas, applying rules, wiring proofs or
 * resolving lemma dependencies. Carries the kind, the bare message and the caller supplied
 * context naming the step, axiom or lemma being processed.
 */
public abstract class LogicException extends RuntimeException {
    private final Kind kind;
    private final String context;
    private final String detail;

    protected LogicException(Kind kind, String context, String detail) {
        this(kind, context, detail, null);
    }

    protected LogicException(Kind kind, String context, String detail, Throwable cause) {
        super(format(context, detail), cause);
        this.kind = requireNonNull(kind);
        this.context = requireNonNull(context);
        this.detail = requireNonNull(detail);
    }

    private static String format(String context, String detail) {
        return context == null || context.isEmpty() ? detail : context + ": " + detail;
    }

    public Kind kind() {
        return kind;
    }

    public String context() {
        return context;
    }

    /** The message without the context prefix. */
    public String detail() {
        return detail;
    }

    public enum Kind {
        TYPING, SHAPE, REFERENTIAL_INTEGRITY, UNRESOLVED_DEPENDENCY
    }
}
