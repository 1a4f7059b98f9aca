package dumb.hilbert.compile;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An author visible connective. Applying it builds an {@link Expr.App}; arity is enforced when
 * the expression is compiled.
 */
public record Constructor(String name, int arity) {
    public Constructor {
        requireNonNull(name);
        if (arity < 0) throw new IllegalArgumentException("Negative arity for " + name);
    }

    public Expr.App apply(Expr... args) {
        return new Expr.App(this, List.of(args));
    }

    public Expr.App apply(List<Expr> args) {
        return new Expr.App(this, args);
    }
}
