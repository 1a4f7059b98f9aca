package dumb.hilbert.compile;

import dumb.hilbert.TypingError;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static dumb.hilbert.compile.Connectives.imp;
import static dumb.hilbert.compile.Connectives.not;
import static java.util.Objects.requireNonNull;

/**
 * A definitional macro: a new name for a pattern over the core connectives. Expanding it yields
 * an expression of the underlying language, so definitions add neither axioms nor rules.
 */
public record Definition(String name, int arity, Function<List<Expr>, Expr> body, @Nullable String doc) {

    /** {@code Or(φ, ψ) := ¬φ → ψ}. */
    public static final Definition OR = new Definition("Or", 2,
            xs -> imp(not(xs.get(0)), xs.get(1)),
            "Disjunction: either φ is false or ψ holds.");

    public static final Map<String, Definition> DEFINITIONS = Map.of(OR.name, OR);

    public Definition {
        requireNonNull(name);
        requireNonNull(body);
        if (arity < 0) throw new IllegalArgumentException("Negative arity for definition " + name);
    }

    public Expr expand(Expr... args) {
        if (args.length != arity)
            throw new TypingError("definition[" + name + "]", "expects " + arity + " args, got " + args.length);
        return body.apply(List.of(args));
    }
}
