package dumb.hilbert.rule;

import dumb.hilbert.ShapeError;
import dumb.hilbert.compile.Signature;
import dumb.hilbert.formula.Builtins;
import dumb.hilbert.formula.Formula;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * From {@code φ} and {@code ( φ → ψ )} conclude {@code ψ}. Hypotheses come in that order: the
 * minor premise first, the implication second.
 */
public final class ModusPonens implements Rule {
    public static final String LABEL = "mp";
    private static final Signature SIGNATURE = Signature.wff(2, "modus ponens");

    private final Builtins b;

    public ModusPonens(Builtins b) {
        this.b = requireNonNull(b);
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public Signature signature() {
        return SIGNATURE;
    }

    @Override
    public Formula apply(List<Hypothesis> hyps, String ctx) {
        var minor = hyps.get(0);
        var major = hyps.get(1);
        var shape = b.tryParseImp(major.body().tokens())
                .orElseThrow(() -> new ShapeError(ctx, LABEL + ": expected token shape '( φ → ψ )' for " + major.label()));
        if (!shape.antecedent().equals(minor.body().tokens()))
            throw new ShapeError(ctx, LABEL + ": antecedent mismatch (token-level) between " + major.label() + " and " + minor.label());
        return Formula.wff(shape.consequent());
    }
}
