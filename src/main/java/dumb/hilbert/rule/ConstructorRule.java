package dumb.hilbert.rule;

import dumb.hilbert.compile.Lowering;
import dumb.hilbert.compile.Signature;
import dumb.hilbert.formula.Builtins;
import dumb.hilbert.formula.Formula;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Syntax rule that builds a formula from already compiled operands with a constructor's
 * lowering, e.g. {@code wi}: from wff φ and wff ψ construct wff {@code ( φ → ψ )}.
 */
public record ConstructorRule(String label, Signature signature, Lowering lowering, Builtins b) implements Rule {
    public ConstructorRule {
        requireNonNull(label);
        requireNonNull(signature);
        requireNonNull(lowering);
        requireNonNull(b);
    }

    @Override
    public Formula apply(List<Hypothesis> hyps, String ctx) {
        var operands = hyps.stream().map(Hypothesis::body).toList();
        return new Formula(signature.outSort(), lowering.lower(b, operands));
    }
}
