package dumb.hilbert.compile;

import dumb.hilbert.formula.Builtins;
import dumb.hilbert.formula.Formula;

import java.util.List;

/** Arranges the compiled operands of a constructor into the parent's token sequence. */
@FunctionalInterface
public interface Lowering {
    List<Integer> lower(Builtins b, List<Formula> args);
}
