package dumb.hilbert.rule;

import dumb.hilbert.compile.Signature;
import dumb.hilbert.formula.Formula;

import java.util.List;

/**
 * An inference or syntax rule. {@link #apply} is called by the {@link RuleEngine} only after the
 * hypotheses passed the signature check.
 */
public interface Rule {
    String label();

    Signature signature();

    Formula apply(List<Hypothesis> hyps, String ctx);
}
