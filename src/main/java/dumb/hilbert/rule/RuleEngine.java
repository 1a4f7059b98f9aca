package dumb.hilbert.rule;

import dumb.hilbert.TypingError;
import dumb.hilbert.compile.SignatureRegistry;
import dumb.hilbert.formula.Formula;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Closed registry of rules keyed by label. Applying a rule first checks the hypotheses against
 * its signature, then runs the rule. Holds no mutable state.
 */
public final class RuleEngine {
    private final Map<String, Rule> rules;
    private final SignatureRegistry signatures;

    private RuleEngine(Map<String, Rule> rules, SignatureRegistry signatures) {
        this.rules = Map.copyOf(rules);
        this.signatures = signatures;
    }

    /**
     * @throws IllegalStateException if two rules share a label
     */
    public static RuleEngine of(List<? extends Rule> rules) {
        var byLabel = new LinkedHashMap<String, Rule>();
        var sigs = SignatureRegistry.builder();
        for (var r : rules) {
            if (byLabel.putIfAbsent(r.label(), r) != null)
                throw new IllegalStateException("Duplicate rule label: " + r.label());
            sigs.require(r.label(), r.signature());
        }
        return new RuleEngine(byLabel, sigs.build());
    }

    public Formula apply(String label, List<Hypothesis> hyps, String ctx) {
        requireNonNull(hyps);
        check(label, hyps, ctx);
        return rules.get(label).apply(hyps, ctx);
    }

    /** Signature phase alone: hypothesis count and sorts. */
    public void check(String label, List<Hypothesis> hyps, String ctx) {
        if (!rules.containsKey(label)) throw new TypingError(ctx, "unknown rule '" + label + "'");
        var sig = signatures.require(label, ctx);
        if (hyps.size() != sig.arity())
            throw new TypingError(ctx, label + ": expects " + sig.arity() + " hypotheses, got " + hyps.size());
        for (var i = 0; i < hyps.size(); i++) {
            var h = hyps.get(i);
            if (!h.body().sort().equals(sig.inSort(i)))
                throw new TypingError(ctx, label + ": hypothesis " + h.label() + " has sort " + h.body().sort() + ", expected " + sig.inSort(i));
        }
    }

    public boolean has(String label) {
        return rules.containsKey(label);
    }

    public Set<String> labels() {
        return rules.keySet();
    }

    public SignatureRegistry signatures() {
        return signatures;
    }
}
