package dumb.hilbert.proof;

import dumb.hilbert.ReferentialIntegrityError;
import dumb.hilbert.compile.Expr;
import dumb.hilbert.formula.Formula;
import dumb.hilbert.rule.Hypothesis;
import dumb.hilbert.rule.ModusPonens;
import dumb.hilbert.system.LogicSystem;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Accumulates the steps of one proof.
 * <p>
 * Every formula a step produces is remembered by object identity. Inference steps and operands
 * of reference steps may only cite formulas remembered here; a structurally equal formula built
 * elsewhere is rejected with {@link ReferentialIntegrityError}. Compilation and rule failures
 * propagate unchanged.
 */
public final class ProofBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ProofBuilder.class);

    private final LogicSystem system;
    private final String name;
    private final List<ProofStep> steps = new ArrayList<>();
    private final Set<String> labels = new HashSet<>();
    private final Map<Formula, String> provenance = new IdentityHashMap<>();
    private boolean finished;

    public ProofBuilder(LogicSystem system, String name) {
        this.system = requireNonNull(system);
        this.name = requireNonNull(name);
    }

    public Formula hyp(String label, Expr expr) {
        var ctx = begin(label);
        return record(label, system.compile(expr, ctx), StepKind.HYPOTHESIS, List.of(), null, "hypothesis");
    }

    public Formula hyp(String label, String text) {
        var ctx = begin(label);
        return record(label, system.compile(text, ctx), StepKind.HYPOTHESIS, List.of(), null, "hypothesis");
    }

    /**
     * An explicit instance of the axiom, lemma or rule {@code ref}. {@code operands} are the
     * earlier formulas the cited inference consumes, if any.
     */
    public Formula ref(String label, Expr expr, String ref, String note, Formula... operands) {
        var ctx = begin(label);
        var ops = operandLabels(ctx, operands);
        return record(label, system.compile(expr, ctx), StepKind.REFERENCE, ops, requireNonNull(ref), note);
    }

    public Formula ref(String label, String text, String ref, String note, Formula... operands) {
        var ctx = begin(label);
        var ops = operandLabels(ctx, operands);
        return record(label, system.compile(text, ctx), StepKind.REFERENCE, ops, requireNonNull(ref), note);
    }

    /** A statement imported without justification. */
    public Formula opaque(String label, Expr expr, String note) {
        var ctx = begin(label);
        return record(label, system.compile(expr, ctx), StepKind.OPAQUE, List.of(), null, note);
    }

    public Formula opaque(String label, String text, String note) {
        var ctx = begin(label);
        return record(label, system.compile(text, ctx), StepKind.OPAQUE, List.of(), null, note);
    }

    /**
     * Modus Ponens: from {@code major = ( φ → ψ )} and {@code minor = φ}, both produced by this
     * builder, conclude {@code ψ}.
     */
    public Formula infer(String label, Formula major, Formula minor, String note) {
        var ctx = begin(label);
        var majorLabel = provenanceOf(ctx, major, "major");
        var minorLabel = provenanceOf(ctx, minor, "minor");
        var result = system.apply(ModusPonens.LABEL,
                List.of(new Hypothesis(minorLabel, minor), new Hypothesis(majorLabel, major)), ctx);
        return record(label, result, StepKind.INFERENCE, List.of(minorLabel, majorLabel), null, note);
    }

    /**
     * Freezes the steps. {@code statement} must be the formula of the last step.
     */
    public Proof finish(Formula statement) {
        var ctx = name + "[finish]";
        if (finished) throw new IllegalStateException(ctx + ": proof already finished");
        if (steps.isEmpty()) throw new ReferentialIntegrityError(ctx, "proof has no steps");
        provenanceOf(ctx, statement, "statement");
        var last = steps.get(steps.size() - 1);
        if (last.formula() != statement)
            throw new ReferentialIntegrityError(ctx, "statement must be the formula of the last step " + last.label() + ", got step " + provenance.get(statement));
        finished = true;
        var proof = new Proof(name, statement, steps);
        logger.debug("finished proof {} with {} steps, references {}", name, steps.size(), proof.references());
        return proof;
    }

    public String name() {
        return name;
    }

    private String begin(String label) {
        requireNonNull(label);
        var ctx = name + "[" + label + "]";
        if (finished) throw new IllegalStateException(ctx + ": proof already finished");
        if (labels.contains(label)) throw new ReferentialIntegrityError(ctx, "duplicate step label '" + label + "'");
        return ctx;
    }

    private List<String> operandLabels(String ctx, Formula[] operands) {
        var out = new ArrayList<String>(operands.length);
        for (var i = 0; i < operands.length; i++) out.add(provenanceOf(ctx, operands[i], "operand " + (i + 1)));
        return out;
    }

    private String provenanceOf(String ctx, Formula f, String role) {
        requireNonNull(f, role);
        var label = provenance.get(f);
        if (label == null)
            throw new ReferentialIntegrityError(ctx, role + " was not produced by a step of " + name);
        return label;
    }

    private Formula record(String label, Formula f, StepKind kind, List<String> operands, @Nullable String ref, String note) {
        steps.add(new ProofStep(label, f, kind, operands, ref, requireNonNull(note)));
        labels.add(label);
        provenance.put(f, label);
        return f;
    }
}
