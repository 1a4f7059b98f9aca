package dumb.hilbert.emit;

import dumb.hilbert.compile.Connectives;
import dumb.hilbert.compile.Expr;
import dumb.hilbert.formula.Formula;
import dumb.hilbert.proof.Proof;
import dumb.hilbert.proof.ProofStep;
import dumb.hilbert.system.LogicSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Feeds compiled axioms, the syntax and inference rule skeleton, and finished lemmas to a
 * {@link DatabaseWriter}, translating symbol identities to external names on the way out.
 * Constants and variables are declared to the writer the first time a statement uses them.
 */
public final class Emitter {
    public static final List<String> RULE_LABELS = List.of("wi", "wn", "wa", "mp");

    private static final Logger logger = LoggerFactory.getLogger(Emitter.class);

    private final DatabaseWriter writer;
    private final Set<Integer> declared = new HashSet<>();
    private final Set<String> emitted = new LinkedHashSet<>();

    public Emitter(DatabaseWriter writer) {
        this.writer = requireNonNull(writer);
    }

    /** Compiles and emits every axiom schema of {@code sys}; returns the compiled formulas. */
    public Map<String, Formula> emitAxioms(LogicSystem sys) {
        var axioms = sys.compileAxioms();
        var names = declare(sys, axioms.values());
        axioms.forEach((label, f) -> {
            claim(label);
            writer.axiom(label, f.sort().name(), names.names(f));
        });
        logger.debug("emitted {} axioms of {}", axioms.size(), sys.language());
        return axioms;
    }

    /** Syntax axioms wi, wn, wa and Modus Ponens with its hypotheses mp.1 and mp.2. */
    public void emitRuleSkeleton(LogicSystem sys) {
        var ph = Expr.var("φ");
        var ps = Expr.var("ψ");
        var wi = sys.compile(Connectives.imp(ph, ps), "rule[wi]");
        var wn = sys.compile(Connectives.not(ph), "rule[wn]");
        var wa = sys.compile(Connectives.and(ph, ps), "rule[wa]");
        var minor = sys.compile(ph, "rule[mp.phi]");
        var conclusion = sys.compile(ps, "rule[mp.psi]");
        var major = sys.compile(Connectives.imp(ph, ps), "rule[mp.imp]");

        var names = declare(sys, List.of(wi, wn, wa, minor, conclusion, major));
        claim("wi");
        writer.axiom("wi", wi.sort().name(), names.names(wi));
        claim("wn");
        writer.axiom("wn", wn.sort().name(), names.names(wn));
        claim("wa");
        writer.axiom("wa", wa.sort().name(), names.names(wa));
        claim("mp");
        writer.hypothesisBlock("mp", conclusion.sort().name(), names.names(conclusion), List.of(
                new DatabaseWriter.Statement("mp.1", minor.sort().name(), names.names(minor)),
                new DatabaseWriter.Statement("mp.2", major.sort().name(), names.names(major))));
    }

    public void emitLemmas(LogicSystem sys, Collection<Proof> lemmas) {
        var formulas = new ArrayList<Formula>();
        for (var p : lemmas) p.steps().forEach(s -> formulas.add(s.formula()));
        var names = declare(sys, formulas);
        for (var p : lemmas) {
            claim(p.name());
            var hyps = new ArrayList<DatabaseWriter.Statement>();
            var renamed = new HashMap<String, String>();
            for (var h : p.hypotheses()) {
                var label = hypothesisLabel(p, h);
                renamed.put(h.label(), label);
                hyps.add(new DatabaseWriter.Statement(label, h.formula().sort().name(), names.names(h.formula())));
            }
            var lines = new ArrayList<DatabaseWriter.ProofLine>(p.steps().size());
            for (var s : p.steps()) {
                var operands = s.operands().stream().map(o -> renamed.getOrDefault(o, o)).toList();
                lines.add(new DatabaseWriter.ProofLine(renamed.getOrDefault(s.label(), s.label()), s.kind().name().toLowerCase(),
                        names.names(s.formula()), operands, s.ref(), s.note()));
            }
            writer.theorem(p.name(), p.statement().sort().name(), names.names(p.statement()), hyps, lines);
        }
        logger.debug("emitted {} lemmas", lemmas.size());
    }

    /** Every exported label must have been emitted by this emitter. */
    public void export(Collection<String> labels) {
        var missing = new TreeSet<String>();
        for (var l : labels) if (!emitted.contains(l)) missing.add(l);
        if (!missing.isEmpty()) throw new IllegalArgumentException("Cannot export labels that were not emitted: " + missing);
        writer.export(List.copyOf(new LinkedHashSet<>(labels)));
    }

    /** Labels emitted so far, in order. */
    public Set<String> emitted() {
        return Collections.unmodifiableSet(emitted);
    }

    private void claim(String label) {
        if (!emitted.add(label)) throw new IllegalStateException("Label " + label + " emitted twice");
    }

    /** Hypothesis labels must be unique across the database, so they carry the lemma name. */
    private static String hypothesisLabel(Proof p, ProofStep h) {
        return h.label().startsWith(p.name() + ".") ? h.label() : p.name() + "." + h.label();
    }

    private TokenNames declare(LogicSystem sys, Collection<Formula> formulas) {
        var table = sys.interner().snapshot();
        var names = new TokenNames(table);
        var constants = new TreeSet<Integer>();
        var variables = new TreeSet<Integer>();
        for (var f : formulas)
            for (var id : f.tokens()) {
                if (declared.contains(id)) continue;
                (table.get(id).isConstant() ? constants : variables).add(id);
            }
        if (!constants.isEmpty()) writer.constants(constants.stream().map(names::name).toList());
        if (!variables.isEmpty()) writer.variables(variables.stream().map(names::name).toList());
        declared.addAll(constants);
        declared.addAll(variables);
        return names;
    }
}
