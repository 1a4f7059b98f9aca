package dumb.hilbert.emit;

import dumb.hilbert.AbstractLogicTest;
import dumb.hilbert.lemma.Lemmas;
import dumb.hilbert.system.LogicSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmitterTest extends AbstractLogicTest {

    private RecordingWriter writer;
    private Emitter emitter;

    @BeforeEach
    void setUpEmitter() {
        writer = new RecordingWriter();
        emitter = new Emitter(writer);
    }

    @Test
    void axiomsAreWrittenWithExternalTokenNames() {
        var axioms = emitter.emitAxioms(sys);
        var a1 = writer.statement("A1");
        var b = sys.builtins();
        var ph = interner.variable("φ", "hilbert").id();
        var ps = interner.variable("ψ", "hilbert").id();

        assertEquals("wff", a1.typecode());
        assertEquals(List.of("c" + b.lparen, "v" + ph, "c" + b.imp, "c" + b.lparen, "v" + ps, "c" + b.imp, "v" + ph, "c" + b.rparen, "c" + b.rparen),
                a1.tokens());
        assertEquals(new TokenNames(interner.snapshot()).names(axioms.get("A1")), a1.tokens());
        assertEquals(List.of("A1", "A2", "A3"), writer.labels());
    }

    @Test
    void symbolsAreDeclaredOnceBeforeUse() {
        emitter.emitAxioms(sys);
        emitter.emitRuleSkeleton(sys);
        emitter.emitAxioms(LogicSystem.predicate(interner));

        var constants = new HashSet<>(writer.constants);
        var variables = new HashSet<>(writer.variables);
        assertEquals(writer.constants.size(), constants.size());
        assertEquals(writer.variables.size(), variables.size());
        for (var s : writer.statements)
            for (var t : s.tokens())
                assertTrue(constants.contains(t) || variables.contains(t), t);
        assertTrue(constants.stream().allMatch(c -> c.startsWith("c")));
        assertTrue(variables.stream().allMatch(v -> v.startsWith("v")));
    }

    @Test
    void ruleSkeletonScopesModusPonensHypotheses() {
        emitter.emitRuleSkeleton(sys);
        assertEquals(Emitter.RULE_LABELS, writer.labels());
        var names = new TokenNames(interner.snapshot());
        assertEquals(names.names(wff("ph -> ps")), writer.statement("wi").tokens());
        assertEquals(names.names(wff("-. ph")), writer.statement("wn").tokens());

        var mp = writer.statement("mp");
        assertEquals(names.names(wff("ps")), mp.tokens());
        assertEquals(List.of("mp.1", "mp.2"), mp.hypotheses().stream().map(DatabaseWriter.Statement::label).toList());
        assertEquals(names.names(wff("ph -> ps")), mp.hypotheses().get(1).tokens());
    }

    @Test
    void lemmasCarryHypothesesAndProofLines() {
        var mt = Lemmas.modusTollens(sys);
        var syl = Lemmas.syl(sys);
        emitter.emitLemmas(sys, List.of(mt, syl));

        var t = writer.statement("modus_tollens");
        assertEquals(List.of("modus_tollens.h1", "modus_tollens.h2"), t.hypotheses().stream().map(DatabaseWriter.Statement::label).toList());
        assertEquals(mt.steps().size(), t.proof().size());
        assertEquals("con3", t.proof().get(2).ref());
        assertEquals("modus_tollens.h1", t.proof().get(0).label());
        assertEquals(List.of("modus_tollens.h1", "s1"), t.proof().get(3).operands());
        var stepLabels = t.proof().stream().map(DatabaseWriter.ProofLine::label).toList();
        for (var line : t.proof())
            for (var operand : line.operands()) assertTrue(stepLabels.contains(operand), operand);

        var s = writer.statement("syl");
        assertEquals(List.of("syl.1", "syl.2"), s.hypotheses().stream().map(DatabaseWriter.Statement::label).toList());
    }

    @Test
    void labelsAreEmittedOnce() {
        emitter.emitAxioms(sys);
        assertThrows(IllegalStateException.class, () -> emitter.emitAxioms(sys));
    }

    @Test
    void onlyEmittedLabelsCanBeExported() {
        emitter.emitAxioms(sys);
        assertThrows(IllegalArgumentException.class, () -> emitter.export(List.of("A1", "wi")));
        emitter.export(List.of("A1", "A2", "A1"));
        assertEquals(List.of("A1", "A2"), writer.exports);
    }

    private record Written(String kind, String label, String typecode, List<String> tokens,
                           List<DatabaseWriter.Statement> hypotheses, List<DatabaseWriter.ProofLine> proof) {
    }

    private static final class RecordingWriter implements DatabaseWriter {
        final List<String> constants = new ArrayList<>();
        final List<String> variables = new ArrayList<>();
        final List<Written> statements = new ArrayList<>();
        final List<String> exports = new ArrayList<>();

        @Override
        public void constants(List<String> names) {
            constants.addAll(names);
        }

        @Override
        public void variables(List<String> names) {
            variables.addAll(names);
        }

        @Override
        public void axiom(String label, String typecode, List<String> tokens) {
            statements.add(new Written("axiom", label, typecode, tokens, List.of(), List.of()));
        }

        @Override
        public void hypothesisBlock(String label, String typecode, List<String> tokens, List<Statement> hypotheses) {
            statements.add(new Written("rule", label, typecode, tokens, hypotheses, List.of()));
        }

        @Override
        public void theorem(String label, String typecode, List<String> tokens, List<Statement> hypotheses, List<ProofLine> proof) {
            statements.add(new Written("theorem", label, typecode, tokens, hypotheses, proof));
        }

        @Override
        public void export(List<String> labels) {
            exports.addAll(labels);
        }

        List<String> labels() {
            return statements.stream().map(Written::label).toList();
        }

        Written statement(String label) {
            return statements.stream().filter(s -> s.label().equals(label)).findFirst().orElseThrow();
        }
    }
}
