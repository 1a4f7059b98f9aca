package dumb.hilbert.proof;

import dumb.hilbert.AbstractLogicTest;
import dumb.hilbert.LogicException;
import dumb.hilbert.ReferentialIntegrityError;
import dumb.hilbert.ShapeError;
import dumb.hilbert.TypingError;
import dumb.hilbert.compile.Connectives;
import dumb.hilbert.compile.Expr;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ProofBuilderTest extends AbstractLogicTest {

    @Test
    void identityFromTwoInstancesOfA1AndOneOfA2() {
        var lb = new ProofBuilder(sys, "id");
        var s1 = lb.ref("s1", "ph -> ( ph -> ph )", "A1", "A1");
        var s2 = lb.ref("s2", "( ph -> ( ( ph -> ph ) -> ph ) ) -> ( ( ph -> ( ph -> ph ) ) -> ( ph -> ph ) )", "A2", "A2");
        var s3 = lb.ref("s3", "ph -> ( ( ph -> ph ) -> ph )", "A1", "A1");
        var s4 = lb.infer("s4", s2, s3, "MP s3, s2");
        var s5 = lb.infer("s5", s4, s1, "MP s1, s4");
        var proof = lb.finish(s5);

        assertEquals(sys.compile(Connectives.imp(Expr.var("φ"), Expr.var("φ")), "independent"), proof.statement());
        assertEquals(5, proof.steps().size());
        assertEquals(Set.of("A1", "A2"), proof.references());
        var last = proof.step("s5").orElseThrow();
        assertEquals(StepKind.INFERENCE, last.kind());
        assertEquals(List.of("s1", "s4"), last.operands());
        assertTrue(last.reference().isEmpty());
    }

    @Test
    void inferenceRejectsFormulasFromOutsideTheBuilder() {
        var outside = wff("ph -> ps");
        var lb = new ProofBuilder(sys, "leak");
        var ph = lb.hyp("h1", "ph");
        var inside = lb.hyp("h2", "ph -> ps");
        assertEquals(inside, outside);

        var e = assertThrows(ReferentialIntegrityError.class, () -> lb.infer("s3", outside, ph, "MP"));
        assertEquals(LogicException.Kind.REFERENTIAL_INTEGRITY, e.kind());
        assertEquals("leak[s3]", e.context());

        assertEquals(wff("ps"), lb.infer("s3", inside, ph, "MP"));
    }

    @Test
    void referenceOperandsMustComeFromTheBuilder() {
        var lb = new ProofBuilder(sys, "ops");
        lb.hyp("h1", "ph -> ps");
        assertThrows(ReferentialIntegrityError.class,
                () -> lb.ref("s2", "-. ps -> -. ph", "con3i", "con3i", wff("ph -> ps")));
    }

    @Test
    void stepLabelsAreUnique() {
        var lb = new ProofBuilder(sys, "dup");
        lb.hyp("h", "ph");
        var e = assertThrows(ReferentialIntegrityError.class, () -> lb.hyp("h", "ps"));
        assertEquals("dup[h]", e.context());
    }

    @Test
    void statementMustBeTheLastStep() {
        var lb = new ProofBuilder(sys, "order");
        var first = lb.hyp("h1", "ph");
        lb.hyp("h2", "ps");
        assertThrows(ReferentialIntegrityError.class, () -> lb.finish(first));
        assertThrows(ReferentialIntegrityError.class, () -> lb.finish(wff("ps")));
    }

    @Test
    void emptyProofCannotFinish() {
        var lb = new ProofBuilder(sys, "empty");
        var e = assertThrows(ReferentialIntegrityError.class, () -> lb.finish(wff("ph")));
        assertEquals("empty[finish]", e.context());
    }

    @Test
    void finishedBuilderAcceptsNothingMore() {
        var lb = new ProofBuilder(sys, "done");
        var h = lb.opaque("res", "ph -> ph", "Imported");
        var proof = lb.finish(h);
        assertEquals(StepKind.OPAQUE, proof.steps().get(0).kind());
        assertThrows(IllegalStateException.class, () -> lb.hyp("more", "ph"));
        assertThrows(IllegalStateException.class, () -> lb.finish(h));
    }

    @Test
    void ruleAndCompileFailuresPropagate() {
        var lb = new ProofBuilder(sys, "bad");
        var ph = lb.hyp("h1", "ph");
        var neg = lb.hyp("h2", "-. ph");
        var shape = assertThrows(ShapeError.class, () -> lb.infer("s3", neg, ph, "MP"));
        assertEquals("bad[s3]", shape.context());
        var typing = assertThrows(TypingError.class, () -> lb.hyp("s4", "A. x ph"));
        assertEquals("bad[s4]", typing.context());
    }

    @Test
    void proofRecordChecksItsSteps() {
        var f = wff("ph");
        var g = wff("ps");
        var h = new ProofStep("h", f, StepKind.HYPOTHESIS, List.of(), null, "hypothesis");
        var dangling = new ProofStep("s", g, StepKind.INFERENCE, List.of("x"), null, "MP");
        assertThrows(IllegalArgumentException.class, () -> new Proof("p", g, List.of(h, dangling)));
        assertThrows(IllegalArgumentException.class, () -> new Proof("p", g, List.of(h)));
        assertThrows(IllegalArgumentException.class, () -> new Proof("p", f, List.of(h, h)));
        assertThrows(IllegalArgumentException.class, () -> new ProofStep("r", f, StepKind.REFERENCE, List.of(), null, "cite"));
        assertThrows(IllegalArgumentException.class, () -> new Proof("p", f, List.of()));
    }

    @Test
    void jsonViewListsSteps() {
        var lb = new ProofBuilder(sys, "a1i");
        var hyp = lb.hyp("a1i.1", "ph");
        var a1 = lb.ref("s1", "ph -> ( ps -> ph )", "A1", "A1");
        var proof = lb.finish(lb.infer("s2", a1, hyp, "MP"));
        var json = proof.toJson();
        assertEquals("a1i", json.getString("name"));
        assertEquals(3, json.getJSONArray("steps").length());
        assertEquals("A1", json.getJSONArray("steps").getJSONObject(1).getString("ref"));
        assertEquals(1, proof.hypotheses().size());
    }
}
