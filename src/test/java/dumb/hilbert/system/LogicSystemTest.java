package dumb.hilbert.system;

import dumb.hilbert.AbstractLogicTest;
import dumb.hilbert.TypingError;
import dumb.hilbert.compile.FormulaParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogicSystemTest extends AbstractLogicTest {

    @Test
    void propositionalAxiomsCompileInOrder() {
        var axioms = sys.compileAxioms();
        assertEquals(List.of("A1", "A2", "A3"), List.copyOf(axioms.keySet()));
        assertEquals(wff("ph -> ( ps -> ph )"), axioms.get("A1"));
        assertEquals(wff("( -. ph -> -. ps ) -> ( ps -> ph )"), axioms.get("A3"));
    }

    @Test
    void predicateAxiomsCompile() {
        var pred = LogicSystem.predicate(interner);
        var axioms = pred.compileAxioms();
        assertEquals(List.of("AX5", "AX6", "AX7", "AX8", "AX9", "AX10", "AX11", "AX12", "AX13"), List.copyOf(axioms.keySet()));
        var b = pred.builtins();
        assertEquals(b.not, axioms.get("AX6").token(0));
        assertEquals(b.forall, axioms.get("AX6").token(1));
        assertTrue(pred.reservedLabels().containsAll(Set.of("mp", "wi", "wn", "wa", "wal", "wex", "weq", "wel")));
    }

    @Test
    void systemsOnOneInternerShareConstantsOnly() {
        var pred = LogicSystem.predicate(interner);
        var p = sys.compile("-. ph", "t");
        var q = pred.compile("-. ph", "t");
        assertSame(sys.builtins().not, pred.builtins().not);
        assertEquals(p.token(0), q.token(0));
        assertNotEquals(p.token(1), q.token(1));
    }

    @Test
    void quantifiersAreNotPropositional() {
        var e = assertThrows(TypingError.class, () -> sys.compile("A. x ph", "authoring"));
        assertEquals("authoring", e.context());
    }

    @Test
    void unparsableTextIsATypingError() {
        var e = assertThrows(TypingError.class, () -> sys.compile("( ph ->", "axiom[bad]"));
        assertEquals("axiom[bad]", e.context());
        assertInstanceOf(FormulaParser.ParseException.class, e.getCause());
    }

    @Test
    void setmmLabelsMapToLocalNames() {
        assertEquals("A1", Language.PROPOSITIONAL.setmmLabels().get("ax-1"));
        assertEquals("mp", Language.PROPOSITIONAL.setmmLabels().get("ax-mp"));
        assertEquals("AX13", Language.PREDICATE.setmmLabels().get("ax-13"));
        for (var local : Language.PREDICATE.setmmLabels().values())
            assertTrue(Language.PREDICATE.axioms().containsKey(local), local);
    }

    @Test
    void axiomSchemasAreCompiledWithTheirLabelAsContext() {
        var tight = LogicSystem.make(Language.PROPOSITIONAL, interner, "tight", 3);
        var e = assertThrows(TypingError.class, tight::compileAxioms);
        assertEquals("compile_axiom[A2]", e.context());
    }
}
