package dumb.hilbert.compile;

import dumb.hilbert.AbstractLogicTest;
import dumb.hilbert.LogicException;
import dumb.hilbert.TypingError;
import dumb.hilbert.formula.Sort;
import dumb.hilbert.system.Language;
import dumb.hilbert.system.LogicSystem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dumb.hilbert.compile.Connectives.imp;
import static dumb.hilbert.compile.Connectives.not;
import static org.junit.jupiter.api.Assertions.*;

class CompilerTest extends AbstractLogicTest {

    private static final Expr.Var PH = Expr.var("φ");
    private static final Expr.Var PS = Expr.var("ψ");

    @Test
    void compilationIsDeterministic() {
        var expr = imp(not(PH), imp(PS, PH));
        var a = Compiler.compile(expr, sys.env(), "a");
        var b = Compiler.compile(expr, sys.env(), "b");
        assertEquals(a, b);
        assertNotSame(a, b);
    }

    @Test
    void implicationLowersToParenthesizedInfix() {
        var b = sys.builtins();
        var ph = interner.variable("φ", "hilbert").id();
        var ps = interner.variable("ψ", "hilbert").id();
        assertEquals(List.of(b.lparen, ph, b.imp, ps, b.rparen), sys.compile(imp(PH, PS), "t").tokens());
        assertEquals(List.of(b.not, ph), sys.compile(not(PH), "t").tokens());
    }

    @Test
    void unknownConstructorIsATypingError() {
        var xor = new Constructor("⊕", 2);
        var e = assertThrows(TypingError.class, () -> sys.compile(xor.apply(PH, PS), "lemma[s1]"));
        assertEquals(LogicException.Kind.TYPING, e.kind());
        assertEquals("lemma[s1]", e.context());
        assertTrue(e.getMessage().startsWith("lemma[s1]: "), e.getMessage());
        assertTrue(e.detail().contains("unknown constructor"), e.detail());
    }

    @Test
    void operandCountMustMatchTheSignature() {
        var e = assertThrows(TypingError.class, () -> sys.compile(Connectives.IMP.apply(PH), "t"));
        assertTrue(e.detail().contains("expects 2 operands, got 1"), e.detail());
    }

    @Test
    void declaredArityMustMatchTheSignature() {
        var ternary = new Constructor(Connectives.IMP.name(), 3);
        var e = assertThrows(TypingError.class, () -> sys.compile(ternary.apply(PH, PS, PH), "t"));
        assertTrue(e.detail().contains("declared with arity 3"), e.detail());
    }

    @Test
    void operandSortsAreChecked() {
        var setvar = new Expr.Var("x", Sort.of("setvar"));
        var e = assertThrows(TypingError.class, () -> sys.compile(imp(setvar, PH), "t"));
        assertTrue(e.detail().contains("operand 1"), e.detail());
    }

    @Test
    void constantsMustBeDeclared() {
        assertThrows(TypingError.class, () -> sys.compile(imp(Expr.constant("⊤"), PH), "t"));
        interner.constant("⊤");
        var f = sys.compile(imp(Expr.constant("⊤"), PH), "t");
        assertEquals(interner.lookupConstant("⊤").id(), f.token(1));
    }

    @Test
    void operatorTokensAreNotAtoms() {
        for (var token : List.of("→", "¬", "∧", "(", ")", "∀", "∃", "=", "∈")) {
            var e = assertThrows(TypingError.class, () -> sys.compile(not(Expr.constant(token)), "t"), token);
            assertTrue(e.detail().contains("reserved token"), e.detail());
        }
    }

    @Test
    void nestingDepthIsBounded() {
        Expr deep = PH;
        for (var i = 0; i < 100; i++) deep = not(deep);
        var expr = deep;

        var e = assertThrows(TypingError.class, () -> sys.compile(expr, "deep"));
        assertTrue(e.detail().contains("maximum depth 64"), e.detail());

        var roomy = LogicSystem.make(Language.PROPOSITIONAL, interner, "roomy", 200);
        assertEquals(101, roomy.compile(expr, "deep").size());
    }

    @Test
    void variablesAreScopedByOriginButConstantsAreShared() {
        var here = sys.compile(not(PH), "t");
        var there = Compiler.compile(not(PH), sys.authorEnv("elsewhere"), "t");
        assertEquals(here.token(0), there.token(0));
        assertNotEquals(here.token(1), there.token(1));
        assertEquals("elsewhere", interner.symbol(there.token(1)).namespace());
    }

    @Test
    void builtinNamespaceIsNotAnOrigin() {
        assertThrows(IllegalArgumentException.class, () -> sys.authorEnv(""));
    }

    @Test
    void definitionsExpandToCoreConnectives() {
        var or = Definition.DEFINITIONS.get("Or");
        assertSame(Definition.OR, or);
        assertEquals(wff("-. ph -> ps"), sys.compile(or.expand(PH, PS), "t"));

        var e = assertThrows(TypingError.class, () -> or.expand(PH));
        assertEquals("definition[Or]", e.context());
    }

    @Test
    void signatureRegistryRejectsDuplicates() {
        var builder = SignatureRegistry.builder().require("wi", Signature.wff(2, null));
        assertThrows(IllegalStateException.class, () -> builder.require("wi", Signature.wff(2, null)));
        var registry = builder.build();
        assertEquals(2, registry.require("wi", "t").arity());
        assertThrows(TypingError.class, () -> registry.require("wn", "t"));
    }
}
