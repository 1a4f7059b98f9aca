package dumb.hilbert.formula;

import dumb.hilbert.symbol.SymbolInterner;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The operator and punctuation constants shared by the propositional and predicate languages,
 * and the token arrangements built from them.
 * <p>
 * Binary connectives are always parenthesized, so an implication can be split at the single
 * arrow found at parenthesis depth zero.
 */
public final class Builtins {
    public static final String LPAREN = "(", RPAREN = ")";
    public static final String IMP = "→", NOT = "¬", AND = "∧";
    public static final String FORALL = "∀", EXISTS = "∃", EQ = "=", ELEM = "∈";

    public final int lparen, rparen, imp, not, and, forall, exists, eq, elem;
    private final SymbolInterner interner;

    private Builtins(SymbolInterner interner) {
        this.interner = interner;
        lparen = interner.constant(LPAREN).id();
        rparen = interner.constant(RPAREN).id();
        imp = interner.constant(IMP).id();
        not = interner.constant(NOT).id();
        and = interner.constant(AND).id();
        forall = interner.constant(FORALL).id();
        exists = interner.constant(EXISTS).id();
        eq = interner.constant(EQ).id();
        elem = interner.constant(ELEM).id();
    }

    /** Interns the builtin constants, reusing existing identities when already present. */
    public static Builtins ensure(SymbolInterner interner) {
        return new Builtins(requireNonNull(interner));
    }

    public SymbolInterner interner() {
        return interner;
    }

    /** Operator and punctuation tokens, which may never stand alone as an atom. */
    public boolean isReserved(int id) {
        return id == lparen || id == rparen || id == imp || id == not || id == and
                || id == forall || id == exists || id == eq || id == elem;
    }

    public List<Integer> imp(Formula a, Formula b) {
        return infix(a, imp, b);
    }

    public List<Integer> and(Formula a, Formula b) {
        return infix(a, and, b);
    }

    public List<Integer> not(Formula a) {
        return prefix(not, a);
    }

    public List<Integer> forall(Formula var, Formula body) {
        return binder(forall, var, body);
    }

    public List<Integer> exists(Formula var, Formula body) {
        return binder(exists, var, body);
    }

    public List<Integer> eq(Formula a, Formula b) {
        return relation(a, eq, b);
    }

    public List<Integer> elem(Formula a, Formula b) {
        return relation(a, elem, b);
    }

    /**
     * Splits {@code ( A → B )} into its operands. Returns empty when the tokens are not an
     * implication or either side is empty.
     */
    public Optional<ImplicationShape> tryParseImp(List<Integer> tokens) {
        var n = tokens.size();
        if (n < 5 || tokens.get(0) != lparen || tokens.get(n - 1) != rparen) return Optional.empty();
        var depth = 0;
        for (var i = 1; i < n - 1; i++) {
            int t = tokens.get(i);
            if (t == lparen) depth++;
            else if (t == rparen) {
                if (--depth < 0) return Optional.empty();
            } else if (t == imp && depth == 0) {
                if (i == 1 || i == n - 2) return Optional.empty();
                return Optional.of(new ImplicationShape(tokens.subList(1, i), tokens.subList(i + 1, n - 1)));
            }
        }
        return Optional.empty();
    }

    private List<Integer> infix(Formula a, int op, Formula b) {
        var out = new ArrayList<Integer>(a.size() + b.size() + 3);
        out.add(lparen);
        out.addAll(a.tokens());
        out.add(op);
        out.addAll(b.tokens());
        out.add(rparen);
        return out;
    }

    private static List<Integer> prefix(int op, Formula a) {
        var out = new ArrayList<Integer>(a.size() + 1);
        out.add(op);
        out.addAll(a.tokens());
        return out;
    }

    private static List<Integer> binder(int op, Formula var, Formula body) {
        var out = new ArrayList<Integer>(var.size() + body.size() + 1);
        out.add(op);
        out.addAll(var.tokens());
        out.addAll(body.tokens());
        return out;
    }

    private static List<Integer> relation(Formula a, int op, Formula b) {
        var out = new ArrayList<Integer>(a.size() + b.size() + 1);
        out.addAll(a.tokens());
        out.add(op);
        out.addAll(b.tokens());
        return out;
    }
}
