package dumb.hilbert.compile;

import dumb.hilbert.formula.Builtins;

/**
 * The connectives of the propositional and predicate languages, with their wff signatures and
 * token lowerings.
 */
public final class Connectives {
    public static final Constructor IMP = new Constructor(Builtins.IMP, 2);
    public static final Constructor NOT = new Constructor(Builtins.NOT, 1);
    public static final Constructor AND = new Constructor(Builtins.AND, 2);
    public static final Constructor FORALL = new Constructor(Builtins.FORALL, 2);
    public static final Constructor EXISTS = new Constructor(Builtins.EXISTS, 2);
    public static final Constructor EQ = new Constructor(Builtins.EQ, 2);
    public static final Constructor ELEM = new Constructor(Builtins.ELEM, 2);

    public static final Lowering IMP_LOWERING = (b, xs) -> b.imp(xs.get(0), xs.get(1));
    public static final Lowering NOT_LOWERING = (b, xs) -> b.not(xs.get(0));
    public static final Lowering AND_LOWERING = (b, xs) -> b.and(xs.get(0), xs.get(1));
    public static final Lowering FORALL_LOWERING = (b, xs) -> b.forall(xs.get(0), xs.get(1));
    public static final Lowering EXISTS_LOWERING = (b, xs) -> b.exists(xs.get(0), xs.get(1));
    public static final Lowering EQ_LOWERING = (b, xs) -> b.eq(xs.get(0), xs.get(1));
    public static final Lowering ELEM_LOWERING = (b, xs) -> b.elem(xs.get(0), xs.get(1));

    private Connectives() {
    }

    public static Expr.App imp(Expr a, Expr b) {
        return IMP.apply(a, b);
    }

    public static Expr.App not(Expr a) {
        return NOT.apply(a);
    }

    public static Expr.App and(Expr a, Expr b) {
        return AND.apply(a, b);
    }

    public static Expr.App forall(Expr.Var x, Expr body) {
        return FORALL.apply(x, body);
    }

    public static Expr.App exists(Expr.Var x, Expr body) {
        return EXISTS.apply(x, body);
    }

    public static Expr.App eq(Expr a, Expr b) {
        return EQ.apply(a, b);
    }

    public static Expr.App elem(Expr a, Expr b) {
        return ELEM.apply(a, b);
    }
}
