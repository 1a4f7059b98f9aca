package dumb.hilbert.compile;

import dumb.hilbert.TypingError;
import dumb.hilbert.formula.Formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers authoring {@link Expr} trees to token level formulas, checking every node against the
 * signature registry of the environment. All failures surface as {@link TypingError} tagged with
 * the caller's context.
 */
public final class Compiler {

    private Compiler() {
    }

    public static Formula compile(Expr expr, CompileEnv env, String ctx) {
        return compile(expr, env, ctx, 1);
    }

    private static Formula compile(Expr expr, CompileEnv env, String ctx, int depth) {
        if (depth > env.maxDepth())
            throw new TypingError(ctx, "expression nesting exceeds maximum depth " + env.maxDepth());
        if (expr instanceof Expr.Var v) {
            var sym = env.interner().variable(v.name(), env.origin());
            return new Formula(v.sort(), List.of(sym.id()));
        } else if (expr instanceof Expr.Const c) {
            var sym = env.interner().lookupConstant(c.name());
            if (sym == null) throw new TypingError(ctx, "undeclared constant '" + c.name() + "'");
            if (env.builtins().isReserved(sym.id())) throw new TypingError(ctx, "reserved token '" + c.name() + "' cannot be an atom");
            return Formula.wff(List.of(sym.id()));
        } else if (expr instanceof Expr.App app) {
            return compileApp(app, env, ctx, depth);
        }
        throw new TypingError(ctx, "unsupported expression " + expr);
    }

    private static Formula compileApp(Expr.App app, CompileEnv env, String ctx, int depth) {
        var name = app.ctor().name();
        var lowering = env.lowering(name)
                .orElseThrow(() -> new TypingError(ctx, "unknown constructor '" + name + "'"));
        var sig = env.signatures().require(name, ctx);
        if (app.ctor().arity() != sig.arity())
            throw new TypingError(ctx, "constructor '" + name + "' declared with arity " + app.ctor().arity() + " but signature has " + sig.arity());
        if (app.args().size() != sig.arity())
            throw new TypingError(ctx, "'" + name + "' expects " + sig.arity() + " operands, got " + app.args().size());

        var children = new ArrayList<Formula>(sig.arity());
        for (var i = 0; i < sig.arity(); i++) {
            var child = compile(app.args().get(i), env, ctx, depth + 1);
            if (!child.sort().equals(sig.inSort(i)))
                throw new TypingError(ctx, "operand " + (i + 1) + " of '" + name + "' has sort " + child.sort() + ", expected " + sig.inSort(i));
            children.add(child);
        }
        return new Formula(sig.outSort(), lowering.lower(env.builtins(), children));
    }
}
