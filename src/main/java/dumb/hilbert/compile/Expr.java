package dumb.hilbert.compile;

import dumb.hilbert.formula.Sort;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Authoring level expression tree, lowered to a {@link dumb.hilbert.formula.Formula} by the
 * {@link Compiler}.
 */
public sealed interface Expr permits Expr.Var, Expr.Const, Expr.App {

    static Var var(String name) {
        return new Var(name, Sort.WFF);
    }

    static Const constant(String name) {
        return new Const(name);
    }

    /** A formal variable, interned under the compilation origin. */
    record Var(String name, Sort sort) implements Expr {
        public Var {
            requireNonNull(name);
            requireNonNull(sort);
            if (name.isBlank()) throw new IllegalArgumentException("Blank variable name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** A reference to an already declared constant symbol. */
    record Const(String name) implements Expr {
        public Const {
            requireNonNull(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record App(Constructor ctor, List<Expr> args) implements Expr {
        public App {
            requireNonNull(ctor);
            args = List.copyOf(requireNonNull(args));
        }

        @Override
        public String toString() {
            return args.stream().map(Object::toString).collect(Collectors.joining(" ", "(" + ctor.name() + " ", ")"));
        }
    }
}
