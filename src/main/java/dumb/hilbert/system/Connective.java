package dumb.hilbert.system;

import dumb.hilbert.compile.Constructor;
import dumb.hilbert.compile.Lowering;
import dumb.hilbert.compile.Signature;

import static java.util.Objects.requireNonNull;

/** A connective of a language together with the label of the syntax rule that builds it. */
public record Connective(Constructor ctor, String ruleLabel, Signature signature, Lowering lowering) {
    public Connective {
        requireNonNull(ctor);
        requireNonNull(ruleLabel);
        requireNonNull(signature);
        requireNonNull(lowering);
        if (ctor.arity() != signature.arity())
            throw new IllegalArgumentException("Connective " + ctor.name() + " has arity " + ctor.arity() + " but signature arity " + signature.arity());
    }
}
