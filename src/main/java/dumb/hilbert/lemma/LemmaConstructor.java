package dumb.hilbert.lemma;

import dumb.hilbert.proof.Proof;
import dumb.hilbert.system.LogicSystem;

/** Builds the proof of one lemma. Implementations must be free of side effects. */
@FunctionalInterface
public interface LemmaConstructor {
    Proof construct(LogicSystem sys);
}
