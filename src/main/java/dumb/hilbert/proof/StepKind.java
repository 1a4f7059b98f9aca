package dumb.hilbert.proof;

public enum StepKind {
    /** Hypothesis of the proved statement. */
    HYPOTHESIS,
    /** Instance of a named axiom, lemma or rule; creates a dependency edge. */
    REFERENCE,
    /** Modus Ponens over two earlier steps. */
    INFERENCE,
    /** Imported statement without justification. */
    OPAQUE
}
