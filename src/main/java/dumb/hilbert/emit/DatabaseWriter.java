package dumb.hilbert.emit;

import org.jetbrains.annotations.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Receives compiled statements for the target verifier database. Tokens are external names
 * (see {@link TokenNames}), never symbol identities.
 */
public interface DatabaseWriter {

    void constants(List<String> names);

    void variables(List<String> names);

    void axiom(String label, String typecode, List<String> tokens);

    /** An axiomatic rule scoped together with the essential hypotheses it consumes. */
    void hypothesisBlock(String label, String typecode, List<String> tokens, List<Statement> hypotheses);

    void theorem(String label, String typecode, List<String> tokens, List<Statement> hypotheses, List<ProofLine> proof);

    /** Labels visible outside this build unit. */
    void export(List<String> labels);

    record Statement(String label, String typecode, List<String> tokens) {
        public Statement {
            requireNonNull(label);
            requireNonNull(typecode);
            tokens = List.copyOf(tokens);
        }
    }

    record ProofLine(String label, String kind, List<String> tokens, List<String> operands, @Nullable String ref, String note) {
        public ProofLine {
            requireNonNull(label);
            requireNonNull(kind);
            tokens = List.copyOf(tokens);
            operands = List.copyOf(operands);
            requireNonNull(note);
        }
    }
}
