package dumb.hilbert.formula;

import java.util.List;

/** The two operand slices of a token sequence shaped {@code ( A → B )}. */
public record ImplicationShape(List<Integer> antecedent, List<Integer> consequent) {
    public ImplicationShape {
        antecedent = List.copyOf(antecedent);
        consequent = List.copyOf(consequent);
    }
}
