package dumb.hilbert.compile;

import dumb.hilbert.formula.Sort;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Operand sorts and result sort of a constructor or rule. The arity is the number of operand
 * sorts.
 */
public record Signature(List<Sort> inSorts, Sort outSort, @Nullable String notes) {
    public Signature {
        inSorts = List.copyOf(requireNonNull(inSorts));
        requireNonNull(outSort);
    }

    public static Signature of(Sort outSort, Sort... inSorts) {
        return new Signature(List.of(inSorts), outSort, null);
    }

    /** {@code arity} operands of sort wff producing a wff. */
    public static Signature wff(int arity, @Nullable String notes) {
        return new Signature(Collections.nCopies(arity, Sort.WFF), Sort.WFF, notes);
    }

    public int arity() {
        return inSorts.size();
    }

    public Sort inSort(int index) {
        return inSorts.get(index);
    }
}
