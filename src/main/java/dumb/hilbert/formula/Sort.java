package dumb.hilbert.formula;

import static java.util.Objects.requireNonNull;

/** The category of a formula, used as typecode when emitted. */
public record Sort(String name) {
    public static final Sort WFF = new Sort("wff");

    public Sort {
        requireNonNull(name);
        if (name.isBlank()) throw new IllegalArgumentException("Blank sort name");
    }

    public static Sort of(String name) {
        return WFF.name.equals(name) ? WFF : new Sort(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
