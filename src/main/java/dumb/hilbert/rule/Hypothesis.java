package dumb.hilbert.rule;

import dumb.hilbert.formula.Formula;

import static java.util.Objects.requireNonNull;

/** A formula handed to a rule together with a label for error messages. */
public record Hypothesis(String label, Formula body) {
    public Hypothesis {
        requireNonNull(label);
        requireNonNull(body);
    }
}
