package dumb.hilbert.proof;

import dumb.hilbert.formula.Formula;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * An immutable, finished proof. The statement is the formula of the last step; operand labels
 * of every step name earlier steps.
 */
public record Proof(String name, Formula statement, List<ProofStep> steps) {
    public Proof {
        requireNonNull(name);
        requireNonNull(statement);
        steps = List.copyOf(requireNonNull(steps));
        if (steps.isEmpty()) throw new IllegalArgumentException("Proof " + name + " has no steps");
        var seen = new HashSet<String>();
        for (var s : steps) {
            for (var op : s.operands())
                if (!seen.contains(op))
                    throw new IllegalArgumentException("Step " + s.label() + " of " + name + " cites " + op + " which is not an earlier step");
            if (!seen.add(s.label()))
                throw new IllegalArgumentException("Duplicate step label " + s.label() + " in " + name);
        }
        if (!steps.get(steps.size() - 1).formula().equals(statement))
            throw new IllegalArgumentException("Statement of " + name + " differs from its last step");
    }

    public List<ProofStep> hypotheses() {
        return steps.stream().filter(s -> s.kind() == StepKind.HYPOTHESIS).toList();
    }

    /** Names cited by reference steps, in order of first citation. */
    public Set<String> references() {
        var refs = new LinkedHashSet<String>();
        for (var s : steps)
            if (s.kind() == StepKind.REFERENCE) refs.add(s.ref());
        return refs;
    }

    public Optional<ProofStep> step(String label) {
        return steps.stream().filter(s -> s.label().equals(label)).findFirst();
    }

    public JSONObject toJson() {
        var jsonSteps = new JSONArray();
        steps.forEach(s -> jsonSteps.put(s.toJson()));
        return new JSONObject()
                .put("name", name)
                .put("statement", statement.toJson())
                .put("steps", jsonSteps);
    }
}
