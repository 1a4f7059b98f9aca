package dumb.hilbert.proof;

import dumb.hilbert.formula.Formula;
import org.jetbrains.annotations.Nullable;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public record ProofStep(String label, Formula formula, StepKind kind, List<String> operands, @Nullable String ref, String note) {
    public ProofStep {
        requireNonNull(label);
        requireNonNull(formula);
        requireNonNull(kind);
        operands = List.copyOf(requireNonNull(operands));
        requireNonNull(note);
        if (kind == StepKind.REFERENCE && ref == null)
            throw new IllegalArgumentException("Reference step " + label + " without reference name");
    }

    public Optional<String> reference() {
        return Optional.ofNullable(ref);
    }

    public JSONObject toJson() {
        var json = new JSONObject()
                .put("label", label)
                .put("kind", kind.name())
                .put("formula", formula.toJson())
                .put("operands", new JSONArray(operands))
                .put("note", note);
        if (ref != null) json.put("ref", ref);
        return json;
    }
}
