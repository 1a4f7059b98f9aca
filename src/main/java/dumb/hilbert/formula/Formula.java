package dumb.hilbert.formula;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Token level formula: a sort and an ordered sequence of symbol ids.
 * <p>
 * Equality is structural. Proof builders track provenance by object identity, so two equal
 * formulas are not interchangeable as citations.
 */
public record Formula(Sort sort, List<Integer> tokens) {
    public Formula {
        requireNonNull(sort);
        tokens = List.copyOf(requireNonNull(tokens));
        if (tokens.isEmpty()) throw new IllegalArgumentException("Formula without tokens");
    }

    public static Formula wff(List<Integer> tokens) {
        return new Formula(Sort.WFF, tokens);
    }

    public int size() {
        return tokens.size();
    }

    public int token(int index) {
        return tokens.get(index);
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("sort", sort.name())
                .put("tokens", new JSONArray(tokens));
    }

    @Override
    public String toString() {
        return sort.name() + tokens;
    }
}
