package dumb.hilbert.deps;

import dumb.hilbert.proof.Proof;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The closed, reference-complete set of lemmas produced by {@link DependencyResolver}, keyed by
 * name in registration order. {@code constructions} counts constructor invocations, which may
 * exceed the number of lemmas when a lemma was built again before its first build was registered.
 */
public record Resolution(Map<String, Proof> lemmas, int constructions) {
    public Resolution {
        lemmas = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(lemmas)));
        if (constructions < lemmas.size())
            throw new IllegalArgumentException("constructions " + constructions + " < lemmas " + lemmas.size());
    }

    public List<String> names() {
        return List.copyOf(lemmas.keySet());
    }

    public List<Proof> proofs() {
        return List.copyOf(lemmas.values());
    }

    public Optional<Proof> get(String name) {
        return Optional.ofNullable(lemmas.get(name));
    }

    public boolean contains(String name) {
        return lemmas.containsKey(name);
    }

    public int size() {
        return lemmas.size();
    }
}
