package dumb.hilbert;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Raised once per resolution with every reference that did not resolve to an axiom, a reserved
 * label or a registered lemma.
 */
public class UnresolvedDependencyError extends LogicException {
    private final SortedMap<String, Set<String>> unresolved;

    public UnresolvedDependencyError(String context, Map<String, ? extends Set<String>> unresolved) {
        super(Kind.UNRESOLVED_DEPENDENCY, context, describe(unresolved));
        var copy = new TreeMap<String, Set<String>>();
        unresolved.forEach((ref, citers) -> copy.put(ref, Set.copyOf(citers)));
        this.unresolved = copy;
    }

    private static String describe(Map<String, ? extends Set<String>> unresolved) {
        return "unresolved references: " + new TreeMap<>(unresolved).entrySet().stream()
                .map(e -> e.getKey() + " (cited by " + String.join(", ", new TreeSet<>(e.getValue())) + ")")
                .collect(Collectors.joining(", "));
    }

    /** The unresolved names, sorted. */
    public List<String> references() {
        return List.copyOf(unresolved.keySet());
    }

    /** Names of the lemmas citing {@code reference}. */
    public Set<String> citedBy(String reference) {
        return unresolved.getOrDefault(reference, Set.of());
    }
}
