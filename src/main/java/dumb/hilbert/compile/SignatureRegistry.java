package dumb.hilbert.compile;

import dumb.hilbert.TypingError;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Immutable table of signatures keyed by constructor name or rule label. Built once when a logic
 * system is constructed.
 */
public final class SignatureRegistry {
    private final Map<String, Signature> signatures;

    private SignatureRegistry(Map<String, Signature> signatures) {
        this.signatures = Map.copyOf(signatures);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Signature> get(String label) {
        return Optional.ofNullable(signatures.get(label));
    }

    public Signature require(String label, String ctx) {
        var sig = signatures.get(label);
        if (sig == null) throw new TypingError(ctx, "no signature declared for '" + label + "'");
        return sig;
    }

    public boolean contains(String label) {
        return signatures.containsKey(label);
    }

    public Set<String> labels() {
        return signatures.keySet();
    }

    public static final class Builder {
        private final Map<String, Signature> signatures = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder require(String label, Signature signature) {
            requireNonNull(label);
            requireNonNull(signature);
            if (signatures.putIfAbsent(label, signature) != null)
                throw new IllegalStateException("Signature for '" + label + "' declared twice");
            return this;
        }

        public SignatureRegistry build() {
            return new SignatureRegistry(signatures);
        }
    }
}
