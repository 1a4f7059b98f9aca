package dumb.hilbert.compile;

import dumb.hilbert.formula.Builtins;
import dumb.hilbert.symbol.SymbolInterner;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Everything a compilation needs: the interner, the builtin tokens, the signatures and lowerings
 * of the available constructors, and the origin namespace under which variables are interned.
 * Variables with the same name compiled under different origins get different identities.
 */
public final class CompileEnv {
    public static final int DEFAULT_MAX_DEPTH = 64;

    private final Builtins builtins;
    private final SignatureRegistry signatures;
    private final Map<String, Lowering> lowerings;
    private final String origin;
    private final int maxDepth;

    public CompileEnv(Builtins builtins, SignatureRegistry signatures, Map<String, Lowering> lowerings, String origin, int maxDepth) {
        this.builtins = requireNonNull(builtins);
        this.signatures = requireNonNull(signatures);
        this.lowerings = Map.copyOf(lowerings);
        this.origin = requireNonNull(origin);
        if (origin.equals(SymbolInterner.BUILTIN_NAMESPACE))
            throw new IllegalArgumentException("Origin must not be the builtin constant namespace");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        this.maxDepth = maxDepth;
        for (var name : this.lowerings.keySet())
            if (!signatures.contains(name))
                throw new IllegalStateException("Constructor '" + name + "' has a lowering but no signature");
    }

    public CompileEnv withOrigin(String origin) {
        return new CompileEnv(builtins, signatures, lowerings, origin, maxDepth);
    }

    public SymbolInterner interner() {
        return builtins.interner();
    }

    public Builtins builtins() {
        return builtins;
    }

    public SignatureRegistry signatures() {
        return signatures;
    }

    public Optional<Lowering> lowering(String constructor) {
        return Optional.ofNullable(lowerings.get(constructor));
    }

    public String origin() {
        return origin;
    }

    public int maxDepth() {
        return maxDepth;
    }
}
