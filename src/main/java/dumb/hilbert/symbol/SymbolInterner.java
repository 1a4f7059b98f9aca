package dumb.hilbert.symbol;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Issues stable integer identities for (name, namespace) pairs.
 * <p>
 * Lookups go through a concurrent map; assigning a new identity happens inside a critical
 * section so that concurrent callers interning the same pair observe the same {@link Symbol}.
 * Constants live in {@link #BUILTIN_NAMESPACE} and are shared by every compilation origin.
 */
public final class SymbolInterner {
    public static final String BUILTIN_NAMESPACE = "";

    private static final Logger logger = LoggerFactory.getLogger(SymbolInterner.class);

    private final Map<Key, Symbol> byKey = new ConcurrentHashMap<>(256);
    private final List<Symbol> byId = new ArrayList<>(256);
    private final Object insertLock = new Object();

    public Symbol intern(String name, String namespace, SymbolKind kind) {
        requireNonNull(kind);
        var key = new Key(requireNonNull(name), requireNonNull(namespace));
        var existing = byKey.get(key);
        if (existing == null) {
            synchronized (insertLock) {
                existing = byKey.get(key);
                if (existing == null) {
                    var created = new Symbol(byId.size(), name, namespace, kind);
                    byId.add(created);
                    byKey.put(key, created);
                    logger.trace("interned {} as {} ({})", key, created.id(), kind);
                    return created;
                }
            }
        }
        if (existing.kind() != kind)
            throw new IllegalStateException("Symbol '" + name + "' in namespace '" + namespace + "' already interned as " + existing.kind() + ", requested " + kind);
        return existing;
    }

    public Symbol constant(String name) {
        return intern(name, BUILTIN_NAMESPACE, SymbolKind.CONSTANT);
    }

    public Symbol variable(String name, String namespace) {
        return intern(name, namespace, SymbolKind.VARIABLE);
    }

    /** The already interned constant named {@code name}, or null. */
    public Symbol lookupConstant(String name) {
        return byKey.get(new Key(requireNonNull(name), BUILTIN_NAMESPACE));
    }

    public Symbol symbol(int id) {
        synchronized (insertLock) {
            if (id < 0 || id >= byId.size()) throw new IllegalArgumentException("Unknown symbol id: " + id);
            return byId.get(id);
        }
    }

    public SymbolKind kindOf(int id) {
        return symbol(id).kind();
    }

    public int size() {
        synchronized (insertLock) {
            return byId.size();
        }
    }

    public SymbolTable snapshot() {
        synchronized (insertLock) {
            return new SymbolTable(byId);
        }
    }

    private record Key(String name, String namespace) {
        @Override
        public String toString() {
            return namespace.isEmpty() ? name : namespace + "::" + name;
        }
    }
}
