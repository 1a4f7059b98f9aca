package dumb.hilbert.symbol;

import org.json.JSONObject;

import static java.util.Objects.requireNonNull;

/**
 * An interned name. The id is stable for the lifetime of the interner that issued it.
 */
public record Symbol(int id, String name, String namespace, SymbolKind kind) {
    public Symbol {
        requireNonNull(name);
        requireNonNull(namespace);
        requireNonNull(kind);
        if (id < 0) throw new IllegalArgumentException("Negative symbol id: " + id);
        if (name.isEmpty()) throw new IllegalArgumentException("Empty symbol name");
    }

    public boolean isConstant() {
        return kind == SymbolKind.CONSTANT;
    }

    public boolean isVariable() {
        return kind == SymbolKind.VARIABLE;
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("id", id)
                .put("name", name)
                .put("namespace", namespace)
                .put("kind", kind.name());
    }
}
