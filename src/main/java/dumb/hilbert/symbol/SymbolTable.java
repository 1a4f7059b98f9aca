package dumb.hilbert.symbol;

import dumb.hilbert.formula.Formula;
import org.json.JSONArray;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable point-in-time copy of an interner's symbols, indexed by id.
 */
public final class SymbolTable {
    private final List<Symbol> symbols;

    SymbolTable(List<Symbol> symbols) {
        this.symbols = List.copyOf(symbols);
    }

    public Symbol get(int id) {
        if (id < 0 || id >= symbols.size())
            throw new IllegalArgumentException("Symbol id " + id + " not present in snapshot of " + symbols.size());
        return symbols.get(id);
    }

    public boolean contains(int id) {
        return id >= 0 && id < symbols.size();
    }

    public int size() {
        return symbols.size();
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    /** Display names of the formula's tokens joined by single spaces. */
    public String render(Formula formula) {
        return formula.tokens().stream().map(id -> get(id).name()).collect(Collectors.joining(" "));
    }

    public JSONArray toJson() {
        var array = new JSONArray();
        symbols.forEach(s -> array.put(s.toJson()));
        return array;
    }
}
