package dumb.hilbert.emit;

import dumb.hilbert.formula.Formula;
import dumb.hilbert.symbol.SymbolTable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** External token names: {@code c<id>} for constants, {@code v<id>} for variables. */
public final class TokenNames {
    private final SymbolTable table;

    public TokenNames(SymbolTable table) {
        this.table = requireNonNull(table);
    }

    public String name(int id) {
        return (table.get(id).isConstant() ? "c" : "v") + id;
    }

    public List<String> names(Formula formula) {
        return formula.tokens().stream().map(this::name).toList();
    }
}
