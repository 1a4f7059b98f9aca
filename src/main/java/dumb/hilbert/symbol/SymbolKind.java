package dumb.hilbert.symbol;

public enum SymbolKind {
    CONSTANT, VARIABLE
}
