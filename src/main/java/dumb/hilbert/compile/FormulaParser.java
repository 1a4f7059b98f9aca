package dumb.hilbert.compile;

import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Parses infix formula text such as {@code ( φ → ψ ) -> ¬ χ} into an {@link Expr}.
 * <p>
 * Unicode connectives and their ASCII spellings are accepted interchangeably:
 * {@code → ->}, {@code ¬ -.}, {@code ∧ /\}, {@code ∀ A.}, {@code ∃ E.}, {@code ∈ e.}, {@code =}.
 * Implication is right associative and binds loosest, then conjunction; negation and the
 * quantifiers are prefix operators over the next unary formula, and {@code =} / {@code ∈} relate
 * two atoms.
 */
public final class FormulaParser {
    private static final int CONTEXT_SIZE = 20;
    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("->", "→"), Map.entry("-.", "¬"), Map.entry("/\\", "∧"),
            Map.entry("A.", "∀"), Map.entry("E.", "∃"), Map.entry("e.", "∈"));
    private static final Map<String, String> VARIABLE_ALIASES = Map.of(
            "ph", "φ", "ps", "ψ", "ch", "χ", "th", "θ", "ta", "τ");
    private static final String OPERATOR_CHARS = "→¬∧∀∃=∈";

    private final String text;
    private int pos;
    @Nullable
    private String lookahead;

    private FormulaParser(String text) {
        this.text = text;
    }

    public static Expr parse(String text) throws ParseException {
        var parser = new FormulaParser(text);
        var expr = parser.parseImplication();
        var rest = parser.peekToken();
        if (rest != null) throw parser.createParseException("Unexpected trailing token", "'" + rest + "'");
        return expr;
    }

    private Expr parseImplication() throws ParseException {
        var left = parseConjunction();
        if ("→".equals(peekToken())) {
            nextToken();
            return Connectives.imp(left, parseImplication());
        }
        return left;
    }

    private Expr parseConjunction() throws ParseException {
        var left = parseUnary();
        while ("∧".equals(peekToken())) {
            nextToken();
            left = Connectives.and(left, parseUnary());
        }
        return left;
    }

    private Expr parseUnary() throws ParseException {
        var t = peekToken();
        if (t == null) throw createParseException("Unexpected end of formula");
        switch (t) {
            case "¬":
                nextToken();
                return Connectives.not(parseUnary());
            case "∀":
                nextToken();
                return Connectives.forall(parseBoundVariable(t), parseUnary());
            case "∃":
                nextToken();
                return Connectives.exists(parseBoundVariable(t), parseUnary());
            default:
                return parseRelation();
        }
    }

    private Expr parseRelation() throws ParseException {
        var left = parsePrimary();
        var t = peekToken();
        if ("=".equals(t)) {
            nextToken();
            return Connectives.eq(left, parsePrimary());
        } else if ("∈".equals(t)) {
            nextToken();
            return Connectives.elem(left, parsePrimary());
        }
        return left;
    }

    private Expr parsePrimary() throws ParseException {
        var t = nextToken();
        if (t == null) throw createParseException("Unexpected end of formula");
        if (t.equals("(")) {
            var inner = parseImplication();
            var close = nextToken();
            if (!")".equals(close))
                throw createParseException("Expected ')'", close == null ? "EOF" : "'" + close + "'");
            return inner;
        }
        return variable(t);
    }

    private Expr.Var parseBoundVariable(String quantifier) throws ParseException {
        var t = nextToken();
        if (t == null) throw createParseException("Expected variable after " + quantifier, "EOF");
        return variable(t);
    }

    private Expr.Var variable(String token) throws ParseException {
        if (token.equals(")") || token.length() == 1 && OPERATOR_CHARS.contains(token))
            throw createParseException("Expected variable", "'" + token + "'");
        var first = token.charAt(0);
        if (!Character.isLetter(first) && first != '_')
            throw createParseException("Invalid variable name", "'" + token + "'");
        return Expr.var(VARIABLE_ALIASES.getOrDefault(token, token));
    }

    @Nullable
    private String peekToken() {
        if (lookahead == null) lookahead = readToken();
        return lookahead;
    }

    @Nullable
    private String nextToken() {
        var t = peekToken();
        lookahead = null;
        return t;
    }

    @Nullable
    private String readToken() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
        if (pos == text.length()) return null;
        var c = text.charAt(pos);
        if (c == '(' || c == ')' || OPERATOR_CHARS.indexOf(c) != -1) {
            pos++;
            return String.valueOf(c);
        }
        var from = pos;
        while (pos < text.length() && !isDelimiter(text.charAt(pos))) pos++;
        var word = text.substring(from, pos);
        return ALIASES.getOrDefault(word, word);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || OPERATOR_CHARS.indexOf(c) != -1;
    }

    private ParseException createParseException(String message) {
        return createParseException(message, null);
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var found = foundToken != null ? " found " + foundToken : "";
        var near = text.substring(Math.max(0, pos - CONTEXT_SIZE), pos);
        return new ParseException(message + found + " at offset " + pos + (near.isBlank() ? "" : " near '" + near + "'"));
    }

    public static class ParseException extends Exception {
        public ParseException(String message) {
            super(message);
        }
    }
}
