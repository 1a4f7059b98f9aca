package dumb.hilbert.system;

import dumb.hilbert.compile.Connectives;
import dumb.hilbert.compile.Signature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Static description of a logic: its connectives, its axiom schemas as formula text, the default
 * origin for its variables and the mapping from set.mm labels to local labels.
 */
public final class Language {

    private static final List<Connective> PROPOSITIONAL_CONNECTIVES = List.of(
            new Connective(Connectives.IMP, "wi", Signature.wff(2, "implication"), Connectives.IMP_LOWERING),
            new Connective(Connectives.NOT, "wn", Signature.wff(1, "negation"), Connectives.NOT_LOWERING),
            new Connective(Connectives.AND, "wa", Signature.wff(2, "conjunction"), Connectives.AND_LOWERING));

    public static final Language PROPOSITIONAL = new Language("propositional", "hilbert",
            PROPOSITIONAL_CONNECTIVES,
            axioms(
                    "A1", "ph -> ( ps -> ph )",
                    "A2", "( ph -> ( ps -> ch ) ) -> ( ( ph -> ps ) -> ( ph -> ch ) )",
                    "A3", "( -. ph -> -. ps ) -> ( ps -> ph )"),
            Map.of("ax-1", "A1", "ax-2", "A2", "ax-3", "A3", "ax-mp", "mp"));

    public static final Language PREDICATE = new Language("predicate", "predicate",
            concat(PROPOSITIONAL_CONNECTIVES, List.of(
                    new Connective(Connectives.FORALL, "wal", Signature.wff(2, "binary forall over wff (var placeholder)"), Connectives.FORALL_LOWERING),
                    new Connective(Connectives.EXISTS, "wex", Signature.wff(2, "binary exists over wff (var placeholder)"), Connectives.EXISTS_LOWERING),
                    new Connective(Connectives.EQ, "weq", Signature.wff(2, "equality"), Connectives.EQ_LOWERING),
                    new Connective(Connectives.ELEM, "wel", Signature.wff(2, "membership"), Connectives.ELEM_LOWERING))),
            axioms(
                    "AX5", "ph -> A. x ph",
                    "AX6", "-. A. x -. x = y",
                    "AX7", "x = y -> ( x = z -> y = z )",
                    "AX8", "x = y -> ( x e. z -> y e. z )",
                    "AX9", "x = y -> ( z e. x -> z e. y )",
                    "AX10", "-. A. x ph -> A. x -. A. x ph",
                    "AX11", "A. x A. y ph -> A. y A. x ph",
                    "AX12", "x = y -> ( A. y ph -> A. x ( x = y -> ph ) )",
                    "AX13", "-. x = y -> ( y = z -> A. x y = z )"),
            Map.of("ax-5", "AX5", "ax-6", "AX6", "ax-7", "AX7", "ax-8", "AX8", "ax-9", "AX9",
                    "ax-10", "AX10", "ax-11", "AX11", "ax-12", "AX12", "ax-13", "AX13"));

    private final String name;
    private final String defaultOrigin;
    private final List<Connective> connectives;
    private final Map<String, String> axioms;
    private final Map<String, String> setmmLabels;

    public Language(String name, String defaultOrigin, List<Connective> connectives, Map<String, String> axioms, Map<String, String> setmmLabels) {
        this.name = requireNonNull(name);
        this.defaultOrigin = requireNonNull(defaultOrigin);
        this.connectives = List.copyOf(connectives);
        this.axioms = Collections.unmodifiableMap(new LinkedHashMap<>(axioms));
        this.setmmLabels = Map.copyOf(setmmLabels);
    }

    private static Map<String, String> axioms(String... labelAndText) {
        var m = new LinkedHashMap<String, String>();
        for (var i = 0; i < labelAndText.length; i += 2) m.put(labelAndText[i], labelAndText[i + 1]);
        return m;
    }

    private static List<Connective> concat(List<Connective> a, List<Connective> b) {
        var out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }

    public String name() {
        return name;
    }

    public String defaultOrigin() {
        return defaultOrigin;
    }

    public List<Connective> connectives() {
        return connectives;
    }

    /** Axiom label to formula text, in declaration order. */
    public Map<String, String> axioms() {
        return axioms;
    }

    /** set.mm label to local axiom or rule label. */
    public Map<String, String> setmmLabels() {
        return setmmLabels;
    }

    @Override
    public String toString() {
        return name;
    }
}
