package dumb.hilbert.system;

import dumb.hilbert.TypingError;
import dumb.hilbert.compile.CompileEnv;
import dumb.hilbert.compile.Compiler;
import dumb.hilbert.compile.Expr;
import dumb.hilbert.compile.FormulaParser;
import dumb.hilbert.compile.Lowering;
import dumb.hilbert.compile.SignatureRegistry;
import dumb.hilbert.formula.Builtins;
import dumb.hilbert.formula.Formula;
import dumb.hilbert.rule.ConstructorRule;
import dumb.hilbert.rule.Hypothesis;
import dumb.hilbert.rule.ModusPonens;
import dumb.hilbert.rule.Rule;
import dumb.hilbert.rule.RuleEngine;
import dumb.hilbert.symbol.SymbolInterner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * A logic bound to an interner: compilation environment, rule engine and axiom schemas.
 * <p>
 * Several systems may share one interner. They share the builtin constants but intern their
 * variables under their own origin, so the propositional φ and the predicate φ are different
 * symbols.
 */
public final class LogicSystem {
    private static final Logger logger = LoggerFactory.getLogger(LogicSystem.class);

    private final Language language;
    private final Builtins builtins;
    private final CompileEnv env;
    private final RuleEngine rules;
    private final Map<String, Expr> axioms;

    private LogicSystem(Language language, Builtins builtins, CompileEnv env, RuleEngine rules, Map<String, Expr> axioms) {
        this.language = language;
        this.builtins = builtins;
        this.env = env;
        this.rules = rules;
        this.axioms = axioms;
    }

    public static LogicSystem propositional(SymbolInterner interner) {
        return make(Language.PROPOSITIONAL, interner, Language.PROPOSITIONAL.defaultOrigin(), CompileEnv.DEFAULT_MAX_DEPTH);
    }

    public static LogicSystem predicate(SymbolInterner interner) {
        return make(Language.PREDICATE, interner, Language.PREDICATE.defaultOrigin(), CompileEnv.DEFAULT_MAX_DEPTH);
    }

    public static LogicSystem make(Language language, SymbolInterner interner, String origin, int maxDepth) {
        requireNonNull(language);
        var b = Builtins.ensure(interner);

        var sigs = SignatureRegistry.builder();
        var lowerings = new HashMap<String, Lowering>();
        var ruleList = new ArrayList<Rule>();
        ruleList.add(new ModusPonens(b));
        for (var c : language.connectives()) {
            sigs.require(c.ctor().name(), c.signature());
            lowerings.put(c.ctor().name(), c.lowering());
            ruleList.add(new ConstructorRule(c.ruleLabel(), c.signature(), c.lowering(), b));
        }
        var env = new CompileEnv(b, sigs.build(), lowerings, origin, maxDepth);
        var engine = RuleEngine.of(ruleList);

        var axioms = new LinkedHashMap<String, Expr>();
        language.axioms().forEach((label, text) -> {
            if (engine.has(label)) throw new IllegalStateException("Axiom label " + label + " collides with a rule label");
            axioms.put(label, parse(text, "axiom[" + label + "]"));
        });
        logger.debug("made {} system: origin={}, rules={}, axioms={}", language, origin, engine.labels(), axioms.keySet());
        return new LogicSystem(language, b, env, engine, Collections.unmodifiableMap(axioms));
    }

    private static Expr parse(String text, String ctx) {
        try {
            return FormulaParser.parse(text);
        } catch (FormulaParser.ParseException e) {
            throw new TypingError(ctx, "cannot parse '" + text + "': " + e.getMessage(), e);
        }
    }

    public Formula compile(Expr expr, String ctx) {
        return Compiler.compile(expr, env, ctx);
    }

    /** Parses {@code text} and compiles it; parse failures are reported as typing errors. */
    public Formula compile(String text, String ctx) {
        return compile(parse(text, ctx), ctx);
    }

    /** Compiles every axiom schema, in declaration order, with context {@code compile_axiom[label]}. */
    public Map<String, Formula> compileAxioms() {
        var out = new LinkedHashMap<String, Formula>();
        axioms.forEach((label, expr) -> out.put(label, compile(expr, "compile_axiom[" + label + "]")));
        return Collections.unmodifiableMap(out);
    }

    public Formula apply(String label, List<Hypothesis> hyps, String ctx) {
        return rules.apply(label, hyps, ctx);
    }

    /** An environment compiling variables under another origin. */
    public CompileEnv authorEnv(String origin) {
        return env.withOrigin(origin);
    }

    public Language language() {
        return language;
    }

    public SymbolInterner interner() {
        return builtins.interner();
    }

    public Builtins builtins() {
        return builtins;
    }

    public CompileEnv env() {
        return env;
    }

    public RuleEngine rules() {
        return rules;
    }

    public Map<String, Expr> axioms() {
        return axioms;
    }

    /** Rule labels, which never need construction when cited. */
    public Set<String> reservedLabels() {
        return rules.labels();
    }
}
