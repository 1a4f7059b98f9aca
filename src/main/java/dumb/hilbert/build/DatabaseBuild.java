package dumb.hilbert.build;

import dumb.hilbert.deps.DependencyResolver;
import dumb.hilbert.deps.Resolution;
import dumb.hilbert.emit.DatabaseWriter;
import dumb.hilbert.emit.Emitter;
import dumb.hilbert.lemma.Lemmas;
import dumb.hilbert.symbol.SymbolInterner;
import dumb.hilbert.system.Language;
import dumb.hilbert.system.LogicSystem;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Assembles one database: propositional axioms and rule skeleton, the requested lemmas closed
 * over their references, then the predicate axioms on the same interner, then the export list.
 */
public final class DatabaseBuild {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseBuild.class);

    private DatabaseBuild() {
    }

    public static Result run(Configuration configuration, DatabaseWriter writer) {
        requireNonNull(configuration);
        var interner = new SymbolInterner();
        var emitter = new Emitter(writer);

        var system = LogicSystem.make(Language.PROPOSITIONAL, interner, configuration.propositionalOrigin(), configuration.maxCompileDepth());
        emitter.emitAxioms(system);
        emitter.emitRuleSkeleton(system);

        var resolution = DependencyResolver.of(system, Lemmas.catalogue()).resolveNames(configuration.lemmas());
        emitter.emitLemmas(system, resolution.proofs());

        LogicSystem predicate = null;
        if (configuration.includePredicate()) {
            predicate = LogicSystem.make(Language.PREDICATE, interner, configuration.predicateOrigin(), configuration.maxCompileDepth());
            emitter.emitAxioms(predicate);
        }

        var exports = new ArrayList<>(Emitter.RULE_LABELS);
        exports.addAll(system.axioms().keySet());
        exports.addAll(resolution.names());
        if (predicate != null) exports.addAll(predicate.axioms().keySet());
        emitter.export(exports);

        logger.info("built database: {} axioms, {} lemmas ({} requested), {} symbols, {} exports",
                system.axioms().size() + (predicate != null ? predicate.axioms().size() : 0),
                resolution.size(), configuration.lemmas().size(), interner.size(), exports.size());
        return new Result(system, predicate, resolution, exports);
    }

    public record Result(LogicSystem propositional, @Nullable LogicSystem predicate, Resolution lemmas, List<String> exports) {
        public Result {
            exports = List.copyOf(exports);
        }
    }
}
