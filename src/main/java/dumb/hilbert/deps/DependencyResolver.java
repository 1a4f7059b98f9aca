package dumb.hilbert.deps;

import dumb.hilbert.UnresolvedDependencyError;
import dumb.hilbert.lemma.LemmaConstructor;
import dumb.hilbert.proof.Proof;
import dumb.hilbert.system.LogicSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Closes a set of requested lemmas over the names their reference steps cite.
 * <p>
 * Built proofs go through a FIFO worklist. A proof whose name is already registered is dropped,
 * so mutually citing lemmas are registered once each. Cited names that are neither axioms,
 * reserved rule labels nor registered lemmas are looked up in the constructor map and built.
 * A name cited by two proofs before its first build is registered is built twice; constructors
 * are pure so only the work is wasted. After the worklist drains every registered proof is
 * scanned again and all references that still do not resolve are reported together.
 */
public final class DependencyResolver {
    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private final LogicSystem system;
    private final Map<String, LemmaConstructor> constructors;
    private final Set<String> reserved;
    private final Set<String> axioms;

    public DependencyResolver(LogicSystem system, Map<String, ? extends LemmaConstructor> constructors,
                              Set<String> reserved, Set<String> axioms) {
        this.system = requireNonNull(system);
        this.constructors = Map.copyOf(requireNonNull(constructors));
        this.reserved = Set.copyOf(reserved);
        this.axioms = Set.copyOf(axioms);
    }

    /** A resolver treating the system's rule labels as reserved and its axiom schemas as axioms. */
    public static DependencyResolver of(LogicSystem system, Map<String, ? extends LemmaConstructor> constructors) {
        return new DependencyResolver(system, constructors, system.reservedLabels(), system.axioms().keySet());
    }

    public Resolution resolve(List<? extends LemmaConstructor> seeds) {
        var worklist = new ArrayDeque<Proof>();
        for (var seed : seeds) worklist.add(seed.construct(system));
        return close(worklist, seeds.size(), new TreeMap<>());
    }

    /**
     * Resolves seeds given by name. Names without a constructor are reported like any other
     * unresolved reference, cited by {@code <seed>}.
     */
    public Resolution resolveNames(Collection<String> names) {
        var unknown = new TreeMap<String, Set<String>>();
        var worklist = new ArrayDeque<Proof>();
        for (var name : names) {
            if (constructors.containsKey(name)) worklist.add(build(name));
            else unknown.computeIfAbsent(name, k -> new TreeSet<>()).add("<seed>");
        }
        return close(worklist, worklist.size(), unknown);
    }

    /** {@code unresolved} holds misses found before closing; they are reported with the rest. */
    private Resolution close(Deque<Proof> worklist, int seeded, Map<String, Set<String>> unresolved) {
        var registered = new LinkedHashMap<String, Proof>();
        var constructions = seeded;
        while (!worklist.isEmpty()) {
            var proof = worklist.poll();
            if (registered.containsKey(proof.name())) {
                logger.debug("dropping duplicate build of {}", proof.name());
                continue;
            }
            registered.put(proof.name(), proof);
            var built = new ArrayList<String>();
            for (var ref : proof.references()) {
                if (isKnown(ref, registered) || !constructors.containsKey(ref)) continue;
                worklist.add(build(ref));
                built.add(ref);
                constructions++;
            }
            logger.debug("registered {}, built {}", proof.name(), built);
        }

        for (var proof : registered.values())
            for (var ref : proof.references())
                if (!isKnown(ref, registered))
                    unresolved.computeIfAbsent(ref, k -> new TreeSet<>()).add(proof.name());
        if (!unresolved.isEmpty()) throw new UnresolvedDependencyError("resolve", unresolved);

        logger.info("resolved {} lemmas with {} constructions", registered.size(), constructions);
        return new Resolution(registered, constructions);
    }

    private boolean isKnown(String ref, Map<String, Proof> registered) {
        return axioms.contains(ref) || reserved.contains(ref) || registered.containsKey(ref);
    }

    private Proof build(String name) {
        var proof = constructors.get(name).construct(system);
        if (!proof.name().equals(name))
            throw new IllegalStateException("Constructor registered as " + name + " built " + proof.name());
        return proof;
    }
}
