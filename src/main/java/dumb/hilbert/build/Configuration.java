package dumb.hilbert.build;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.hilbert.compile.CompileEnv;
import dumb.hilbert.system.Language;
import dumb.hilbert.util.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Build settings, read from JSON. Missing keys take their defaults.
 */
public record Configuration(
        @JsonProperty("maxCompileDepth") int maxCompileDepth,
        @JsonProperty("propositionalOrigin") String propositionalOrigin,
        @JsonProperty("predicateOrigin") String predicateOrigin,
        @JsonProperty("lemmas") List<String> lemmas,
        @JsonProperty("includePredicate") boolean includePredicate
) {
    public static final String RESOURCE = "/hilbert.json";
    public static final List<String> DEFAULT_LEMMAS = List.of("id", "a1i", "syl", "com12", "modus_tollens", "peirce");
    private static final boolean DEFAULT_INCLUDE_PREDICATE = true;

    public Configuration {
        requireNonNull(propositionalOrigin);
        requireNonNull(predicateOrigin);
        lemmas = List.copyOf(lemmas);
        if (maxCompileDepth < 1) throw new IllegalArgumentException("maxCompileDepth must be positive: " + maxCompileDepth);
    }

    @JsonCreator
    public Configuration(
            @JsonProperty("maxCompileDepth") Integer maxCompileDepth,
            @JsonProperty("propositionalOrigin") String propositionalOrigin,
            @JsonProperty("predicateOrigin") String predicateOrigin,
            @JsonProperty("lemmas") List<String> lemmas,
            @JsonProperty("includePredicate") Boolean includePredicate
    ) {
        this(
                maxCompileDepth != null ? maxCompileDepth : CompileEnv.DEFAULT_MAX_DEPTH,
                propositionalOrigin != null ? propositionalOrigin : Language.PROPOSITIONAL.defaultOrigin(),
                predicateOrigin != null ? predicateOrigin : Language.PREDICATE.defaultOrigin(),
                lemmas != null ? lemmas : DEFAULT_LEMMAS,
                includePredicate != null ? includePredicate : DEFAULT_INCLUDE_PREDICATE
        );
    }

    public static Configuration defaults() {
        return new Configuration(null, null, null, null, null);
    }

    public static Configuration load(Path file) throws IOException {
        return Json.the.readValue(Files.readString(file), Configuration.class);
    }

    /** The {@value #RESOURCE} classpath resource, or the defaults when there is none. */
    public static Configuration fromClasspath() {
        try (var in = Configuration.class.getResourceAsStream(RESOURCE)) {
            return in == null ? defaults() : Json.the.readValue(in, Configuration.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public Configuration withLemmas(List<String> lemmas) {
        return new Configuration(maxCompileDepth, propositionalOrigin, predicateOrigin, lemmas, includePredicate);
    }

    public Configuration withDepth(int maxCompileDepth) {
        return new Configuration(maxCompileDepth, propositionalOrigin, predicateOrigin, lemmas, includePredicate);
    }

    public Configuration withPredicate(boolean includePredicate) {
        return new Configuration(maxCompileDepth, propositionalOrigin, predicateOrigin, lemmas, includePredicate);
    }
}
