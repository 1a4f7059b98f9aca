package dumb.hilbert.emit;

import com.fasterxml.jackson.annotation.JsonInclude;
import dumb.hilbert.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects everything written to it and serializes it as one JSON document with Jackson.
 */
public final class JsonDatabaseWriter implements DatabaseWriter {
    private final Clock clock;
    private final List<String> constants = new ArrayList<>();
    private final List<String> variables = new ArrayList<>();
    private final List<Entry> statements = new ArrayList<>();
    private final List<String> exports = new ArrayList<>();

    public JsonDatabaseWriter() {
        this(Clock.systemUTC());
    }

    public JsonDatabaseWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void constants(List<String> names) {
        constants.addAll(names);
    }

    @Override
    public void variables(List<String> names) {
        variables.addAll(names);
    }

    @Override
    public void axiom(String label, String typecode, List<String> tokens) {
        statements.add(new Entry("axiom", label, typecode, List.copyOf(tokens), null, null));
    }

    @Override
    public void hypothesisBlock(String label, String typecode, List<String> tokens, List<Statement> hypotheses) {
        statements.add(new Entry("rule", label, typecode, List.copyOf(tokens), List.copyOf(hypotheses), null));
    }

    @Override
    public void theorem(String label, String typecode, List<String> tokens, List<Statement> hypotheses, List<ProofLine> proof) {
        statements.add(new Entry("theorem", label, typecode, List.copyOf(tokens), List.copyOf(hypotheses), List.copyOf(proof)));
    }

    @Override
    public void export(List<String> labels) {
        exports.addAll(labels);
    }

    public Database document() {
        return new Database(new Manifest("hilbert", clock.instant(), statements.size()),
                List.copyOf(constants), List.copyOf(variables), List.copyOf(statements), List.copyOf(exports));
    }

    public String toJson() {
        return Json.str(document());
    }

    public void write(Path file) throws IOException {
        var parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Json.the.writeValue(file.toFile(), document());
    }

    public record Database(Manifest manifest, List<String> constants, List<String> variables,
                           List<Entry> statements, List<String> exports) {
    }

    public record Manifest(String generator, Instant generatedAt, int statements) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Entry(String type, String label, String typecode, List<String> tokens,
                        @Nullable List<Statement> hypotheses, @Nullable List<ProofLine> proof) {
    }
}
