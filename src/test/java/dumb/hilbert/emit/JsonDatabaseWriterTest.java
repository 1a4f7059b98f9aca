package dumb.hilbert.emit;

import dumb.hilbert.AbstractLogicTest;
import dumb.hilbert.lemma.Lemmas;
import dumb.hilbert.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonDatabaseWriterTest extends AbstractLogicTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Test
    void documentRoundTripsThroughJackson(@TempDir Path dir) throws Exception {
        var writer = new JsonDatabaseWriter(Clock.fixed(NOW, ZoneOffset.UTC));
        var emitter = new Emitter(writer);
        emitter.emitAxioms(sys);
        emitter.emitRuleSkeleton(sys);
        emitter.emitLemmas(sys, List.of(Lemmas.id(sys)));
        emitter.export(List.of("mp", "id"));

        var file = dir.resolve("out/db.json");
        writer.write(file);
        var tree = Json.the.readTree(file.toFile());

        assertEquals("2024-05-01T12:00:00Z", tree.get("manifest").get("generatedAt").asText());
        assertEquals(8, tree.get("manifest").get("statements").asInt());
        assertEquals(8, tree.get("statements").size());
        assertEquals("mp", tree.get("exports").get(0).asText());

        var mp = tree.get("statements").get(6);
        assertEquals("rule", mp.get("type").asText());
        assertEquals(2, mp.get("hypotheses").size());
        assertFalse(mp.has("proof"));

        var id = tree.get("statements").get(7);
        assertEquals("theorem", id.get("type").asText());
        assertEquals(5, id.get("proof").size());
        assertEquals("A1", id.get("proof").get(0).get("ref").asText());
    }

    @Test
    void toJsonMatchesDocument() throws Exception {
        var writer = new JsonDatabaseWriter(Clock.fixed(NOW, ZoneOffset.UTC));
        writer.constants(List.of("c0"));
        writer.axiom("ax", "wff", List.of("c0"));
        var parsed = Json.the.readTree(writer.toJson());
        assertEquals(Json.node(writer.document()), parsed);
        assertEquals("axiom", parsed.get("statements").get(0).get("type").asText());
    }
}
