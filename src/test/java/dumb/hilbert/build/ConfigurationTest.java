package dumb.hilbert.build;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.hilbert.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationTest {

    @Test
    void defaults() {
        var c = Configuration.defaults();
        assertEquals(64, c.maxCompileDepth());
        assertEquals("hilbert", c.propositionalOrigin());
        assertEquals("predicate", c.predicateOrigin());
        assertEquals(Configuration.DEFAULT_LEMMAS, c.lemmas());
        assertTrue(c.includePredicate());
    }

    @Test
    void missingKeysTakeDefaults() throws Exception {
        var c = Json.obj("{\"maxCompileDepth\": 12, \"lemmas\": [\"syl\"]}", Configuration.class);
        assertEquals(12, c.maxCompileDepth());
        assertEquals(List.of("syl"), c.lemmas());
        assertEquals("hilbert", c.propositionalOrigin());
        assertTrue(c.includePredicate());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        var file = dir.resolve("hilbert.json");
        Files.writeString(file, "{\"includePredicate\": false, \"predicateOrigin\": \"fol\"}");
        var c = Configuration.load(file);
        assertFalse(c.includePredicate());
        assertEquals("fol", c.predicateOrigin());
    }

    @Test
    void classpathResourceMatchesDefaults() {
        assertEquals(Configuration.defaults(), Configuration.fromClasspath());
    }

    @Test
    void nonPositiveDepthIsRejected() {
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"maxCompileDepth\": 0}", Configuration.class));
        assertThrows(IllegalArgumentException.class, () -> Configuration.defaults().withDepth(0));
    }
}
