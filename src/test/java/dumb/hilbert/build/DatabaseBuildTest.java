package dumb.hilbert.build;

import dumb.hilbert.TypingError;
import dumb.hilbert.UnresolvedDependencyError;
import dumb.hilbert.emit.Emitter;
import dumb.hilbert.emit.JsonDatabaseWriter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseBuildTest {

    @Test
    void defaultBuildEmitsAndExportsEverything() {
        var writer = new JsonDatabaseWriter();
        var result = DatabaseBuild.run(Configuration.defaults(), writer);

        assertNotNull(result.predicate());
        assertTrue(result.lemmas().contains("peirce"));
        assertTrue(result.lemmas().contains("simplim"));
        assertTrue(result.exports().containsAll(Emitter.RULE_LABELS));
        assertTrue(result.exports().containsAll(List.of("A1", "A2", "A3", "AX5", "AX13", "id", "modus_tollens")));

        var doc = writer.document();
        assertEquals(3 + Emitter.RULE_LABELS.size() + result.lemmas().size() + 9, doc.statements().size());
        assertEquals(result.exports(), doc.exports());
    }

    @Test
    void predicateAxiomsCanBeLeftOut() {
        var writer = new JsonDatabaseWriter();
        var config = Configuration.defaults().withLemmas(List.of("id")).withPredicate(false);
        var result = DatabaseBuild.run(config, writer);
        assertNull(result.predicate());
        assertEquals(List.of("id"), result.lemmas().names());
        assertFalse(result.exports().contains("AX5"));
        assertEquals(List.of("wi", "wn", "wa", "mp", "A1", "A2", "A3", "id"), result.exports());
    }

    @Test
    void unknownLemmaFailsBeforeAnythingIsExported() {
        var writer = new JsonDatabaseWriter();
        var config = Configuration.defaults().withLemmas(List.of("id", "fermat"));
        var e = assertThrows(UnresolvedDependencyError.class, () -> DatabaseBuild.run(config, writer));
        assertEquals(List.of("fermat"), e.references());
        assertTrue(writer.document().exports().isEmpty());
    }

    @Test
    void depthLimitApplies() {
        var config = Configuration.defaults().withDepth(3);
        var e = assertThrows(TypingError.class, () -> DatabaseBuild.run(config, new JsonDatabaseWriter()));
        assertEquals("compile_axiom[A2]", e.context());
    }
}
