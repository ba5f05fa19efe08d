package work.lcod.reshape.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.errors.SpecTypeException;

class EvaluationOptionsTest {
    @Test
    void defaultsReRaiseEverything() {
        var options = EvaluationOptions.defaults();

        assertFalse(options.hasDefault());
        assertFalse(options.swallows(new ReshapeException("x")));
        assertEquals(Set.of(ReshapeException.class), options.skipOn());
        assertEquals(Map.of(), options.variables());
    }

    @Test
    void defaultSwallowsReshapeErrorsOnly() {
        var options = EvaluationOptions.builder().defaultValue(0).build();

        assertTrue(options.swallows(new SpecTypeException("bad spec")));
        assertFalse(options.swallows(new IllegalStateException("user")));
    }

    @Test
    void builderCopiesItsState() {
        var builder = EvaluationOptions.builder().variable("a", 1);
        var options = builder.build();
        builder.variable("b", 2);

        assertEquals(Map.of("a", 1), options.variables());
        assertThrows(UnsupportedOperationException.class, () -> options.variables().put("c", 3));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
