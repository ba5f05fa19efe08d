package work.lcod.reshape.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.reshape.support.ReshapeTestSupport.list;
import static work.lcod.reshape.support.ReshapeTestSupport.map;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.reshape.api.Reshaper;
import work.lcod.reshape.errors.PathAccessException;
import work.lcod.reshape.errors.ReshapeException;
import work.lcod.reshape.runtime.Scope;
import work.lcod.reshape.spec.Pipeline;
import work.lcod.reshape.spec.TargetExpr;

class TracerTest {
    private static final String NL = System.lineSeparator();

    private final Reshaper reshaper = Reshaper.create();

    private ReshapeException failure() {
        var target = map("items", list(map("n", 1), map()));
        var spec = map("out", Pipeline.of("items", List.of("n")));
        return assertThrows(PathAccessException.class, () -> reshaper.reshape(target, spec));
    }

    @Test
    void lineStackShowsSpecsTypeChangesAndPath() {
        assertEquals("/Map!LinkedHashMap/Pipeline/List!ArrayList<'items'>/'n'!LinkedHashMap<1>",
            Tracer.lineStack(failure()));
    }

    @Test
    void lineStackRendersDeferredExpressions() {
        var error = assertThrows(PathAccessException.class,
            () -> reshaper.reshape(map("a", map()), TargetExpr.T.index("a").index("b")));

        assertEquals("/T['a']['b']!LinkedHashMap", Tracer.lineStack(error));
    }

    @Test
    void tallStackSkipsRepeatedTargets() {
        var expected = String.join(NL,
            "target: {'items': [{'n': 1}, {}]}",
            "spec: {'out': Pipeline('items', ['n'])}",
            "spec: Pipeline('items', ['n'])",
            "target: [{'n': 1}, {}]",
            "spec: ['n']",
            "target: {}",
            "spec: 'n'");

        assertEquals(expected, Tracer.tallStack(failure().scope()));
    }

    @Test
    void shortStackTruncatesValues() {
        var lines = Tracer.shortStack(failure(), 12).split(NL);

        assertEquals("target: {'items':...", lines[0]);
        assertEquals("spec: {'out': P...", lines[1]);
        assertEquals("spec: 'n'", lines[lines.length - 1]);
    }

    @Test
    void missingScopeHasNoTrace() {
        assertEquals("(no trace)", Tracer.lineStack((Scope) null));
        assertEquals("(no trace)", Tracer.tallStack(null));
    }
}
