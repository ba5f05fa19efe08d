package work.lcod.reshape.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.reshape.support.ReshapeTestSupport.map;

import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import work.lcod.reshape.support.ReshapeTestSupport;

class ReprsTest {
    @Test
    void rendersValuesCompactly() {
        Function<Object, Object> identity = value -> value;

        assertEquals("'it\\'s'", Reprs.repr("it's"));
        assertEquals("{'a': [1, null]}", Reprs.repr(map("a", Arrays.asList(1, null))));
        assertEquals("['x', 2]", Reprs.repr(new Object[] {"x", 2}));
        assertEquals("String", Reprs.repr(String.class));
        assertEquals("<function>", Reprs.repr(identity));
        assertEquals("null", Reprs.repr(null));
    }

    @Test
    void selfReferencesAreElided() {
        var looped = map("a", 1);
        looped.put("self", looped);
        var items = ReshapeTestSupport.list(1);
        items.add(items);
        var shared = List.of(0);

        assertEquals("{'a': 1, 'self': {...}}", Reprs.repr(looped));
        assertEquals("[1, [...]]", Reprs.repr(items));
        assertEquals("[[0], [0]]", Reprs.repr(List.of(shared, shared)));
    }

    @Test
    void truncatesLongText() {
        assertEquals("abcdef", Reprs.truncate("abcdef", 0));
        assertEquals("abcdef", Reprs.truncate("abcdef", 6));
        assertEquals("ab...", Reprs.truncate("abcdef", 5));
        assertEquals("ab", Reprs.truncate("abcdef", 2));
    }

    @Test
    void pipelineSegmentsKeepPathsBare() {
        assertEquals("a.b", Reprs.segment("a.b"));
        assertEquals("['x']", Reprs.segment(List.of("x")));
        assertEquals(List.of("a", 0), Reprs.append(List.of("a"), 0));
    }
}
