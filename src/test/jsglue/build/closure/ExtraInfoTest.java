package jsglue.build.closure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExtraInfoTest {

    @Test
    void testNoPayload() {
        assertNull(ExtraInfo.fromSource("var x = 1;"));
        // must follow some code
        assertNull(ExtraInfo.fromSource("// EXTRA_INFO:{}"));
    }

    @Test
    void testAllFields() {
        ExtraInfo info = ExtraInfo.fromSource("var x = 1;\n// EXTRA_INFO:{"
                + "\"mapping\": {\"abort\": \"a\"},"
                + "\"exports\": [[\"_foo\", \"foo\"]],"
                + "\"globals\": [\"g1\", \"g2\"],"
                + "\"unused\": [\"emcc$import$b\"]}");

        assertEquals(ImmutableMap.of("abort", "a"), info.getMapping());
        assertEquals(1, info.getExports().size());
        assertEquals("_foo", info.getExports().get(0).getName());
        assertEquals("foo", info.getExports().get(0).getBinaryName());
        assertEquals(ImmutableList.of("g1", "g2"), info.getGlobalNames());
        assertNull(info.getGlobalMapping());
        assertEquals(ImmutableSet.of("emcc$import$b"), info.getUnused());
    }

    @Test
    void testGlobalsAsMapping() {
        ExtraInfo info = ExtraInfo.parse("{\"globals\": {\"f\": \"a\"}}");
        assertEquals(ImmutableMap.of("f", "a"), info.getGlobalMapping());
        assertTrue(info.getGlobalNames().isEmpty());
        assertTrue(info.getMapping().isEmpty());
    }

    @Test
    void testLastMarkerWins() {
        ExtraInfo info = ExtraInfo.fromSource("x;\n// EXTRA_INFO:{\"unused\": [\"a\"]}\n// EXTRA_INFO:{\"unused\": [\"b\"]}");
        assertEquals(ImmutableSet.of("b"), info.getUnused());
    }

    @Test
    void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> ExtraInfo.parse("{not json"));
        assertThrows(IllegalArgumentException.class, () -> ExtraInfo.parse("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> ExtraInfo.parse("{\"exports\": [[\"only-one\"]]}"));
        assertThrows(IllegalArgumentException.class, () -> ExtraInfo.parse("{\"mapping\": [1]}"));
    }
}
