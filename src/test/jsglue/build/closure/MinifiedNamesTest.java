package jsglue.build.closure;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MinifiedNamesTest {

    @Test
    void testOrder() {
        MinifiedNames names = new MinifiedNames();
        assertEquals("a", names.get(0));
        assertEquals("z", names.get(25));
        assertEquals("A", names.get(26));
        assertEquals("_", names.get(52));
        assertEquals("$", names.get(53));
        // the first character changes fastest
        assertEquals("aa", names.get(54));
        assertEquals("ba", names.get(55));
    }

    @Test
    void testDistinctAndNotReserved() {
        MinifiedNames names = new MinifiedNames();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 10000; i++) {
            String name = names.get(i);
            assertTrue(name.matches("[a-zA-Z_$][a-zA-Z0-9_$]*"), name);
            assertFalse(MinifiedNames.RESERVED.contains(name), name);
            assertTrue(seen.add(name), name);
        }
        assertFalse(seen.contains("do"));
        assertFalse(seen.contains("if"));
        assertFalse(seen.contains("var"));
    }

    @Test
    void testReproducible() {
        MinifiedNames first = new MinifiedNames();
        MinifiedNames second = new MinifiedNames();
        // order of requests doesn't matter
        String late = second.get(4000);
        for (int i = 0; i < 4000; i++) {
            assertEquals(first.get(i), second.get(i));
        }
        assertEquals(first.get(4000), late);
    }

    @Test
    void testNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> new MinifiedNames().get(-1));
    }
}
