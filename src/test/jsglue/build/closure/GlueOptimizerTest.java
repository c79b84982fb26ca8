package jsglue.build.closure;

import com.google.gson.JsonArray;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GlueOptimizerTest {

    @Test
    void testRegistry() {
        for (String pass : new String[]{"JSDCE", "AJSDCE", "applyImportAndExportNameChanges", "emitDCEGraph",
                "applyDCEGraphRemovals", "minifyLocals", "minifyGlobals", "minifyWhitespace", "noPrint", "verbose",
                "last", "dump"}) {
            assertTrue(GlueOptimizer.PASSES.containsKey(pass), pass);
        }
    }

    @Test
    void testUnknownPass() {
        // checked before anything is parsed
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> GlueOptimizer.optimize("this is not js (", "JSDCE", "safeHeap"));
        assertTrue(e.getMessage().contains("safeHeap"));
    }

    @Test
    void testPipeline() {
        String output = GlueOptimizer.optimize("var unused = 1; function used() { return 1; } used();",
                "JSDCE", "minifyWhitespace");
        assertEquals(JsTesting.normalize("; function used() { return 1; } used();").trim(), output.trim());
    }

    @Test
    void testPrettyByDefault() {
        String output = GlueOptimizer.optimize("function f() { return 1; } f();", "last");
        assertTrue(output.contains("\n  return 1;"), output);
    }

    @Test
    void testGraphReplacesCode() {
        String output = GlueOptimizer.optimize("var wasmImports = {'a': _a}; function _a() {} _a();", "emitDCEGraph");
        JsonArray arr = JsonParser.parseString(output).getAsJsonArray();
        assertEquals(2, arr.size());
        assertEquals("emcc$defun$_a", arr.get(0).getAsJsonObject().get("name").getAsString());
        assertTrue(arr.get(0).getAsJsonObject().get("root").getAsBoolean());
    }

    @Test
    void testNoPrint() {
        assertEquals("", GlueOptimizer.optimize("var x = 1;", "JSDCE", "noPrint"));
    }

    @Test
    void testExtraInfoFromInput() {
        String output = GlueOptimizer.optimize("var wasmImports = {'a': fn1, 'b': fn2};\n"
                        + "// EXTRA_INFO:{\"unused\": [\"emcc$import$b\"]}\n",
                "applyDCEGraphRemovals", "minifyWhitespace");
        assertEquals(JsTesting.normalize("var wasmImports = {'a': fn1};").trim(), output.trim());
    }

    @Test
    void testSuffix() {
        String output = GlueOptimizer.optimize("function instantiate(a) { var x = a; }\n// EXTRA_INFO:{\"globals\": []}",
                "minifyGlobals", "minifyWhitespace");
        String[] lines = output.trim().split("\n");
        assertEquals("// EXTRA_INFO:{\"x\":\"a\",\"a\":\"b\"}", lines[lines.length - 1]);
    }

    @Test
    void testUseStrictKept() {
        String output = GlueOptimizer.optimize("'use strict';\nvar x = 1; foo(x);", "AJSDCE", "minifyWhitespace");
        assertTrue(output.contains("use strict"), output);
        assertTrue(output.indexOf("use strict") < output.indexOf("var x"), output);
        assertTrue(output.contains("foo(x)"), output);
    }

    @Test
    void testFunctionUseStrictKept() {
        String output = GlueOptimizer.optimize("function f() { 'use strict'; return 1; } f();", "JSDCE", "minifyWhitespace");
        assertTrue(output.contains("use strict"), output);
        assertTrue(output.indexOf("function f") < output.indexOf("use strict"), output);
        assertTrue(output.indexOf("use strict") < output.indexOf("return 1"), output);
    }

    @Test
    void testDump() {
        String output = GlueOptimizer.optimize("var x = 1;", "dump", "noPrint");
        assertTrue(output.contains("SCRIPT"), output);
    }

    @Test
    void testParseError() {
        JsParseException e = assertThrows(JsParseException.class,
                () -> GlueOptimizer.optimize("var ok = 1;\nvar x = ;\n", "JSDCE"));
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().contains("var x = ;\n"), e.getMessage());
        assertTrue(e.getMessage().contains("^"), e.getMessage());
    }
}
