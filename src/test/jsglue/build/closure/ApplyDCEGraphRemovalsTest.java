package jsglue.build.closure;

import com.google.javascript.rhino.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ApplyDCEGraphRemovalsTest {

    static void assertPruned(String unusedJson, String input, String expected) {
        Node root = JsTesting.parse(input);
        new ApplyDCEGraphRemovals(JsTesting.context("{\"unused\": " + unusedJson + "}")).process(null, root);
        JsTesting.assertCode(expected, root);
    }

    @Test
    void testUnusedImportRemoved() {
        assertPruned("[\"emcc$import$b\"]",
                "var wasmImports = {'a': fn1, 'b': fn2};",
                "var wasmImports = {'a': fn1};");
    }

    @Test
    void testImportWithSideEffectsKept() {
        assertPruned("[\"emcc$import$b\"]",
                "var wasmImports = {'a': fn1, 'b': makeImport()};",
                "var wasmImports = {'a': fn1, 'b': makeImport()};");
    }

    @Test
    void testUnusedExportsLoseTheirValue() {
        String input = String.join("\n",
                "var _malloc = asm['malloc'];",
                "var _free = Module['_free'] = asm['free'];",
                "var _main = function() { return (_main = Module['asm']['main']).apply(null, arguments); };",
                "var _kept = asm['kept'];",
                "var _other = function() { return 1; };");
        String expected = String.join("\n",
                "var _malloc;",
                "var _free;",
                "var _main;",
                "var _kept = asm['kept'];",
                "var _other = function() { return 1; };");

        assertPruned("[\"emcc$export$_malloc\", \"emcc$export$_free\", \"emcc$export$_main\", \"emcc$export$_other\"]",
                input, expected);
    }

    @Test
    void testModuleAssignmentOutsideVar() {
        assertPruned("[\"emcc$export$_x\"]",
                "Module['_x'] = asm['x'];",
                "undefined;");
    }

    @Test
    void testMinimalRuntimeAssignmentsRemoved() {
        assertPruned("[\"emcc$export$_malloc\"]",
                "function ready(output) { var asm = output.instance.exports; _malloc = asm['_malloc']; _free = asm['_free']; }",
                "function ready(output) { var asm = output.instance.exports; ; _free = asm['_free']; }");
    }

    @Test
    void testNeedsExtraInfo() {
        Node root = JsTesting.parse("var wasmImports = {};");
        assertThrows(IllegalStateException.class,
                () -> new ApplyDCEGraphRemovals(JsTesting.context(null)).process(null, root));
    }
}
