package jsglue.build.closure;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.rhino.Node;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertThrows;

public class ApplyImportAndExportNameChangesTest {

    @Test
    void testRename() {
        Compiler cc = ParserHelper.createCompiler();
        Node root = ParserHelper.parse(cc, "test.js", String.join("\n",
                "var wasmImports = {'abort': abort, 'log': log};",
                "var _main = asm['main'];",
                "Module['asm']['__wasm_call_ctors']();",
                "asm['other'];",
                "obj['main'];"));

        ImmutableMap<String, String> mapping = ImmutableMap.of(
                "abort", "a",
                "main", "b",
                "__wasm_call_ctors", "c",
                "asm", "d");
        new ApplyImportAndExportNameChanges(cc, mapping).process(null, root);

        JsTesting.assertCode(String.join("\n",
                "var wasmImports = {'a': abort, 'log': log};",
                "var _main = asm['b'];",
                "Module['asm']['c']();",
                "asm['other'];",
                "obj['main'];"), root);
    }

    @Test
    void testMappingFromExtraInfo() {
        Compiler cc = ParserHelper.createCompiler();
        Node root = ParserHelper.parse(cc, "test.js", "var wasmImports = {'abort': abort}; asm['malloc'](1);");

        OptimizerContext context = JsTesting.context("{\"mapping\": {\"abort\": \"x\", \"malloc\": \"y\"}}");
        new ApplyImportAndExportNameChanges(cc, context).process(null, root);

        JsTesting.assertCode("var wasmImports = {'x': abort}; asm['y'](1);", root);
    }

    @Test
    void testNeedsExtraInfo() {
        Compiler cc = ParserHelper.createCompiler();
        assertThrows(IllegalStateException.class,
                () -> new ApplyImportAndExportNameChanges(cc, JsTesting.context(null)));
    }
}
