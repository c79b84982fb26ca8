package jsglue.build.closure;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.AbstractCompiler;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeTraversal;
import com.google.javascript.rhino.Node;

/**
 * util pass to apply the import and export names the wasm got after minifying them
 * <p>
 * var wasmImports = { "abort": .. } -> var wasmImports = { "a": .. }
 * asm["__wasm_call_ctors"]() -> asm["M"]()
 */
public class ApplyImportAndExportNameChanges extends NodeTraversal.AbstractPostOrderCallback implements CompilerPass {
    private final AbstractCompiler compiler;
    private final ImmutableMap<String, String> mapping;

    public ApplyImportAndExportNameChanges(AbstractCompiler compiler, ImmutableMap<String, String> mapping) {
        this.compiler = compiler;
        this.mapping = mapping;
    }

    public ApplyImportAndExportNameChanges(AbstractCompiler compiler, OptimizerContext context) {
        this(compiler, context.requireExtraInfo("applyImportAndExportNameChanges").getMapping());
    }

    @Override
    public void process(Node externs, Node root) {
        NodeTraversal.traverse(compiler, root, this);
    }

    @Override
    public void visit(NodeTraversal t, Node node, Node parent) {
        if (WasmBoundary.isWasmImportsAssign(node)) {
            Node obj = WasmBoundary.getWasmImportsValue(node);
            for (Node item = obj.getFirstChild(); item != null; item = item.getNext()) {
                if (item.isStringKey()) {
                    rename(item);
                }
            }
        } else if (WasmBoundary.isAsmUse(node)) {
            // asm['x'] and Module['asm']['x'], in assignments, calls or anywhere else
            rename(node.getSecondChild());
        }
    }

    private void rename(Node node) {
        String replacement = mapping.get(node.getString());
        if (replacement != null) {
            node.setString(replacement);
        }
    }
}
