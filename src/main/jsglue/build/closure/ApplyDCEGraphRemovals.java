package jsglue.build.closure;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;

/**
 * Applies what wasm-metadce found to be unused. The names come from the graph {@link EmitDCEGraph}
 * printed, the same patterns are matched again to find what they stand for.
 * <p>
 * Exports keep their declaration, only the value goes away.
 */
public class ApplyDCEGraphRemovals implements CompilerPass {

    private final OptimizerContext context;

    public ApplyDCEGraphRemovals(OptimizerContext context) {
        this.context = context;
    }

    @Override
    public void process(Node externs, Node root) {
        ImmutableSet<String> unused = context.requireExtraInfo("applyDCEGraphRemovals").getUnused();
        TreeWalk.full(root, node -> visit(node, unused));
    }

    private static boolean isUnusedExport(ImmutableSet<String> unused, String name) {
        return name != null && unused.contains(DCEGraph.Kind.EXPORT.graphName(name));
    }

    private void visit(Node node, ImmutableSet<String> unused) {
        if (WasmBoundary.isWasmImportsAssign(node)) {
            Node obj = WasmBoundary.getWasmImportsValue(node);
            Node item = obj.getFirstChild();
            while (item != null) {
                Node next = item.getNext();
                if (item.isStringKey()
                        && unused.contains(DCEGraph.Kind.IMPORT.graphName(item.getString()))
                        && !SideEffects.has(item.getFirstChild())) {
                    item.detach();
                }
                item = next;
            }
        } else if (node.isAssign()) {
            // var x = Module['x'] = asm['x'];
            Node target = node.getFirstChild();
            if (WasmBoundary.isAsmUse(target) || WasmBoundary.isModuleUse(target)) {
                Node value = node.getSecondChild();
                if (isUnusedExport(unused, WasmBoundary.getAsmOrModuleUseName(target))
                        && (WasmBoundary.isAsmUse(value) || !SideEffects.has(value))) {
                    removeValue(node);
                }
            }
        } else if (NodeUtil.isNameDeclaration(node) && node.getFirstChild().isName() && node.getFirstChild().hasChildren()) {
            // var x = asm['x'];
            // var x = function() { return (x = asm['x']).apply(..) };
            // the graph names exports by their js name
            Node decl = node.getFirstChild();
            Node init = decl.getFirstChild();
            boolean isExport = WasmBoundary.isAsmUse(init)
                    || (init.isFunction() && WasmBoundary.getExportWrapperName(init) != null);
            if (isExport && isUnusedExport(unused, decl.getString())) {
                removeValue(init);
            }
        } else if (node.isExprResult() && node.getFirstChild().isAssign()) {
            // the minimal runtime only has x = asm['x'], never in a var
            Node assign = node.getFirstChild();
            Node target = assign.getFirstChild();
            Node value = assign.getSecondChild();
            if (target.isName() && WasmBoundary.isAsmUse(value)
                    && target.getString().equals(WasmBoundary.getAsmOrModuleUseName(value))
                    && isUnusedExport(unused, target.getString())) {
                AstUtil.emptyOut(node);
            }
        }
    }

    /**
     * drops the initializer when node is one, anything else becomes undefined
     */
    static void removeValue(Node node) {
        Node parent = node.getParent();
        if (parent.isName() && node == parent.getFirstChild()) {
            node.detach();
        } else {
            node.replaceWith(IR.name("undefined"));
        }
    }
}
