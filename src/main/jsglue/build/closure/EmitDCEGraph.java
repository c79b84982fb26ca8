package jsglue.build.closure;

import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * Emits the graph wasm-metadce uses to optimize the combined JS+wasm. It records where JS depends
 * on wasm and where wasm depends on JS.
 * <p>
 * The analysis is simple, it only looks at the toplevel scope and toplevel function declarations
 * (defuns):
 * <ul>
 * <li>anything used in a defun creates an edge from that defun, to another defun or into the wasm</li>
 * <li>anything used in the toplevel scope is a root, it is code we assume will run. Receiving a
 * value from the wasm (an export) or handing one to it (an import) doesn't root anything</li>
 * <li>anything else (nested functions, objects) is treated as toplevel, we don't optimize that</li>
 * </ul>
 * The tree is left as it was found, only the graph is printed.
 */
public class EmitDCEGraph implements CompilerPass {

    private final OptimizerContext context;

    public EmitDCEGraph(OptimizerContext context) {
        this.context = context;
    }

    @Override
    public void process(Node externs, Node root) {
        DCEGraph graph = build(root);
        context.out().println(graph.print());
        context.setNoPrint(true);
    }

    public DCEGraph build(Node root) {
        Builder builder = new Builder();
        try {
            builder.collect(root);
            return builder.link(root);
        } finally {
            AstUtil.restore(root, builder.hidden);
        }
    }

    private class Builder {
        final HiddenNodes hidden = new HiddenNodes();
        final List<String> imports = new ArrayList<>();
        final List<Node> defuns = new ArrayList<>();
        final List<String> dynCallNames = new ArrayList<>();
        final Map<String, String> nameToGraphName = new LinkedHashMap<>();
        final Map<String, String> modulePropertyToGraphName = new LinkedHashMap<>();
        final Map<String, String> exportNameToGraphName = new LinkedHashMap<>();
        final DCEGraph graph = new DCEGraph();

        boolean foundWasmImports = false;
        boolean foundMinimalRuntimeExports = false;

        /**
         * first pass, finds imports, exports and defuns and hides them from the second pass
         */
        void collect(Node root) {
            TreeWalk.full(root, this::collectNode);

            // must find the imports, everything else depends on them
            checkState(foundWasmImports,
                    "could not find the assignment to \"%s\". perhaps --pre-js or --post-js code moved it out of the global scope?"
                            + " (things like that should be done after emcc runs, as they do not need to be run through the optimizer)",
                    WasmBoundary.WASM_IMPORTS);

            ExtraInfo extraInfo = context.getExtraInfo();
            if (extraInfo != null) {
                for (ExtraInfo.ExportName exp : extraInfo.getExports()) {
                    saveAsmExport(exp.getName(), exp.getBinaryName());
                }
            }
        }

        void collectNode(Node node) {
            if (WasmBoundary.isWasmImportsAssign(node)) {
                collectImports(WasmBoundary.getWasmImportsValue(node));
                foundWasmImports = true;
                // doesn't root what it hands over
                hidden.hide(node);
            } else if (NodeUtil.isNameDeclaration(node)) {
                collectDeclaration(node);
            } else if (node.isFunction()) {
                if (NodeUtil.isFunctionDeclaration(node)) {
                    String name = node.getFirstChild().getString();
                    defuns.add(node);
                    nameToGraphName.put(name, DCEGraph.Kind.DEFUN.graphName(name));
                    if (name.startsWith(WasmBoundary.DYN_CALL_PREFIX)) {
                        dynCallNames.add(DCEGraph.Kind.DEFUN.graphName(name));
                    }
                    // scanned separately
                    hidden.hide(node);
                } else {
                    collectMinimalRuntimeExports(node);
                }
            }
        }

        void collectImports(Node obj) {
            for (Node item = obj.getFirstChild(); item != null; item = item.getNext()) {
                checkState(item.isStringKey(), "unexpected property in %s: %s", WasmBoundary.WASM_IMPORTS, item);
                Node value = item.getFirstChild();
                if (AstUtil.isLiteral(value) || value.isFunction()) {
                    // nothing to link to
                    continue;
                }
                if (value.isOr() || value.isAnd() || value.getToken() == Token.COALESCE) {
                    // wasmMemory || Module.wasmMemory in pthreads code, the left side is the binding
                    value = value.getFirstChild();
                }
                checkState(value.isName(), "import %s is not a plain name: %s", item.getString(), value);
                // the key doesn't matter, the value is what actually gets imported
                imports.add(value.getString());
            }
        }

        void collectDeclaration(Node node) {
            if (node.hasOneChild() && node.getFirstChild().isName()) {
                Node decl = node.getFirstChild();
                String name = decl.getString();
                Node value = decl.getFirstChild();

                if (value != null && WasmBoundary.isAsmUse(value)) {
                    // var _x = asm['x'];
                    saveAsmExport(name, WasmBoundary.getAsmOrModuleUseName(value));
                    hidden.hide(node);
                    return;
                }

                if (value != null && value.isFunction()) {
                    // var x = function() { return (x = Module['asm']['x']).apply(..) }
                    String asmName = WasmBoundary.getExportWrapperName(value);
                    if (asmName != null) {
                        saveAsmExport(name, asmName);
                        hidden.hide(node);
                        return;
                    }
                }

                if (value != null && value.isAssign()) {
                    Node assigned = value.getFirstChild();
                    if (WasmBoundary.isModuleUse(assigned) && name.equals(WasmBoundary.getAsmOrModuleUseName(assigned))) {
                        // var x = Module['x'] = ?, an export being received if there is exactly one asm use
                        Node rhs = value.getSecondChild();
                        List<String> asmNames = new ArrayList<>();
                        TreeWalk.full(rhs, n -> {
                            if (WasmBoundary.isAsmUse(n)) {
                                asmNames.add(WasmBoundary.getAsmOrModuleUseName(n));
                            }
                        });
                        if (asmNames.size() == 1) {
                            // the js name may differ from what the wasm provides, an extra _ in front
                            saveAsmExport(name, asmNames.get(0));
                            hidden.hide(node);
                            return;
                        }
                        if (AstUtil.isLiteral(rhs)) {
                            // var x = Module['x'] = 1234; exported global addresses, not a use
                            checkState(rhs.isNumber(), "expected an exported address for %s, got %s", name, rhs);
                            hidden.hide(node);
                            return;
                        }
                    }
                }
            }

            // just declarations are not roots, it takes an actual use
            boolean hasInit = false;
            for (Node decl = node.getFirstChild(); decl != null; decl = decl.getNext()) {
                if (!decl.isName() || decl.hasChildren()) {
                    hasInit = true;
                }
            }
            if (!hasInit) {
                hidden.hide(node);
            }
        }

        void collectMinimalRuntimeExports(Node fn) {
            // function(output) { var asm = output.instance.exports; _malloc = asm['malloc']; .. }
            Node body = WasmBoundary.getMinimalRuntimeExportsBody(fn);
            if (body == null) {
                return;
            }
            checkState(!foundMinimalRuntimeExports, "found more than one minimal runtime exports function");
            for (Node item = body.getSecondChild(); item != null; item = item.getNext()) {
                if (WasmBoundary.isMinimalRuntimeExport(item)) {
                    Node assign = item.getFirstChild();
                    saveAsmExport(assign.getFirstChild().getString(), WasmBoundary.getAsmOrModuleUseName(assign.getSecondChild()));
                    hidden.hide(item);
                }
            }
            foundMinimalRuntimeExports = true;
        }

        void saveAsmExport(String name, String asmName) {
            String graphName = DCEGraph.Kind.EXPORT.graphName(name);
            nameToGraphName.put(name, graphName);
            modulePropertyToGraphName.put(name, graphName);
            exportNameToGraphName.put(asmName, graphName);
            if (name.startsWith(WasmBoundary.DYN_CALL_PREFIX) && !dynCallNames.contains(graphName)) {
                dynCallNames.add(graphName);
            }
        }

        /**
         * second pass, everything used at the toplevel is a root, things used in defuns become edges
         */
        DCEGraph link(Node root) {
            for (String imp : imports) {
                DCEGraph.GraphNode node = graph.addImport(imp);
                String target = nameToGraphName.get(imp);
                // otherwise it is a number or something else we don't track
                if (target != null) {
                    node.addReach(target);
                }
            }

            for (Map.Entry<String, String> e : exportNameToGraphName.entrySet()) {
                graph.addExport(e.getValue(), e.getKey());
            }

            for (Node defun : defuns) {
                DCEGraph.GraphNode info = graph.addDefun(defun.getFirstChild().getString());
                TreeWalk.full(defun.getLastChild(), node -> visit(node, info));
            }

            TreeWalk.full(root, node -> visit(node, null));
            return graph;
        }

        void visit(Node node, DCEGraph.GraphNode from) {
            // no scope awareness, every use is assumed to refer to the toplevel binding
            if (node.isName()) {
                reach(nameToGraphName.get(node.getString()), from);
            } else if (WasmBoundary.isModuleUse(node)) {
                reach(modulePropertyToGraphName.get(WasmBoundary.getAsmOrModuleUseName(node)), from);
            } else if (node.isGetProp() && WasmBoundary.isName(node.getFirstChild(), WasmBoundary.MODULE)) {
                // Module._x is the same as Module['_x']
                reach(modulePropertyToGraphName.get(node.getString()), from);
            } else if (WasmBoundary.isStaticDynCall(node)) {
                reach(DCEGraph.Kind.EXPORT.graphName(WasmBoundary.getStaticDynCallName(node)), from);
            } else if (WasmBoundary.isDynamicDynCall(node)) {
                // may reach *any* dynCall_, no way to narrow it down
                for (String target : dynCallNames) {
                    reach(target, from);
                }
            } else if (WasmBoundary.isAsmUse(node)) {
                // direct asm uses are always roots
                String target = exportNameToGraphName.get(WasmBoundary.getAsmOrModuleUseName(node));
                if (target != null) {
                    graph.get(target).setRoot();
                }
            }
        }

        void reach(String target, DCEGraph.GraphNode from) {
            if (target == null) {
                return;
            }
            if (from != null) {
                from.addReach(target);
                return;
            }
            DCEGraph.GraphNode node = graph.get(target);
            if (node != null) {
                node.setRoot();
            } else if (context.isVerbose()) {
                // e.g. Module.dynCall_vi in library code, doesn't exist in a standalone build
                context.warnOnce("metadce: missing declaration for " + target);
            }
        }
    }
}
