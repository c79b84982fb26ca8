package jsglue.build.closure;

import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;

/**
 * Recognizes the places where the glue code talks to the wasm module. Matching is purely
 * syntactic on the shapes emitted by the toolchain.
 */
public class WasmBoundary {

    public static final String WASM_IMPORTS = "wasmImports";
    public static final String ASM = "asm";
    public static final String MODULE = "Module";
    public static final String DYN_CALL = "dynCall";
    public static final String DYN_CALL_PREFIX = DYN_CALL + "_";

    public static boolean isLiteralString(Node node) {
        return node != null && node.isStringLit();
    }

    static boolean isName(Node node, String name) {
        return node != null && node.isName() && name.equals(node.getString());
    }

    /**
     * var wasmImports = { ... };
     */
    public static boolean isWasmImportsAssign(Node node) {
        if (!NodeUtil.isNameDeclaration(node) || !node.hasOneChild()) {
            return false;
        }
        Node decl = node.getFirstChild();
        return isName(decl, WASM_IMPORTS) && decl.hasChildren() && decl.getFirstChild().isObjectLit();
    }

    public static Node getWasmImportsValue(Node node) {
        return node.getFirstChild().getFirstChild();
    }

    /**
     * asm['X'] or Module['asm']['X']
     */
    public static boolean isAsmUse(Node node) {
        if (!node.isGetElem() || !isLiteralString(node.getSecondChild())) {
            return false;
        }
        Node object = node.getFirstChild();
        return isName(object, ASM) || isModuleProperty(object, ASM);
    }

    public static String getAsmOrModuleUseName(Node node) {
        return node.getSecondChild().getString();
    }

    /**
     * Module['X']
     */
    public static boolean isModuleUse(Node node) {
        return node.isGetElem() && isName(node.getFirstChild(), MODULE) && isLiteralString(node.getSecondChild());
    }

    static boolean isModuleProperty(Node node, String property) {
        return isModuleUse(node) && property.equals(node.getSecondChild().getString());
    }

    /**
     * dynCall('vii', ..) is static even though it goes through dynCall, we see the signature
     */
    public static boolean isStaticDynCall(Node node) {
        return node.isCall() && isName(node.getFirstChild(), DYN_CALL) && isLiteralString(node.getSecondChild());
    }

    public static String getStaticDynCallName(Node node) {
        return DYN_CALL_PREFIX + node.getSecondChild().getString();
    }

    /**
     * Some dynCall_* may be called but we can't tell which. Either
     * <p>
     * dynCall(*not a string*, ..)
     * <p>
     * or, to be conservative, the string "dynCall_" anywhere since that prefix means a dynCall name
     * may be built at runtime (dynCall and embind's requireFunction do this).
     */
    public static boolean isDynamicDynCall(Node node) {
        if (node.isCall()) {
            return isName(node.getFirstChild(), DYN_CALL) && !isLiteralString(node.getSecondChild());
        }
        return node.isStringLit() && DYN_CALL_PREFIX.equals(node.getString());
    }

    /**
     * The export wrappers the toolchain generates
     * <p>
     * var _foo = function() {
     * return (_foo = Module['asm']['foo']).apply(null, arguments);
     * };
     *
     * @return the name of the wrapped export, null if fn is not a wrapper
     */
    public static String getExportWrapperName(Node fn) {
        Node body = fn.getLastChild();
        if (!body.isBlock() || !body.hasOneChild()) {
            return null;
        }
        Node stmt = body.getFirstChild();
        if (!stmt.isReturn() || !stmt.hasChildren()) {
            return null;
        }
        Node rtn = stmt.getFirstChild();
        // a call through an assignment (x = y).apply(), not a plain call z()
        if (!rtn.isCall()) {
            return null;
        }
        Node callee = rtn.getFirstChild();
        if (!callee.isGetProp() && !callee.isGetElem()) {
            return null;
        }
        Node target = callee.getFirstChild();
        if (target.isAssign() && isAsmUse(target.getSecondChild())) {
            return getAsmOrModuleUseName(target.getSecondChild());
        }
        return null;
    }

    /**
     * The minimal runtime receives the exports in the instantiate callback
     * <p>
     * function(output) {
     * var asm = output.instance.exports; // may also be a plain assignment
     * _malloc = asm['malloc'];
     * ..
     * }
     *
     * @return the callback body, null if fn doesn't look like that
     */
    public static Node getMinimalRuntimeExportsBody(Node fn) {
        Node params = fn.getSecondChild();
        if (!params.hasOneChild() || !isName(params.getFirstChild(), "output")) {
            return null;
        }
        Node body = fn.getLastChild();
        if (!body.isBlock() || !body.hasChildren()) {
            return null;
        }

        Node first = body.getFirstChild();
        Node target = null;
        Node value = null;
        if (NodeUtil.isNameDeclaration(first) && first.hasOneChild() && first.getFirstChild().isName()) {
            target = first.getFirstChild();
            value = target.getFirstChild();
        } else if (first.isExprResult() && first.getFirstChild().isAssign()) {
            Node assign = first.getFirstChild();
            target = assign.getFirstChild();
            value = assign.getSecondChild();
        }

        if (isName(target, ASM) && value != null && value.matchesQualifiedName("output.instance.exports")) {
            return body;
        }
        return null;
    }

    /**
     * x = asm['y'];
     */
    public static boolean isMinimalRuntimeExport(Node stmt) {
        if (!stmt.isExprResult() || !stmt.getFirstChild().isAssign()) {
            return false;
        }
        Node assign = stmt.getFirstChild();
        Node value = assign.getSecondChild();
        return assign.getFirstChild().isName()
                && value.isGetElem()
                && isName(value.getFirstChild(), ASM)
                && isLiteralString(value.getSecondChild());
    }
}
