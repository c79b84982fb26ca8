package jsglue.build.closure;

import com.google.gson.JsonObject;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * Minifies everything inside the wasm2js wrapper
 * <p>
 * function instantiate(wasmImports, wasmMemory, wasmTable) {
 * var helper..
 * function asmFunc(global, env, buffer) {
 * var memory = env.memory;
 * var HEAP8 = new global.Int8Array(buffer);
 * <p>
 * except instantiate itself, which is called from outside.
 * <p>
 * This is not scope aware, every declared name is treated as one global namespace. That works for
 * wasm2js output, which doesn't shadow. The name table is emitted as extra info for minifyLocals.
 */
public class MinifyGlobals implements CompilerPass {

    public static final String INSTANTIATE = "instantiate";

    private final OptimizerContext context;

    public MinifyGlobals(OptimizerContext context) {
        this.context = context;
    }

    @Override
    public void process(Node externs, Node root) {
        List<String> globals = context.requireExtraInfo("minifyGlobals").getGlobalNames();

        checkState(root.hasOneChild()
                        && NodeUtil.isFunctionDeclaration(root.getFirstChild())
                        && INSTANTIATE.equals(root.getFirstChild().getFirstChild().getString()),
                "minifyGlobals only works on a single function %s(..) {..}", INSTANTIATE);

        Node fn = root.getFirstChild();
        Node fnName = fn.getFirstChild();

        Set<String> declared = new LinkedHashSet<>();
        TreeWalk.simple(fn, new TreeWalk.Visitors()
                .on(Token.FUNCTION, node -> {
                    if (NodeUtil.isFunctionDeclaration(node) && node != fn) {
                        declared.add(node.getFirstChild().getString());
                    }
                    for (Node param : AstUtil.paramNames(node.getSecondChild())) {
                        declared.add(param.getString());
                    }
                })
                .on(node -> {
                    List<Node> bound = new ArrayList<>();
                    for (Node decl = node.getFirstChild(); decl != null; decl = decl.getNext()) {
                        AstUtil.collectBoundNames(decl, bound);
                    }
                    for (Node name : bound) {
                        declared.add(name.getString());
                    }
                }, Token.VAR, Token.LET, Token.CONST));

        // declared names first, things like HEAP8 are used a lot and should get the short ones
        Map<String, String> minified = new LinkedHashMap<>();
        int[] next = {0};
        for (String name : declared) {
            minified.computeIfAbsent(name, k -> context.getMinifiedNames().get(next[0]++));
        }
        // globals of the function chunks, not seen here but minifyLocals will need them
        for (String name : globals) {
            minified.computeIfAbsent(name, k -> context.getMinifiedNames().get(next[0]++));
        }

        // x.a is a GETPROP holding a string, only real names are renamed
        TreeWalk.simple(fn, new TreeWalk.Visitors().on(Token.NAME, node -> {
            if (node != fnName) {
                String replacement = minified.get(node.getString());
                if (replacement != null) {
                    node.setString(replacement);
                }
            }
        }));

        JsonObject json = new JsonObject();
        for (Map.Entry<String, String> e : minified.entrySet()) {
            json.addProperty(e.getKey(), e.getValue());
        }
        context.setSuffix(ExtraInfo.MARKER + json);
    }
}
