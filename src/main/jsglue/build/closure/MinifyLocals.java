package jsglue.build.closure;

import com.google.common.collect.ImmutableMap;
import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * Minifies the locals of every toplevel function. The globals were already minified elsewhere
 * and arrive as the "globals" mapping of the extra info, every function name must be in there.
 * <p>
 * Names are handed out the first time a local is seen, params first, so the output is stable.
 */
public class MinifyLocals implements CompilerPass {

    private final OptimizerContext context;

    public MinifyLocals(OptimizerContext context) {
        this.context = context;
    }

    @Override
    public void process(Node externs, Node root) {
        ImmutableMap<String, String> globals = context.requireExtraInfo("minifyLocals").getGlobalMapping();
        checkState(globals != null, "minifyLocals needs \"globals\" as an object of minified names");

        for (Node fn = root.getFirstChild(); fn != null; fn = fn.getNext()) {
            if (NodeUtil.isFunctionDeclaration(fn)) {
                new FunctionMinifier(fn, globals).run();
            }
        }
    }

    private class FunctionMinifier {
        final Node fn;
        final ImmutableMap<String, String> globals;

        final Set<String> localNames = new HashSet<>();
        // old to new names
        final Map<String, String> newNames = new HashMap<>();
        // names that must not be collided with
        final Set<String> usedNames = new HashSet<>();
        final Map<String, String> labelNames = new HashMap<>();

        int nextMinifiedName = 0;
        int nextMinifiedLabel = 0;

        FunctionMinifier(Node fn, ImmutableMap<String, String> globals) {
            this.fn = fn;
            this.globals = globals;
        }

        void run() {
            Node params = fn.getSecondChild();
            Node body = fn.getLastChild();

            List<Node> paramNames = AstUtil.paramNames(params);
            for (Node param : paramNames) {
                localNames.add(param.getString());
            }
            TreeWalk.simple(body, new TreeWalk.Visitors().on(node -> {
                List<Node> bound = new ArrayList<>();
                for (Node decl = node.getFirstChild(); decl != null; decl = decl.getNext()) {
                    AstUtil.collectBoundNames(decl, bound);
                }
                for (Node name : bound) {
                    localNames.add(name.getString());
                }
            }, Token.VAR, Token.LET, Token.CONST));

            // the function name is not in its own scope, params and body only from here on.
            // globals get their known names, those are taken before any local is renamed
            TreeWalk.Visitors globalUses = new TreeWalk.Visitors()
                    .on(Token.NAME, node -> {
                        String name = node.getString();
                        if (!localNames.contains(name)) {
                            String minified = globals.get(name);
                            if (minified != null) {
                                newNames.put(name, minified);
                                usedNames.add(minified);
                            }
                        }
                    })
                    .on(Token.CALL, node -> {
                        // asm.js style locals are numbers, all functions are declared outside
                        Node callee = node.getFirstChild();
                        if (callee.isName()) {
                            checkState(!localNames.contains(callee.getString()), "cannot call a local: %s", callee.getString());
                        }
                    });
            TreeWalk.simple(params, globalUses);
            TreeWalk.simple(body, globalUses);

            for (Node param : paramNames) {
                String minified = nextMinifiedName();
                newNames.put(param.getString(), minified);
                param.setString(minified);
            }

            TreeWalk.Handlers renames = new TreeWalk.Handlers()
                    .on(Token.NAME, (node, c) -> {
                        renameName(node);
                        // declarators hold their initializer
                        TreeWalk.visitChildren(node, c::walk);
                    })
                    .on(Token.LABEL, (node, c) -> {
                        Node label = node.getFirstChild();
                        String minified = labelNames.computeIfAbsent(label.getString(), k -> nextMinifiedLabel());
                        label.setString(minified);
                        c.walk(node.getLastChild());
                    })
                    .on((node, c) -> {
                        if (node.hasChildren()) {
                            Node label = node.getFirstChild();
                            String minified = labelNames.get(label.getString());
                            checkState(minified != null, "jump to unknown label %s", label.getString());
                            label.setString(minified);
                        }
                    }, Token.BREAK, Token.CONTINUE);

            // default values, the param names themselves are done
            for (Node param = params.getFirstChild(); param != null; param = param.getNext()) {
                if (param.isDefaultValue()) {
                    TreeWalk.recursive(param.getSecondChild(), renames);
                }
            }
            TreeWalk.recursive(body, renames);

            Node name = fn.getFirstChild();
            String minified = globals.get(name.getString());
            checkState(minified != null, "function %s has no minified global name", name.getString());
            name.setString(minified);
        }

        void renameName(Node node) {
            String name = node.getString();
            String minified = newNames.get(name);
            if (minified != null) {
                node.setString(minified);
            } else if (localNames.contains(name)) {
                minified = nextMinifiedName();
                newNames.put(name, minified);
                node.setString(minified);
            }
        }

        String nextMinifiedName() {
            while (true) {
                String minified = context.getMinifiedNames().get(nextMinifiedName++);
                if (!usedNames.contains(minified) && !localNames.contains(minified)) {
                    return minified;
                }
            }
        }

        // labels have their own namespace
        String nextMinifiedLabel() {
            return context.getMinifiedNames().get(nextMinifiedLabel++);
        }
    }
}
