package jsglue.build.closure;

import com.google.javascript.jscomp.CompilerPass;
import com.google.javascript.jscomp.NodeUtil;
import com.google.javascript.rhino.IR;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * Removes obviously unused code: vars nobody reads and functions nobody calls.
 * <p>
 * Similar to the closure rules, something is kept only if it is used somewhere or has side effects.
 * The analysis is conservative, a name that shows up anywhere in a scope (or below it, as a free
 * variable) counts as used there.
 * <p>
 * One iteration only removes what is dead in its own scope. Things that become dead because of a
 * removal (a var only read by a removed function) need another iteration, which the aggressive mode
 * does until nothing changes.
 */
public class JsDeadCodeElimination implements CompilerPass {

    static class Usage {
        boolean def;
        boolean use;
        // params can't be eliminated
        boolean param;
    }

    static class Scope {
        final Map<String, Usage> names = new LinkedHashMap<>();

        Usage ensure(String name) {
            return names.computeIfAbsent(name, k -> new Usage());
        }
    }

    private final boolean aggressive;

    public JsDeadCodeElimination(boolean aggressive) {
        this.aggressive = aggressive;
    }

    @Override
    public void process(Node externs, Node root) {
        run(root);
    }

    /**
     * @return the number of things removed over all iterations
     */
    public int run(Node root) {
        int total = 0;
        while (true) {
            int removed = new Iteration().run(root);
            total += removed;
            if (removed == 0 || !aggressive) {
                return total;
            }
        }
    }

    private class Iteration {
        private final Deque<Scope> scopes = new ArrayDeque<>();
        private final LoopHeaders loopHeaders = new LoopHeaders();
        private int removed = 0;

        int run(Node root) {
            // begin with an empty toplevel scope
            scopes.push(new Scope());

            TreeWalk.recursive(root, new TreeWalk.Handlers()
                    .on(this::handleDeclaration, Token.VAR, Token.LET, Token.CONST)
                    .on(Token.FUNCTION, (node, c) -> handleFunction(node, c, NodeUtil.isFunctionDeclaration(node)))
                    .on(Token.NAME, (node, c) -> current().ensure(node.getString()).use = true));

            Scope toplevel = scopes.pop();
            checkState(scopes.isEmpty(), "unbalanced scopes after walking the program");

            Set<String> names = new HashSet<>();
            for (Map.Entry<String, Usage> e : toplevel.names.entrySet()) {
                Usage data = e.getValue();
                if (data.def && !data.use) {
                    checkState(!data.param, "toplevel name %s can't be a parameter", e.getKey());
                    names.add(e.getKey());
                }
            }
            cleanUp(root, names);
            return removed;
        }

        private Scope current() {
            Scope scope = scopes.peek();
            checkState(scope != null, "no scope to record a name in");
            return scope;
        }

        private void handleDeclaration(Node node, TreeWalk.Continuation c) {
            for (Node decl = node.getFirstChild(); decl != null; decl = decl.getNext()) {
                if (decl.isName()) {
                    current().ensure(decl.getString()).def = true;
                    if (decl.hasChildren()) {
                        c.walk(decl.getFirstChild());
                    }
                } else {
                    // destructuring, the names are defined here but we never try to remove them
                    List<Node> bound = new ArrayList<>();
                    AstUtil.collectBoundNames(decl, bound);
                    for (Node name : bound) {
                        current().ensure(name.getString()).def = true;
                    }
                    c.walk(decl);
                }
            }
        }

        private void handleFunction(Node node, TreeWalk.Continuation c, boolean defun) {
            // defun names matter, function names (the y in var x = function y() {..}) are just for stack traces
            String ownName = "";
            if (defun) {
                ownName = node.getFirstChild().getString();
                current().ensure(ownName).def = true;
            }

            Scope scope = new Scope();
            Node params = node.getSecondChild();
            for (Node name : AstUtil.paramNames(params)) {
                Usage data = scope.ensure(name.getString());
                data.def = true;
                data.param = true;
            }
            scopes.push(scope);

            // default values are evaluated in the function scope
            for (Node param = params.getFirstChild(); param != null; param = param.getNext()) {
                if (!param.isName()) {
                    c.walk(param);
                }
            }
            c.walk(node.getLastChild());

            checkState(scopes.pop() == scope, "scope stack out of order");

            Set<String> names = new HashSet<>();
            for (Map.Entry<String, Usage> e : scope.names.entrySet()) {
                String name = e.getKey();
                // references to ourselves inside ourselves don't keep us alive
                if (name.equals(ownName)) {
                    continue;
                }
                Usage data = e.getValue();
                if (data.use && !data.def) {
                    // free variable, used from a higher scope
                    current().ensure(name).use = true;
                    continue;
                }
                if (data.def && !data.use && !data.param) {
                    names.add(name);
                }
            }
            cleanUp(node.getLastChild(), names);
        }

        private void cleanUp(Node root, Set<String> names) {
            TreeWalk.recursive(root, new TreeWalk.Handlers()
                    .on((node, c) -> cleanUpDeclaration(node, names), Token.VAR, Token.LET, Token.CONST)
                    .on(Token.EXPR_RESULT, (node, c) -> cleanUpStatement(node))
                    .on(Token.FUNCTION, (node, c) -> {
                        if (NodeUtil.isFunctionDeclaration(node) && names.contains(node.getFirstChild().getString())) {
                            removed++;
                            AstUtil.emptyOut(node);
                        }
                        // do not recurse into other scopes
                    }));
            removed -= loopHeaders.restore(root);
        }

        private void cleanUpDeclaration(Node node, Set<String> names) {
            List<Node> dropped = new ArrayList<>();
            Node decl = node.getFirstChild();
            while (decl != null) {
                Node next = decl.getNext();
                if (decl.isName() && names.contains(decl.getString())) {
                    Node value = decl.getFirstChild();
                    if (value == null || !SideEffects.has(value)) {
                        dropped.add(decl.detach());
                    }
                }
                decl = next;
            }
            if (!dropped.isEmpty()) {
                removed++;
            }
            if (!node.hasChildren()) {
                // if this is in a for header the loop header repair will put it back
                loopHeaders.emptyOut(node, dropped);
            }
        }

        private void cleanUpStatement(Node node) {
            if (aggressive && !SideEffects.has(node)) {
                Node expr = node.getFirstChild();
                if (!expr.isNull() && !AstUtil.isUseStrict(expr)) {
                    expr.replaceWith(IR.nullNode());
                    removed++;
                }
            }
        }
    }
}
