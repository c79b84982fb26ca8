package jsglue.build.closure;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;

/**
 * Emptying the declaration in
 * <p>
 * for (var i in x) {}
 * for (var j = 0;;) {}
 * <p>
 * leaves a broken loop header. The removed declarators are stashed when a declaration is emptied
 * and put back by {@link #restore(Node)}.
 */
public class LoopHeaders {

    private static class Stash {
        final Token token;
        final List<Node> declarators;

        Stash(Token token, List<Node> declarators) {
            this.token = token;
            this.declarators = declarators;
        }
    }

    private final Map<Node, Stash> stashed = new IdentityHashMap<>();

    /**
     * empties a declaration whose declarators were all detached
     */
    public void emptyOut(Node declaration, List<Node> removedDeclarators) {
        checkState(!declaration.hasChildren(), "declaration still has declarators: %s", declaration);
        stashed.put(declaration, new Stash(declaration.getToken(), removedDeclarators));
        AstUtil.emptyOut(declaration);
    }

    /**
     * @return the number of loop headers put back
     */
    public int restore(Node root) {
        int[] restored = {0};
        TreeWalk.simple(root, new TreeWalk.Visitors()
                .on(Token.FOR, node -> {
                    // for (;;) has an EMPTY init that never was a declaration
                    if (fix(node.getFirstChild(), false)) {
                        restored[0]++;
                    }
                })
                .on(node -> {
                    if (fix(node.getFirstChild(), true)) {
                        restored[0]++;
                    }
                }, Token.FOR_IN, Token.FOR_OF, Token.FOR_AWAIT_OF));
        return restored[0];
    }

    private boolean fix(Node init, boolean required) {
        if (!init.isEmpty()) {
            return false;
        }
        Stash stash = stashed.remove(init);
        if (stash == null) {
            checkState(!required, "loop header was emptied without a backup of its declaration");
            return false;
        }
        init.setToken(stash.token);
        for (Node declarator : stash.declarators) {
            init.addChildToBack(declarator);
        }
        return true;
    }
}
