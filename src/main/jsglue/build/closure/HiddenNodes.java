package jsglue.build.closure;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * nodes retyped to EMPTY for the duration of a pass, remembers what they were
 */
public class HiddenNodes {
    private final Map<Node, Token> original = new IdentityHashMap<>();

    public void hide(Node node) {
        if (node.isEmpty()) {
            // already hidden or really empty, either way nothing to restore later
            return;
        }
        original.put(node, node.getToken());
        node.setToken(Token.EMPTY);
    }

    public boolean isHidden(Node node) {
        return original.containsKey(node);
    }

    Token take(Node node) {
        return original.remove(node);
    }

    public boolean isEmpty() {
        return original.isEmpty();
    }

    public int size() {
        return original.size();
    }
}
