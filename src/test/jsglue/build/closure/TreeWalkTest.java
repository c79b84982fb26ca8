package jsglue.build.closure;

import com.google.common.collect.ImmutableList;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TreeWalkTest {

    static List<String> names(Node root) {
        List<String> names = new ArrayList<>();
        TreeWalk.simple(root, new TreeWalk.Visitors().on(Token.NAME, n -> names.add(n.getString())));
        return names;
    }

    @Test
    void testSimpleIsPostOrder() {
        Node root = JsTesting.parse("a + b; c;");
        assertEquals(ImmutableList.of("a", "b", "c"), names(root));

        List<Token> tokens = new ArrayList<>();
        TreeWalk.full(root, n -> tokens.add(n.getToken()));
        assertEquals(Token.NAME, tokens.get(0));
        assertEquals(Token.SCRIPT, tokens.get(tokens.size() - 1));
    }

    @Test
    void testEmptyStopsDescent() {
        Node root = JsTesting.parse("function f() { inner; } outer;");
        HiddenNodes hidden = AstUtil.hideInnerScopes(root);

        assertEquals(1, hidden.size());
        assertEquals(ImmutableList.of("outer"), names(root));

        AstUtil.restore(root, hidden);
        assertTrue(hidden.isEmpty());
        assertTrue(root.getFirstChild().isFunction());
        assertEquals(ImmutableList.of("f", "inner", "outer"), names(root));
    }

    @Test
    void testRestoreNested() {
        String code = "function f() { var g = function() { return () => 1; }; }";
        Node root = JsTesting.parse(code);
        HiddenNodes hidden = AstUtil.hideInnerScopes(root);

        assertEquals(3, hidden.size());
        assertTrue(root.getFirstChild().isEmpty());

        AstUtil.restore(root, hidden);
        assertTrue(hidden.isEmpty());
        assertEquals(JsTesting.normalize(code), JsTesting.print(root));
    }

    @Test
    void testRecursiveHandlerControlsDescent() {
        Node root = JsTesting.parse("function f() { hidden; } visible;");
        List<String> seen = new ArrayList<>();

        TreeWalk.recursive(root, new TreeWalk.Handlers()
                .on(Token.FUNCTION, (node, c) -> {
                    // skip the body
                })
                .on(Token.NAME, (node, c) -> seen.add(node.getString())));

        assertEquals(ImmutableList.of("visible"), seen);
    }

    @Test
    void testHandlerMayDetachCurrentNode() {
        Node root = JsTesting.parse("a; b; c;");
        int[] count = {0};

        TreeWalk.simple(root, new TreeWalk.Visitors().on(Token.EXPR_RESULT, n -> {
            count[0]++;
            n.detach();
        }));

        assertEquals(3, count[0]);
        assertFalse(root.hasChildren());
    }

    @Test
    void testBoundNames() {
        Node fn = JsTesting.parse("function f(a, b = 1, {c, d: [e]}, ...g) {}").getFirstChild();
        List<String> params = new ArrayList<>();
        for (Node n : AstUtil.paramNames(fn.getSecondChild())) {
            params.add(n.getString());
        }
        assertEquals(ImmutableList.of("a", "b", "c", "e", "g"), params);

        Node var = JsTesting.parse("var {x, y: [z, ...w]} = o;").getFirstChild();
        List<Node> bound = new ArrayList<>();
        AstUtil.collectBoundNames(var.getFirstChild(), bound);
        List<String> names = new ArrayList<>();
        for (Node n : bound) {
            names.add(n.getString());
        }
        assertEquals(ImmutableList.of("x", "z", "w"), names);
    }
}
