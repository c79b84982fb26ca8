package jsglue.build.closure;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.EnumMap;
import java.util.Map;

/**
 * Walks used by all glue passes.
 * <p>
 * NodeTraversal would descend into nodes we temporarily retyped to EMPTY while they still
 * hold children (hidden scopes, things the graph builder already consumed), these walks stop there.
 * <p>
 * Children are read one step ahead so a handler may detach or replace the node it was called with.
 */
public class TreeWalk {

    public interface Visitor {
        void visit(Node node);
    }

    public interface Continuation {
        void walk(Node node);
    }

    public interface Handler {
        void handle(Node node, Continuation c);
    }

    public static class Visitors {
        private final Map<Token, Visitor> byToken = new EnumMap<>(Token.class);

        public Visitors on(Token token, Visitor visitor) {
            byToken.put(token, visitor);
            return this;
        }

        public Visitors on(Visitor visitor, Token... tokens) {
            for (Token token : tokens) {
                byToken.put(token, visitor);
            }
            return this;
        }

        Visitor get(Token token) {
            return byToken.get(token);
        }
    }

    public static class Handlers {
        private final Map<Token, Handler> byToken = new EnumMap<>(Token.class);

        public Handlers on(Token token, Handler handler) {
            byToken.put(token, handler);
            return this;
        }

        public Handlers on(Handler handler, Token... tokens) {
            for (Token token : tokens) {
                byToken.put(token, handler);
            }
            return this;
        }

        Handler get(Token token) {
            return byToken.get(token);
        }
    }

    public static void visitChildren(Node node, Visitor c) {
        // emptyOut() and temporary hiding leave EMPTY nodes that may still have children
        if (node.isEmpty()) {
            return;
        }
        Node child = node.getFirstChild();
        while (child != null) {
            Node next = child.getNext();
            c.visit(child);
            child = next;
        }
    }

    /**
     * post-order, calls the visitor registered for the node token if there is one
     */
    public static void simple(Node node, Visitors visitors) {
        visitChildren(node, child -> simple(child, visitors));
        Visitor visitor = visitors.get(node.getToken());
        if (visitor != null) {
            visitor.visit(node);
        }
    }

    /**
     * post-order, calls fn for every node
     */
    public static void full(Node node, Visitor fn) {
        visitChildren(node, child -> full(child, fn));
        fn.visit(node);
    }

    /**
     * a registered handler takes over the node and decides what to descend into via the continuation,
     * everything else is descended into automatically
     */
    public static void recursive(Node node, Handlers handlers) {
        new Continuation() {
            @Override
            public void walk(Node n) {
                Handler handler = handlers.get(n.getToken());
                if (handler == null) {
                    visitChildren(n, this::walk);
                } else {
                    handler.handle(n, this);
                }
            }
        }.walk(node);
    }
}
