package jsglue.build.closure;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkState;

public class AstUtil {

    /**
     * deletes a node without unlinking it, it stays in its slot as an EMPTY without children
     */
    public static void emptyOut(Node node) {
        node.removeChildren();
        node.setToken(Token.EMPTY);
    }

    public static boolean isLiteral(Node node) {
        switch (node.getToken()) {
            case NUMBER:
            case BIGINT:
            case STRINGLIT:
            case REGEXP:
            case TRUE:
            case FALSE:
            case NULL:
                return true;
            default:
                return false;
        }
    }

    public static boolean isUseStrict(Node node) {
        return node.isStringLit() && "use strict".equals(node.getString());
    }

    /**
     * Retypes every function below (and including) node to EMPTY so walks treat function bodies as opaque.
     * A function only has effects when it is called, not where it is declared.
     */
    public static HiddenNodes hideInnerScopes(Node node) {
        HiddenNodes hidden = new HiddenNodes();
        TreeWalk.simple(node, new TreeWalk.Visitors().on(Token.FUNCTION, hidden::hide));
        return hidden;
    }

    /**
     * undoes hiding, a restored node may itself contain hidden nodes
     */
    public static void restore(Node node, HiddenNodes hidden) {
        TreeWalk.full(node, n -> {
            if (hidden.isHidden(n)) {
                n.setToken(hidden.take(n));
                restore(n, hidden);
            }
        });
    }

    /**
     * the NAME nodes a parameter list binds, in declaration order
     */
    public static List<Node> paramNames(Node paramList) {
        checkState(paramList.isParamList(), "not a parameter list: %s", paramList);
        List<Node> names = new ArrayList<>();
        for (Node param = paramList.getFirstChild(); param != null; param = param.getNext()) {
            collectBoundNames(param, names);
        }
        return names;
    }

    /**
     * the NAME nodes bound by a declaration target, parameter or destructuring pattern
     */
    public static void collectBoundNames(Node target, List<Node> names) {
        switch (target.getToken()) {
            case NAME:
                names.add(target);
                break;
            case DEFAULT_VALUE:
            case ITER_REST:
            case OBJECT_REST:
            case DESTRUCTURING_LHS:
                collectBoundNames(target.getFirstChild(), names);
                break;
            case ARRAY_PATTERN:
                for (Node c = target.getFirstChild(); c != null; c = c.getNext()) {
                    collectBoundNames(c, names);
                }
                break;
            case OBJECT_PATTERN:
                for (Node c = target.getFirstChild(); c != null; c = c.getNext()) {
                    if (c.isComputedProp()) {
                        collectBoundNames(c.getSecondChild(), names);
                    } else if (c.isStringKey()) {
                        collectBoundNames(c.getFirstChild(), names);
                    } else {
                        collectBoundNames(c, names);
                    }
                }
                break;
            default:
                // EMPTY array holes, property targets in assignment patterns
                break;
        }
    }
}
