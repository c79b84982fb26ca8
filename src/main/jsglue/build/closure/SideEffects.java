package jsglue.build.closure;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.rhino.Node;

/**
 * Conservative side effect analysis, anything not known to be safe has side effects.
 * <p>
 * Works on syntax only, the glue code is machine generated and uses a small set of shapes.
 */
public class SideEffects {

    // property reads on these can't run user code
    public static final ImmutableSet<String> PURE_GLOBAL_OBJECTS = ImmutableSet.of("Math");

    public static final ImmutableSet<String> PURE_CONSTRUCTORS = ImmutableSet.of(
            "TextDecoder",
            "ArrayBuffer",
            "Int8Array",
            "Uint8Array",
            "Int16Array",
            "Uint16Array",
            "Int32Array",
            "Uint32Array",
            "Float32Array",
            "Float64Array");

    public static boolean has(Node node) {
        HiddenNodes hidden = AstUtil.hideInnerScopes(node);
        boolean[] has = {false};
        TreeWalk.full(node, n -> {
            if (!isSafe(n)) {
                has[0] = true;
            }
        });
        AstUtil.restore(node, hidden);
        return has[0];
    }

    /**
     * only looks at the node itself, children are checked by the walk
     */
    static boolean isSafe(Node node) {
        switch (node.getToken()) {
            case NUMBER:
            case BIGINT:
            case STRINGLIT:
            case REGEXP:
            case TRUE:
            case FALSE:
            case NULL:
            case NAME:
            case NOT:
            case BITNOT:
            case POS:
            case NEG:
            case TYPEOF:
            case VOID:
            case ADD:
            case SUB:
            case MUL:
            case DIV:
            case MOD:
            case EXPONENT:
            case BITOR:
            case BITXOR:
            case BITAND:
            case LSH:
            case RSH:
            case URSH:
            case EQ:
            case NE:
            case SHEQ:
            case SHNE:
            case LT:
            case LE:
            case GT:
            case GE:
            case INSTANCEOF:
            case IN:
            case AND:
            case OR:
            case COALESCE:
            case HOOK:
            case EXPR_RESULT:
            case FUNCTION:
            case VAR:
            case LET:
            case CONST:
            case OBJECTLIT:
            case STRING_KEY:
            case MEMBER_FUNCTION_DEF:
            case GETTER_DEF:
            case SETTER_DEF:
            case COMPUTED_PROP:
            case OBJECT_SPREAD:
            case ITER_SPREAD:
            case ARRAYLIT:
            case BLOCK:
            case EMPTY:
                return true;

            case GETPROP:
            case GETELEM:
            case OPTCHAIN_GETPROP:
            case OPTCHAIN_GETELEM: {
                Node object = node.getFirstChild();
                return object.isName() && PURE_GLOBAL_OBJECTS.contains(object.getString());
            }

            case NEW: {
                // the arguments are checked by the walk like everything else
                Node callee = node.getFirstChild();
                return callee.isName() && PURE_CONSTRUCTORS.contains(callee.getString());
            }

            default:
                return false;
        }
    }
}
