package io.screenbind.core.expr;

import io.screenbind.core.model.ExprNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Static analysis over a parsed tree, used to check an expression against an allow-list before it
 * is stored. Traversal is depth-first in source order; duplicates are kept.
 */
public final class AstInspector {

    private AstInspector() {}

    /** Every path node as its dotted string. */
    public static List<String> collectPaths(ExprNode root) {
        List<String> paths = new ArrayList<>();
        visit(root, paths, true);
        return paths;
    }

    /** Every call node's function name. */
    public static List<String> collectFunctions(ExprNode root) {
        List<String> names = new ArrayList<>();
        visit(root, names, false);
        return names;
    }

    private static void visit(ExprNode node, List<String> out, boolean paths) {
        if (node instanceof ExprNode.Path path) {
            if (paths) {
                out.add(path.dotted());
            }
        } else if (node instanceof ExprNode.Call call) {
            if (!paths) {
                out.add(call.name());
            }
            call.args().forEach(arg -> visit(arg, out, paths));
        } else if (node instanceof ExprNode.Binary binary) {
            visit(binary.left(), out, paths);
            visit(binary.right(), out, paths);
        } else if (node instanceof ExprNode.Unary unary) {
            visit(unary.operand(), out, paths);
        } else if (node instanceof ExprNode.Ternary ternary) {
            visit(ternary.condition(), out, paths);
            visit(ternary.consequent(), out, paths);
            visit(ternary.alternate(), out, paths);
        } else if (node instanceof ExprNode.ArrayLiteral array) {
            array.elements().forEach(element -> visit(element, out, paths));
        }
    }
}
