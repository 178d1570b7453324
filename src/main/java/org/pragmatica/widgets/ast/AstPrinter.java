package org.pragmatica.widgets.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Renders AST nodes back to canonical source text.
 *
 * <p>Output is normalized: comments and original whitespace are dropped, arguments are separated by
 * {@code ", "} and top-level expressions are written one per line. Literals keep their source form.
 *
 * <p>Rendering works from an explicit stack of pending nodes and text fragments, so arbitrarily
 * long property chains and hand-built trees of any depth print without deep recursion.
 */
public final class AstPrinter {

    private AstPrinter() {
    }

    public static String print(AstNode node) {
        var sb = new StringBuilder();
        // Either an AstNode still to render or a String to append verbatim
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(node);

        while (!pending.isEmpty()) {
            var item = pending.pop();
            if (item instanceof String text) {
                sb.append(text);
            } else {
                expand((AstNode) item, sb, pending);
            }
        }
        return sb.toString();
    }

    // Items are pushed in reverse of their output order
    private static void expand(AstNode node, StringBuilder sb, Deque<Object> pending) {
        if (node instanceof AstNode.Program program) {
            pushSeparated(program.body(), "\n", pending);
        } else if (node instanceof AstNode.ConstructorCall call) {
            pending.push(call.arguments());
            call.modifier().ifPresent(modifier -> sb.append(modifier).append(' '));
            sb.append(call.name());
        } else if (node instanceof AstNode.Identifier identifier) {
            sb.append(identifier.name());
        } else if (node instanceof AstNode.Literal literal) {
            sb.append(literal.raw());
        } else if (node instanceof AstNode.PropertyAccess access) {
            pending.push((access.nullAware() ? "?." : ".") + access.property());
            pending.push(access.target());
        } else if (node instanceof AstNode.MethodCall call) {
            pending.push(call.arguments());
            pending.push("." + call.method());
            pending.push(call.target());
            call.modifier().ifPresent(modifier -> sb.append(modifier).append(' '));
        } else if (node instanceof AstNode.ArrayLiteral array) {
            pending.push("]");
            pushSeparated(array.elements(), ", ", pending);
            sb.append('[');
        } else if (node instanceof AstNode.NamedArgument named) {
            pending.push(named.value());
            sb.append(named.name()).append(": ");
        } else if (node instanceof AstNode.PositionalArgument positional) {
            pending.push(positional.value());
        } else if (node instanceof AstNode.ArgumentList list) {
            pending.push(")");
            pushSeparated(list.arguments(), ", ", pending);
            sb.append('(');
        }
    }

    private static void pushSeparated(List<? extends AstNode> nodes, String separator, Deque<Object> pending) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            pending.push(nodes.get(i));
            if (i > 0) {
                pending.push(separator);
            }
        }
    }
}
