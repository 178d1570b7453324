package org.pragmatica.widgets.ast;

import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Syntax tree of the widget expression subset.
 *
 * <p>Nodes are immutable, every node is owned by exactly one parent and carries the span of
 * source text it was parsed from.
 */
public sealed interface AstNode {

    SourceSpan span();

    /**
     * Direct child nodes in source order.
     */
    List<AstNode> children();

    /**
     * Root of a parsed source text: top-level expressions in source order.
     */
    record Program(SourceSpan span, List<AstNode> body) implements AstNode {
        public Program {
            body = List.copyOf(body);
        }

        public static Program empty(SourceSpan span) {
            return new Program(span, List.of());
        }

        public boolean isEmpty() {
            return body.isEmpty();
        }

        @Override
        public List<AstNode> children() {
            return body;
        }
    }

    /**
     * Bare identifier immediately followed by an argument list: {@code Text("hi")}.
     *
     * @param modifier {@code const} or {@code new} when written before the name
     */
    record ConstructorCall(SourceSpan span, String name, ArgumentList arguments, Optional<String> modifier)
        implements AstNode {
        public int argumentCount() {
            return arguments.arguments().size();
        }

        @Override
        public List<AstNode> children() {
            return List.of(arguments);
        }
    }

    record Identifier(SourceSpan span, String name) implements AstNode {
        @Override
        public List<AstNode> children() {
            return List.of();
        }
    }

    /**
     * String, number, boolean or null literal.
     *
     * @param value {@link String}, {@link Long}, {@link Double}, {@link Boolean} or {@code null}
     * @param raw   literal as written in source
     */
    record Literal(SourceSpan span, Object value, String raw) implements AstNode {
        @Override
        public List<AstNode> children() {
            return List.of();
        }
    }

    /**
     * {@code target.property}, or {@code target?.property} when {@code nullAware}.
     */
    record PropertyAccess(SourceSpan span, AstNode target, String property, boolean nullAware) implements AstNode {
        @Override
        public List<AstNode> children() {
            return List.of(target);
        }
    }

    /**
     * {@code target.method(arguments)}; also named constructors such as {@code EdgeInsets.all(8)}.
     *
     * @param modifier {@code const} or {@code new} written before a named constructor, empty for
     *                 ordinary method calls
     */
    record MethodCall(SourceSpan span, AstNode target, String method, ArgumentList arguments, Optional<String> modifier)
        implements AstNode {
        @Override
        public List<AstNode> children() {
            return List.of(target, arguments);
        }
    }

    record ArrayLiteral(SourceSpan span, List<AstNode> elements) implements AstNode {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public List<AstNode> children() {
            return elements;
        }
    }

    /**
     * A single argument of an argument list.
     */
    sealed interface Argument extends AstNode {
        AstNode value();

        @Override
        default List<AstNode> children() {
            return List.of(value());
        }
    }

    record NamedArgument(SourceSpan span, String name, AstNode value) implements Argument {}

    record PositionalArgument(SourceSpan span, AstNode value) implements Argument {}

    /**
     * Arguments in source order; named and positional arguments may interleave.
     */
    record ArgumentList(SourceSpan span, List<Argument> arguments) implements AstNode {
        public ArgumentList {
            arguments = List.copyOf(arguments);
        }

        public List<NamedArgument> named() {
            var result = new ArrayList<NamedArgument>();
            for (var argument : arguments) {
                if (argument instanceof NamedArgument named) {
                    result.add(named);
                }
            }
            return result;
        }

        public List<PositionalArgument> positional() {
            var result = new ArrayList<PositionalArgument>();
            for (var argument : arguments) {
                if (argument instanceof PositionalArgument positional) {
                    result.add(positional);
                }
            }
            return result;
        }

        @Override
        public List<AstNode> children() {
            return List.copyOf(arguments);
        }
    }
}
