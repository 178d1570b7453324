package org.pragmatica.widgets.extract;

import org.pragmatica.widgets.ast.AstNode;
import org.pragmatica.widgets.ast.AstNode.ArgumentList;
import org.pragmatica.widgets.ast.AstNode.ArrayLiteral;
import org.pragmatica.widgets.ast.AstNode.ConstructorCall;
import org.pragmatica.widgets.ast.AstNode.Identifier;
import org.pragmatica.widgets.ast.AstNode.MethodCall;
import org.pragmatica.widgets.ast.AstNode.NamedArgument;
import org.pragmatica.widgets.ast.AstNode.Program;
import org.pragmatica.widgets.ast.AstNode.PropertyAccess;
import org.pragmatica.widgets.ast.AstPrinter;
import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.DiagnosticCode;
import org.pragmatica.widgets.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds widget trees from parsed programs.
 *
 * <p>Every constructor call that is not a known value type becomes a widget; calls missing from
 * the catalog become {@link Widget#UNKNOWN} placeholders with one warning each, and their
 * arguments are still walked. Named constructors ({@code Image.asset(...)}) are widgets when the
 * catalog registers them.
 *
 * <p>Widgets are visited with an explicit work stack, so source nesting never grows the call
 * stack; nesting beyond {@link ExtractorConfig#maxWidgetDepth()} is dropped with a diagnostic.
 * Extraction never throws on source content.
 */
public final class WidgetExtractor {
    private static final Logger log = LoggerFactory.getLogger(WidgetExtractor.class);

    private static final String POSITIONAL_KEY_PREFIX = "positional";
    private static final Set<String> THEME_OWNERS = Set.of("Theme", "CupertinoTheme");
    private static final Set<String> COLOR_OWNERS = Set.of("Colors", "CupertinoColors");
    private static final Map<String, Range> RANGES = Map.of(
        "opacity", new Range(0, 1),
        "flex", Range.NON_NEGATIVE,
        "width", Range.NON_NEGATIVE,
        "height", Range.NON_NEGATIVE,
        "elevation", Range.NON_NEGATIVE,
        "fontSize", Range.NON_NEGATIVE);

    private final ExtractorConfig config;
    private final WidgetCatalog catalog;
    private final List<Diagnostic> diagnostics;
    private final Deque<Task> pending;
    private final List<Draft> created;
    private int nextId;

    private WidgetExtractor(ExtractorConfig config) {
        this.config = config;
        this.catalog = config.catalog();
        this.diagnostics = new ArrayList<>();
        this.pending = new ArrayDeque<>();
        this.created = new ArrayList<>();
        this.nextId = 1;
    }

    public static ExtractionResult extract(Program program) {
        return extract(program, ExtractorConfig.DEFAULT);
    }

    public static ExtractionResult extract(Program program, ExtractorConfig config) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(config, "config");
        return new WidgetExtractor(config).run(program.body());
    }

    public static ExtractionResult extract(ConstructorCall call, ExtractorConfig config) {
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(config, "config");
        return new WidgetExtractor(config).run(List.of(call));
    }

    private ExtractionResult run(List<AstNode> expressions) {
        var roots = new ArrayList<Draft>();
        for (var expression : expressions) {
            if (isWidgetNode(expression)) {
                roots.add(walk(expression));
            } else {
                var embedded = embeddedWidgets(expression);
                var diagnostic = Diagnostic.of(DiagnosticCode.NOT_A_WIDGET, expression.span(), AstPrinter.print(expression))
                                           .withContext(Diagnostic.NODE_TYPE, expression.getClass().getSimpleName());
                diagnostics.add(embedded.isEmpty()
                                ? diagnostic
                                : diagnostic.withNote(embedded.size() + " widget expression(s) inside it extracted as separate trees"));
                for (var widget : embedded) {
                    roots.add(walk(widget));
                }
            }
        }

        // Pre-order: children are created after their parent, so freeze in reverse
        for (int i = created.size() - 1; i >= 0; i--) {
            created.get(i).freeze();
        }
        var widgets = roots.stream()
                           .map(draft -> draft.frozen)
                           .toList();
        log.debug("Extracted {} widgets in {} trees from {} expressions, {} diagnostics",
                  created.size(), widgets.size(), expressions.size(), diagnostics.size());
        return new ExtractionResult(widgets, diagnostics);
    }

    private Draft walk(AstNode rootNode) {
        Draft root = null;
        pending.push(new Task(rootNode, null, Optional.empty(), 1));
        while (!pending.isEmpty()) {
            var task = pending.pop();
            if (task.depth() > config.maxWidgetDepth()) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.NESTING_TOO_DEEP, task.node().span(), config.maxWidgetDepth())
                                          .withContext(Diagnostic.WIDGET, task.parent().constructor)
                                          .withLabel("widget subtree dropped"));
                continue;
            }
            var draft = open(task);
            if (root == null) {
                root = draft;
            }
        }
        return root;
    }

    private Draft open(Task task) {
        var node = task.node();
        var name = constructorName(node).orElseThrow();
        var arguments = argumentsOf(node);
        var kind = catalog.widget(name);
        var draft = new Draft("widget_" + nextId++, kind, name, task.slot(), node.span());

        if (kind.isEmpty()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.UNKNOWN_WIDGET, node.span(), name)
                                      .withContext(Diagnostic.WIDGET, name)
                                      .withContext(Diagnostic.LEXEME, name)
                                      .withLabel("not a known widget or value type"));
        }
        created.add(draft);
        if (task.parent() != null) {
            task.parent().children.add(draft);
        }

        var scope = new Scope(draft, new ArrayList<>(), task.depth());
        var slots = kind.map(WidgetKind::positionalSlots).orElse(List.of());
        for (var argument : keyed(arguments, slots, name)) {
            resolveProperty(argument, scope);
        }
        for (int i = scope.childTasks().size() - 1; i >= 0; i--) {
            pending.push(scope.childTasks().get(i));
        }
        return draft;
    }

    private void resolveProperty(Keyed argument, Scope scope) {
        var value = argument.value();
        var key = argument.key();

        if (isWidgetNode(value)) {
            scope.hoist(value, key);
            return;
        }
        if (value instanceof ArrayLiteral array) {
            var rest = new ArrayList<PropertyValue>();
            boolean hasWidgets = false;
            for (var element : array.elements()) {
                if (isWidgetNode(element)) {
                    scope.hoist(element, key);
                    hasWidgets = true;
                } else {
                    resolveValue(element, key, scope, 1).ifPresent(rest::add);
                }
            }
            if (!hasWidgets || !rest.isEmpty()) {
                scope.owner().properties.put(key, new PropertyValue.ListValue(rest));
            }
            return;
        }
        resolveValue(value, key, scope, 1).ifPresent(resolved -> {
            checkRange(key, resolved, scope.owner().constructor, value.span());
            scope.owner().properties.put(key, resolved);
        });
    }

    /**
     * Resolves a non-widget value. Widgets met inside value objects or lists are hoisted into
     * the owning widget's children under {@code path}, and yield no value.
     */
    private Optional<PropertyValue> resolveValue(AstNode node, String path, Scope scope, int nesting) {
        if (nesting > config.maxWidgetDepth()) {
            diagnostics.add(Diagnostic.of(DiagnosticCode.NESTING_TOO_DEEP, node.span(), config.maxWidgetDepth())
                                      .withContext(Diagnostic.FIELD, path)
                                      .withLabel("value dropped"));
            return Optional.empty();
        }
        if (node instanceof AstNode.Literal literal) {
            return Optional.of(PropertyValue.Literal.of(literal.value()));
        }
        if (isWidgetNode(node)) {
            scope.hoist(node, path);
            return Optional.empty();
        }
        if (node instanceof ArrayLiteral array) {
            var items = new ArrayList<PropertyValue>();
            for (var element : array.elements()) {
                resolveValue(element, path, scope, nesting + 1).ifPresent(items::add);
            }
            return Optional.of(new PropertyValue.ListValue(items));
        }
        var valueKind = constructorName(node).flatMap(catalog::value);
        if (valueKind.isPresent()) {
            return Optional.of(objectValue(valueKind.get(), argumentsOf(node), path, scope, nesting));
        }
        hoistEmbeddedWidgets(node, path, scope);
        return Optional.of(reference(node));
    }

    // Widgets passed to calls the extractor does not evaluate, e.g. Positioned.fill(child: ...)
    private void hoistEmbeddedWidgets(AstNode node, String path, Scope scope) {
        for (var widget : embeddedWidgets(node)) {
            scope.hoist(widget, path);
        }
    }

    /**
     * Outermost widget nodes below {@code node} in source order; {@code node} itself is not examined.
     */
    private List<AstNode> embeddedWidgets(AstNode node) {
        var found = new ArrayList<AstNode>();
        var stack = new ArrayDeque<AstNode>();
        pushChildren(stack, node);
        while (!stack.isEmpty()) {
            var current = stack.pop();
            if (isWidgetNode(current)) {
                found.add(current);
            } else {
                pushChildren(stack, current);
            }
        }
        return found;
    }

    private static void pushChildren(Deque<AstNode> stack, AstNode node) {
        var children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private PropertyValue objectValue(ValueKind kind, ArgumentList arguments, String path, Scope scope, int nesting) {
        var fields = new LinkedHashMap<String, PropertyValue>();
        for (var argument : keyed(arguments, kind.positionalSlots(), kind.name())) {
            var key = argument.key();
            resolveValue(argument.value(), path + "." + key, scope, nesting + 1).ifPresent(resolved -> {
                checkRange(key, resolved, kind.name(), argument.value().span());
                fields.put(key, resolved);
            });
        }
        return new PropertyValue.ObjectValue(kind.name(), fields);
    }

    /**
     * Assigns every argument its property name: named arguments keep theirs, positional ones take
     * the owner's slot for their index or a synthetic {@code positionalN} key. Repeated names keep
     * the first occurrence.
     */
    private List<Keyed> keyed(ArgumentList arguments, List<String> slots, String owner) {
        var result = new ArrayList<Keyed>();
        var seen = new HashSet<String>();
        int positionalIndex = 0;

        for (var argument : arguments.arguments()) {
            String key;
            if (argument instanceof NamedArgument named) {
                key = named.name();
            } else {
                int index = positionalIndex++;
                key = index < slots.size() ? slots.get(index) : unmappedPositional(index, owner, argument.span());
            }
            if (!seen.add(key)) {
                diagnostics.add(Diagnostic.of(DiagnosticCode.DUPLICATE_ARGUMENT, argument.span(), key, owner)
                                          .withContext(Diagnostic.FIELD, key)
                                          .withContext(Diagnostic.WIDGET, owner)
                                          .withLabel("ignored"));
                continue;
            }
            result.add(new Keyed(key, argument.value()));
        }
        return result;
    }

    private String unmappedPositional(int index, String owner, SourceSpan span) {
        var key = POSITIONAL_KEY_PREFIX + index;
        diagnostics.add(Diagnostic.of(DiagnosticCode.UNMAPPED_POSITIONAL, span, index, owner, key)
                                  .withContext(Diagnostic.FIELD, key)
                                  .withContext(Diagnostic.WIDGET, owner));
        return key;
    }

    private void checkRange(String key, PropertyValue value, String owner, SourceSpan span) {
        var range = RANGES.get(key);
        if (range == null || !(value instanceof PropertyValue.Literal literal)) {
            return;
        }
        literal.asNumber()
               .filter(number -> !range.contains(number))
               .ifPresent(number -> diagnostics.add(
                   Diagnostic.of(DiagnosticCode.VALUE_OUT_OF_RANGE, span, literal.value(), key, range)
                             .withContext(Diagnostic.FIELD, key)
                             .withContext(Diagnostic.VALUE, literal.value())
                             .withContext(Diagnostic.WIDGET, owner)));
    }

    private PropertyValue reference(AstNode node) {
        var text = AstPrinter.print(node);
        var themePath = themePath(node);
        if (themePath.isPresent()) {
            return PropertyValue.Reference.theme(text, themePath.get());
        }
        if (node instanceof Identifier) {
            return PropertyValue.Reference.of(ReferenceKind.IDENTIFIER, text);
        }
        var root = rootName(node);
        if (root.filter(COLOR_OWNERS::contains).isPresent()) {
            return PropertyValue.Reference.of(ReferenceKind.COLOR, text);
        }
        if (node instanceof PropertyAccess access
            && access.target() instanceof Identifier type
            && isTypeName(type.name())) {
            return PropertyValue.Reference.of(ReferenceKind.ENUM, text);
        }
        return PropertyValue.Reference.of(ReferenceKind.EXPRESSION, text);
    }

    /**
     * Member path after {@code Theme.of(...)}, e.g. {@code textTheme.titleLarge}.
     */
    private static Optional<String> themePath(AstNode node) {
        var segments = new ArrayDeque<String>();
        var current = node;
        while (true) {
            if (current instanceof PropertyAccess access) {
                segments.push(access.property());
                current = access.target();
            } else if (current instanceof MethodCall call) {
                if (call.target() instanceof Identifier owner
                    && THEME_OWNERS.contains(owner.name())
                    && "of".equals(call.method())) {
                    return Optional.of(String.join(".", segments));
                }
                segments.push(call.method() + "()");
                current = call.target();
            } else {
                return Optional.empty();
            }
        }
    }

    private static Optional<String> rootName(AstNode node) {
        var current = node;
        while (true) {
            if (current instanceof PropertyAccess access) {
                current = access.target();
            } else if (current instanceof MethodCall call) {
                current = call.target();
            } else if (current instanceof Identifier identifier) {
                return Optional.of(identifier.name());
            } else {
                return Optional.empty();
            }
        }
    }

    private boolean isWidgetNode(AstNode node) {
        if (node instanceof ConstructorCall call) {
            return !catalog.isValue(call.name());
        }
        return node instanceof MethodCall
               && constructorName(node).filter(catalog::isWidget).isPresent();
    }

    /**
     * {@code Name} for constructor calls, {@code Type.name} for calls on a bare type identifier.
     */
    private static Optional<String> constructorName(AstNode node) {
        if (node instanceof ConstructorCall call) {
            return Optional.of(call.name());
        }
        if (node instanceof MethodCall call && call.target() instanceof Identifier type && isTypeName(type.name())) {
            return Optional.of(type.name() + "." + call.method());
        }
        return Optional.empty();
    }

    private static ArgumentList argumentsOf(AstNode node) {
        return node instanceof ConstructorCall call ? call.arguments() : ((MethodCall) node).arguments();
    }

    private static boolean isTypeName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    private record Task(AstNode node, Draft parent, Optional<String> slot, int depth) {}

    private record Keyed(String key, AstNode value) {}

    private record Scope(Draft owner, List<Task> childTasks, int depth) {
        void hoist(AstNode node, String slot) {
            childTasks.add(new Task(node, owner, Optional.of(slot), depth + 1));
        }
    }

    private record Range(double min, double max) {
        static final Range NON_NEGATIVE = new Range(0, Double.POSITIVE_INFINITY);

        boolean contains(double value) {
            return value >= min && value <= max;
        }

        @Override
        public String toString() {
            return "[" + format(min) + ", " + (Double.isInfinite(max) ? "inf)" : format(max) + "]");
        }

        private static String format(double value) {
            return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
        }
    }

    private static final class Draft {
        private final String id;
        private final Optional<WidgetKind> kind;
        private final String constructor;
        private final Optional<String> slot;
        private final SourceSpan span;
        private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
        private final List<Draft> children = new ArrayList<>();
        private Widget frozen;

        private Draft(String id, Optional<WidgetKind> kind, String constructor, Optional<String> slot, SourceSpan span) {
            this.id = id;
            this.kind = kind;
            this.constructor = constructor;
            this.slot = slot;
            this.span = span;
        }

        private void freeze() {
            var childWidgets = children.stream()
                                       .map(child -> child.frozen)
                                       .toList();
            frozen = new Widget(id,
                                kind.map(WidgetKind::typeName).orElse(Widget.UNKNOWN),
                                constructor,
                                kind.map(WidgetKind::category).orElse(WidgetCategory.UNKNOWN),
                                properties,
                                StyleProjection.project(properties),
                                childWidgets,
                                slot,
                                span);
        }
    }
}
