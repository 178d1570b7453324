package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.analysis.LayoutAnalysis.CrossAxisAlignment;
import org.pragmatica.widgets.analysis.LayoutAnalysis.Direction;
import org.pragmatica.widgets.analysis.LayoutAnalysis.FlexChild;
import org.pragmatica.widgets.analysis.LayoutAnalysis.FlexFit;
import org.pragmatica.widgets.analysis.LayoutAnalysis.MainAxisAlignment;
import org.pragmatica.widgets.analysis.LayoutAnalysis.PositionedChild;
import org.pragmatica.widgets.extract.PropertyValue;
import org.pragmatica.widgets.extract.Widget;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detects layout patterns in extracted widget trees: linear and flex layouts, stacks with
 * positioned children, wraps, grids and scroll views, and which of them map onto auto layout.
 */
public final class LayoutAnalyzer {

    private static final Set<String> LINEAR_TYPES = Set.of("Row", "Column", "Flex");
    private static final Set<String> FLEX_CHILD_TYPES = Set.of("Expanded", "Flexible");
    private static final Set<String> POSITION_KEYS = Set.of("top", "right", "bottom", "left");

    private LayoutAnalyzer() {
    }

    /**
     * Analyze every widget of the given trees, in pre-order.
     */
    public static LayoutSummary analyzeAll(List<Widget> roots) {
        var analyses = new ArrayList<LayoutAnalysis>();
        for (var root : roots) {
            for (var widget : root.preOrder()) {
                analyses.add(analyze(widget));
            }
        }
        return new LayoutSummary(analyses);
    }

    public static LayoutAnalysis analyze(Widget widget) {
        var flexChildren = LINEAR_TYPES.contains(widget.type()) ? flexChildren(widget) : List.<FlexChild>of();
        var type = layoutType(widget, !flexChildren.isEmpty());
        var positioned = type == LayoutType.STACK ? positionedChildren(widget) : List.<PositionedChild>of();

        return new LayoutAnalysis(widget,
                                  type,
                                  direction(widget, type),
                                  member(widget, "mainAxisAlignment").flatMap(MainAxisAlignment::fromMember),
                                  member(widget, "crossAxisAlignment").flatMap(CrossAxisAlignment::fromMember),
                                  number(widget, "spacing"),
                                  widget.property("padding").flatMap(EdgeInsets::from),
                                  number(widget, "width"),
                                  number(widget, "height"),
                                  flexChildren,
                                  positioned,
                                  isAutoLayoutCandidate(widget, type));
    }

    private static LayoutType layoutType(Widget widget, boolean hasFlexChildren) {
        return switch (widget.type()) {
            case "Row" -> hasFlexChildren ? LayoutType.FLEX : LayoutType.ROW;
            case "Column" -> hasFlexChildren ? LayoutType.FLEX : LayoutType.COLUMN;
            case "Flex" -> LayoutType.FLEX;
            case "Stack", "IndexedStack" -> LayoutType.STACK;
            case "Wrap" -> LayoutType.WRAP;
            case "GridView" -> LayoutType.GRID;
            case "ListView", "SingleChildScrollView", "CustomScrollView", "PageView" -> LayoutType.SCROLL;
            default -> byChildCount(widget);
        };
    }

    // Unclassified widgets with several children (Scaffold: app bar over body) read top to bottom
    private static LayoutType byChildCount(Widget widget) {
        return switch (widget.children().size()) {
            case 0 -> LayoutType.NONE;
            case 1 -> LayoutType.SINGLE_CHILD;
            default -> LayoutType.COLUMN;
        };
    }

    private static Optional<Direction> direction(Widget widget, LayoutType type) {
        return switch (type) {
            case ROW -> Optional.of(Direction.HORIZONTAL);
            case COLUMN -> Optional.of(Direction.VERTICAL);
            case FLEX -> switch (widget.type()) {
                case "Row" -> Optional.of(Direction.HORIZONTAL);
                case "Column" -> Optional.of(Direction.VERTICAL);
                default -> axis(widget, "direction");
            };
            case WRAP -> axis(widget, "direction").or(() -> Optional.of(Direction.HORIZONTAL));
            case SCROLL -> axis(widget, "scrollDirection").or(() -> Optional.of(Direction.VERTICAL));
            default -> Optional.empty();
        };
    }

    private static Optional<Direction> axis(Widget widget, String property) {
        return member(widget, property).flatMap(member -> switch (member) {
            case "horizontal" -> Optional.of(Direction.HORIZONTAL);
            case "vertical" -> Optional.of(Direction.VERTICAL);
            default -> Optional.empty();
        });
    }

    private static List<FlexChild> flexChildren(Widget widget) {
        var result = new ArrayList<FlexChild>();
        for (var child : widget.children()) {
            if (!FLEX_CHILD_TYPES.contains(child.type()) && child.property("flex").isEmpty()) {
                continue;
            }
            int flex = number(child, "flex").map(Double::intValue).orElse(1);
            var fit = member(child, "fit").map(member -> "tight".equals(member) ? FlexFit.TIGHT : FlexFit.LOOSE)
                                          .orElse("Expanded".equals(child.type()) ? FlexFit.TIGHT : FlexFit.LOOSE);
            result.add(new FlexChild(child, flex, fit));
        }
        return result;
    }

    private static List<PositionedChild> positionedChildren(Widget widget) {
        var result = new ArrayList<PositionedChild>();
        for (var child : widget.children()) {
            boolean hasOffsets = POSITION_KEYS.stream().anyMatch(key -> number(child, key).isPresent());
            if (!hasOffsets) {
                continue;
            }
            result.add(new PositionedChild(child,
                                           number(child, "top"),
                                           number(child, "right"),
                                           number(child, "bottom"),
                                           number(child, "left"),
                                           number(child, "width"),
                                           number(child, "height")));
        }
        return result;
    }

    private static boolean isAutoLayoutCandidate(Widget widget, LayoutType type) {
        return switch (type) {
            case ROW, COLUMN, FLEX -> !widget.children().isEmpty();
            case SINGLE_CHILD, WRAP -> true;
            default -> false;
        };
    }

    private static Optional<Double> number(Widget widget, String property) {
        return widget.property(property)
                     .filter(PropertyValue.Literal.class::isInstance)
                     .flatMap(value -> ((PropertyValue.Literal) value).asNumber());
    }

    /**
     * Member name of an enum-like reference: {@code center} for {@code MainAxisAlignment.center}.
     */
    private static Optional<String> member(Widget widget, String property) {
        return widget.property(property)
                     .filter(PropertyValue.Reference.class::isInstance)
                     .map(value -> ((PropertyValue.Reference) value).expression())
                     .map(expression -> expression.substring(expression.lastIndexOf('.') + 1));
    }
}
