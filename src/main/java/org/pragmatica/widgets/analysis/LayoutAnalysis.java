package org.pragmatica.widgets.analysis;

import org.pragmatica.widgets.extract.Widget;

import java.util.List;
import java.util.Optional;

/**
 * Layout facts about one widget, in the terms a frame-based design tool uses.
 *
 * @param widget              analyzed widget
 * @param type                how children are arranged
 * @param direction           main axis direction for linear, flex, wrap and scroll layouts
 * @param mainAxis            main axis alignment when given
 * @param crossAxis           cross axis alignment when given
 * @param spacing             gap between children when given
 * @param padding             resolved {@code padding} property
 * @param width               fixed width when given as a number
 * @param height              fixed height when given as a number
 * @param flexChildren        {@code Expanded}/{@code Flexible} children of a flex layout
 * @param positionedChildren  {@code Positioned} children of a stack
 * @param autoLayoutCandidate whether the layout maps onto auto layout frames
 */
public record LayoutAnalysis(
    Widget widget,
    LayoutType type,
    Optional<Direction> direction,
    Optional<MainAxisAlignment> mainAxis,
    Optional<CrossAxisAlignment> crossAxis,
    Optional<Double> spacing,
    Optional<EdgeInsets> padding,
    Optional<Double> width,
    Optional<Double> height,
    List<FlexChild> flexChildren,
    List<PositionedChild> positionedChildren,
    boolean autoLayoutCandidate
) {
    public LayoutAnalysis {
        flexChildren = List.copyOf(flexChildren);
        positionedChildren = List.copyOf(positionedChildren);
    }

    public enum Direction {
        HORIZONTAL,
        VERTICAL
    }

    public enum MainAxisAlignment {
        START("start"),
        CENTER("center"),
        END("end"),
        SPACE_BETWEEN("spaceBetween"),
        SPACE_AROUND("spaceAround"),
        SPACE_EVENLY("spaceEvenly");

        private final String member;

        MainAxisAlignment(String member) {
            this.member = member;
        }

        public static Optional<MainAxisAlignment> fromMember(String member) {
            for (var value : values()) {
                if (value.member.equals(member)) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        }
    }

    public enum CrossAxisAlignment {
        START("start"),
        CENTER("center"),
        END("end"),
        STRETCH("stretch"),
        BASELINE("baseline");

        private final String member;

        CrossAxisAlignment(String member) {
            this.member = member;
        }

        public static Optional<CrossAxisAlignment> fromMember(String member) {
            for (var value : values()) {
                if (value.member.equals(member)) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        }
    }

    public enum FlexFit {
        TIGHT,
        LOOSE
    }

    public record FlexChild(Widget widget, int flex, FlexFit fit) {}

    /**
     * Offsets of a {@code Positioned} child; absent edges are unconstrained.
     */
    public record PositionedChild(
        Widget widget,
        Optional<Double> top,
        Optional<Double> right,
        Optional<Double> bottom,
        Optional<Double> left,
        Optional<Double> width,
        Optional<Double> height
    ) {}

    public int totalFlex() {
        return flexChildren.stream()
                           .mapToInt(FlexChild::flex)
                           .sum();
    }

    /**
     * Layouts that need manual frames: stacks, grids, positioned children, or flex children
     * mixed with fixed-size ones.
     */
    public boolean isComplex() {
        boolean mixedFlex = !flexChildren.isEmpty() && flexChildren.size() < widget.children().size();
        return type == LayoutType.STACK
               || type == LayoutType.GRID
               || !positionedChildren.isEmpty()
               || mixedFlex;
    }
}
