package org.pragmatica.widgets.analysis;

import java.util.List;
import java.util.Optional;

/**
 * Reusable component candidates found in a set of widget trees.
 *
 * @param patterns      components in order of their first instance
 * @param totalWidgets  widgets examined, all trees and nesting levels included
 */
public record ComponentDetection(List<ComponentPattern> patterns, int totalWidgets) {

    public ComponentDetection {
        patterns = List.copyOf(patterns);
    }

    /**
     * Widgets that are an instance of some component.
     */
    public int totalInstances() {
        return patterns.stream()
                       .mapToInt(ComponentPattern::usageCount)
                       .sum();
    }

    public int uniquePatterns() {
        return patterns.size();
    }

    /**
     * Percentage of examined widgets that are component instances, 0 when nothing was examined.
     */
    public double componentCoverage() {
        return totalWidgets == 0 ? 0 : totalInstances() * 100.0 / totalWidgets;
    }

    public Optional<ComponentPattern> pattern(String name) {
        return patterns.stream()
                       .filter(pattern -> pattern.name().equals(name))
                       .findFirst();
    }
}
