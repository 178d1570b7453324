package org.pragmatica.widgets.analysis;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layout analyses of every widget in a set of trees, in pre-order.
 */
public record LayoutSummary(List<LayoutAnalysis> analyses) {

    public LayoutSummary {
        analyses = List.copyOf(analyses);
    }

    public List<LayoutAnalysis> autoLayoutCandidates() {
        return analyses.stream()
                       .filter(LayoutAnalysis::autoLayoutCandidate)
                       .toList();
    }

    public List<LayoutAnalysis> complexLayouts() {
        return analyses.stream()
                       .filter(LayoutAnalysis::isComplex)
                       .toList();
    }

    public List<LayoutAnalysis> ofType(LayoutType type) {
        return analyses.stream()
                       .filter(analysis -> analysis.type() == type)
                       .toList();
    }

    public Map<LayoutType, Integer> countsByType() {
        var counts = new EnumMap<LayoutType, Integer>(LayoutType.class);
        for (var analysis : analyses) {
            counts.merge(analysis.type(), 1, Integer::sum);
        }
        return counts;
    }

    public int size() {
        return analyses.size();
    }
}
