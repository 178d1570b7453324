package org.pragmatica.widgets.analysis;

import java.util.Objects;
import java.util.Set;

/**
 * Component detection options.
 *
 * @param minInstances          fewest structurally identical widgets that make a component
 * @param minConfidence         lowest confidence score, between 0 and 1, a component is reported with
 * @param maxVariants           most variants kept per component; the least used are dropped first
 * @param ignoreProperties      property names not compared when telling variants apart
 * @param includeUnknownWidgets whether placeholders for unrecognized constructors take part
 */
public record ComponentDetectorConfig(int minInstances,
                                      double minConfidence,
                                      int maxVariants,
                                      Set<String> ignoreProperties,
                                      boolean includeUnknownWidgets) {

    public static final ComponentDetectorConfig DEFAULT = new ComponentDetectorConfig(2, 0.7, 10,
                                                                                      Set.of("key", "id"), true);

    public ComponentDetectorConfig {
        if (minInstances < 2) {
            throw new IllegalArgumentException("minInstances must be at least 2, got " + minInstances);
        }
        if (minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1], got " + minConfidence);
        }
        if (maxVariants < 1) {
            throw new IllegalArgumentException("maxVariants must be positive, got " + maxVariants);
        }
        ignoreProperties = Set.copyOf(Objects.requireNonNull(ignoreProperties, "ignoreProperties"));
    }

    public ComponentDetectorConfig withMinInstances(int instances) {
        return new ComponentDetectorConfig(instances, minConfidence, maxVariants, ignoreProperties,
                                           includeUnknownWidgets);
    }

    public ComponentDetectorConfig withMinConfidence(double confidence) {
        return new ComponentDetectorConfig(minInstances, confidence, maxVariants, ignoreProperties,
                                           includeUnknownWidgets);
    }

    public ComponentDetectorConfig withMaxVariants(int variants) {
        return new ComponentDetectorConfig(minInstances, minConfidence, variants, ignoreProperties,
                                           includeUnknownWidgets);
    }

    public ComponentDetectorConfig withIgnoreProperties(Set<String> properties) {
        return new ComponentDetectorConfig(minInstances, minConfidence, maxVariants, properties,
                                           includeUnknownWidgets);
    }

    public ComponentDetectorConfig withIncludeUnknownWidgets(boolean include) {
        return new ComponentDetectorConfig(minInstances, minConfidence, maxVariants, ignoreProperties, include);
    }
}
