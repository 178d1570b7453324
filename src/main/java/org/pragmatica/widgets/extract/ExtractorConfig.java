package org.pragmatica.widgets.extract;

import org.pragmatica.widgets.parser.ParserConfig;

import java.util.Objects;

/**
 * Widget extractor configuration options.
 *
 * @param maxWidgetDepth deepest widget nesting extracted; deeper subtrees are dropped with a diagnostic
 * @param catalog        recognized widget and value constructors
 */
public record ExtractorConfig(int maxWidgetDepth, WidgetCatalog catalog) {

    public static final ExtractorConfig DEFAULT = new ExtractorConfig(ParserConfig.DEFAULT_MAX_NESTING_DEPTH,
                                                                      WidgetCatalog.builtIn());

    public ExtractorConfig {
        if (maxWidgetDepth < 1) {
            throw new IllegalArgumentException("maxWidgetDepth must be positive, got " + maxWidgetDepth);
        }
        Objects.requireNonNull(catalog, "catalog");
    }

    public ExtractorConfig withMaxWidgetDepth(int depth) {
        return new ExtractorConfig(depth, catalog);
    }

    public ExtractorConfig withCatalog(WidgetCatalog widgetCatalog) {
        return new ExtractorConfig(maxWidgetDepth, widgetCatalog);
    }
}
