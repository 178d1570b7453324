package org.pragmatica.widgets.extract;

import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.StageResult;

import java.util.List;
import java.util.Optional;

/**
 * Widget trees extracted from a program, one per top-level widget expression, with the
 * diagnostics recorded while extracting them.
 */
public record ExtractionResult(List<Widget> roots, List<Diagnostic> diagnostics) implements StageResult<List<Widget>> {

    public ExtractionResult {
        roots = List.copyOf(roots);
        diagnostics = List.copyOf(diagnostics);
    }

    @Override
    public List<Widget> product() {
        return roots;
    }

    /**
     * The first root; sources usually hold a single widget expression.
     */
    public Optional<Widget> tree() {
        return roots.isEmpty() ? Optional.empty() : Optional.of(roots.get(0));
    }

    public boolean isUsable() {
        return !roots.isEmpty();
    }

    /**
     * Number of widgets across all roots.
     */
    public int widgetCount() {
        return roots.stream()
                    .mapToInt(Widget::size)
                    .sum();
    }
}
