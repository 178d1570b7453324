package org.pragmatica.widgets.error;

import java.util.List;

/**
 * Product of one pipeline stage bundled with the diagnostics the stage recorded.
 *
 * <p>A stage is successful when it recorded no error-severity diagnostic. Warnings (placeholder
 * widgets, opaque references, skipped unsupported syntax) never affect success.
 *
 * @param <T> type of the stage product
 */
public interface StageResult<T> {

    T product();

    List<Diagnostic> diagnostics();

    default List<Diagnostic> errors() {
        return diagnostics().stream()
                            .filter(Diagnostic::isError)
                            .toList();
    }

    /**
     * Non-error diagnostics rendered as user messages, in recording order.
     */
    default List<String> warnings() {
        return diagnostics().stream()
                            .filter(d -> !d.isError())
                            .map(Diagnostic::toUserMessage)
                            .toList();
    }

    default boolean isSuccess() {
        return diagnostics().stream().noneMatch(Diagnostic::isError);
    }

    default boolean hasDiagnostics() {
        return !diagnostics().isEmpty();
    }

    default int errorCount() {
        return (int) diagnostics().stream()
                                  .filter(Diagnostic::isError)
                                  .count();
    }

    default int warningCount() {
        return (int) diagnostics().stream()
                                  .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                                  .count();
    }

    /**
     * Format all diagnostics with source context.
     */
    default String formatDiagnostics(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics()) {
            sb.append(diagnostic.format(source, filename)).append('\n');
        }
        return sb.toString();
    }
}
