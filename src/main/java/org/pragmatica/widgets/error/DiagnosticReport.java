package org.pragmatica.widgets.error;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics of a whole run, folded from the results of the individual stages.
 *
 * <p>Folding is explicit: the caller hands over the stage results it wants reported, in order.
 * The report is immutable and can be handed to whichever component presents it to the user.
 */
public record DiagnosticReport(List<Diagnostic> diagnostics) {

    public static final DiagnosticReport EMPTY = new DiagnosticReport(List.of());

    public DiagnosticReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public static DiagnosticReport fold(StageResult<?>... results) {
        return fold(List.of(results));
    }

    public static DiagnosticReport fold(List<? extends StageResult<?>> results) {
        var all = new ArrayList<Diagnostic>();
        for (var result : results) {
            all.addAll(result.diagnostics());
        }
        return new DiagnosticReport(all);
    }

    /**
     * Append diagnostics produced outside the core, e.g. by a node-creation collaborator.
     */
    public DiagnosticReport plus(List<Diagnostic> more) {
        var all = new ArrayList<>(diagnostics);
        all.addAll(more);
        return new DiagnosticReport(all);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream()
                          .filter(Diagnostic::isError)
                          .toList();
    }

    public List<String> warnings() {
        return diagnostics.stream()
                          .filter(d -> !d.isError())
                          .map(Diagnostic::toUserMessage)
                          .toList();
    }

    public List<Diagnostic> byCategory(DiagnosticCategory category) {
        return diagnostics.stream()
                          .filter(d -> d.category() == category)
                          .toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }

    /**
     * Short human readable tally, e.g. {@code "2 errors, 1 warning"}.
     */
    public String summary() {
        int errors = errors().size();
        int warnings = diagnostics.size() - errors;
        return plural(errors, "error") + ", " + plural(warnings, "warning");
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }

    public String format(String source, String filename) {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic.format(source, filename)).append('\n');
        }
        return sb.toString();
    }
}
