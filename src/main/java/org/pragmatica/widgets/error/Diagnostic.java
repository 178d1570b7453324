package org.pragmatica.widgets.error;

import org.pragmatica.widgets.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recoverable issue found while lexing, parsing or extracting widgets.
 *
 * <p>Diagnostics are plain data: stages collect them and return them with their product, they are
 * never thrown. Category specific details (offending lexeme, widget name, field, value) live in
 * the {@code context} map under the keys declared on this type.
 *
 * <p>Example of {@link #format(String, String)} output:
 * <pre>
 * error[E0101]: unexpected ')', expected expression
 *   --> main.dart:1:18
 *   |
 * 1 | Container(color: )
 *   |                  ^ found ')'
 *   |
 *   = help: a named argument needs a value after ':'
 * </pre>
 *
 * @param severity Error severity level
 * @param code     Diagnostic code, also determines the category
 * @param message  Rendered message
 * @param span     Source span the diagnostic refers to
 * @param context  Extra facts about the offending construct
 * @param labels   Additional labeled spans
 * @param notes    Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    DiagnosticCode code,
    String message,
    SourceSpan span,
    Map<String, String> context,
    List<Label> labels,
    List<String> notes
) {
    public static final String LEXEME = "lexeme";
    public static final String WIDGET = "widget";
    public static final String FIELD = "field";
    public static final String VALUE = "value";
    public static final String THEME_PATH = "themePath";
    public static final String NODE_TYPE = "nodeType";
    public static final String VARIABLE = "variable";

    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    /**
     * Create a diagnostic with the default severity of {@code code} and a message rendered from its template.
     */
    public static Diagnostic of(DiagnosticCode code, SourceSpan span, Object... args) {
        return new Diagnostic(code.severity(), code, code.render(args), span, Map.of(), List.of(), List.of());
    }

    public DiagnosticCategory category() {
        return code.category();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public int line() {
        return span.start().line();
    }

    public int column() {
        return span.start().column();
    }

    public Diagnostic withContext(String key, Object value) {
        var newContext = new LinkedHashMap<>(context);
        newContext.put(key, String.valueOf(value));
        return new Diagnostic(severity, code, message, span, Collections.unmodifiableMap(newContext), labels, notes);
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.primary(span, labelMessage));
        return new Diagnostic(severity, code, message, span, context, List.copyOf(newLabels), notes);
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(Label.secondary(labelSpan, labelMessage));
        return new Diagnostic(severity, code, message, span, context, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, code, message, span, context, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * One-line message for end users, phrased per category.
     */
    public String toUserMessage() {
        var title = category().title();
        return switch (category()) {
            case SYNTAX -> title + " at line " + line() + ": " + message;
            case WIDGET -> title + suffix(" in ", WIDGET, "") + ": " + message;
            case THEME -> title + suffix(" (", THEME_PATH, ")") + ": " + message;
            case CONVERSION -> title + suffix(" for ", NODE_TYPE, "") + ": " + message;
            case VARIABLE -> title + suffix(" '", VARIABLE, "'") + ": " + message;
            case VALIDATION -> title + suffix(" in ", FIELD, "") + ": " + message;
            case API -> title + ": " + message;
        };
    }

    private String suffix(String prefix, String key, String postfix) {
        var value = context.get(key);
        return value == null ? "" : prefix + value + postfix;
    }

    /**
     * Compact single-line form: {@code file:line:column: severity[code]: message}.
     */
    public String formatSimple(String filename) {
        return String.format("%s:%d:%d: %s[%s]: %s",
                             filename, line(), column(), severity.display(), code.code(), message);
    }

    /**
     * Render the diagnostic with the offending source lines and underlines.
     *
     * @param source   The source text the span refers to
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append(severity.display())
          .append('[').append(code.code()).append(']')
          .append(": ").append(message).append('\n');

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(line()).append(':').append(column()).append('\n');

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }
        int gutterWidth = String.valueOf(maxLine).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) {
                continue;
            }
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(lineContent).append('\n');

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ")
                  .append(underlines(lineNum, lineContent, lineLabels))
                  .append('\n');
            }
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append('\n');
        }
        return sb.toString();
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();
        if (labels.isEmpty() && span.start().line() <= lineNum && span.end().line() >= lineNum) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }
        result.sort(Comparator.comparingInt(label -> label.span().start().column()));
        return result;
    }

    private static String underlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        for (var label : lineLabels) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                         ? label.span().end().column()
                         : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            int width = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            currentCol += width;

            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }
}
