package org.pragmatica.widgets.error;

/**
 * Diagnostic taxonomy shared by the parsing core and the collaborators that consume widget trees.
 *
 * <p>The core itself reports SYNTAX, WIDGET and VALIDATION diagnostics. THEME, CONVERSION, VARIABLE
 * and API are reserved for the downstream node-creation layer so that one report can carry both.
 */
public enum DiagnosticCategory {
    SYNTAX("Syntax error"),
    WIDGET("Widget error"),
    THEME("Theme error"),
    CONVERSION("Conversion error"),
    VARIABLE("Variable error"),
    API("Design API error"),
    VALIDATION("Validation error");

    private final String title;

    DiagnosticCategory(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
