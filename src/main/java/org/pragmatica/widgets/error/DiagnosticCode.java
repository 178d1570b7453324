package org.pragmatica.widgets.error;

import org.pragmatica.widgets.error.Diagnostic.Severity;

/**
 * Every diagnostic the core can produce, with its stable code, category, default severity and
 * message template. Message text is always produced by {@link #render(Object...)}.
 */
public enum DiagnosticCode {
    // Lexical
    UNEXPECTED_CHARACTER("E0001", DiagnosticCategory.SYNTAX, Severity.ERROR, "unexpected character '%s'"),
    UNTERMINATED_STRING("E0002", DiagnosticCategory.SYNTAX, Severity.ERROR, "unterminated string literal"),
    UNTERMINATED_COMMENT("E0003", DiagnosticCategory.SYNTAX, Severity.ERROR, "unterminated block comment"),
    MALFORMED_NUMBER("E0004", DiagnosticCategory.SYNTAX, Severity.ERROR, "malformed number literal '%s'"),
    INVALID_ESCAPE("W0005", DiagnosticCategory.SYNTAX, Severity.WARNING, "unknown escape sequence '\\%s'"),

    // Syntax
    UNEXPECTED_TOKEN("E0101", DiagnosticCategory.SYNTAX, Severity.ERROR, "unexpected %s, expected %s"),
    EXPECTED_TOKEN("E0102", DiagnosticCategory.SYNTAX, Severity.ERROR, "expected %s but found %s"),
    UNCLOSED_DELIMITER("E0103", DiagnosticCategory.SYNTAX, Severity.ERROR, "unclosed '%s'"),
    MISMATCHED_DELIMITER("E0104", DiagnosticCategory.SYNTAX, Severity.ERROR, "mismatched closing delimiter: found '%s', expected '%s'"),
    UNSUPPORTED_SYNTAX("W0105", DiagnosticCategory.SYNTAX, Severity.WARNING, "unsupported syntax skipped: %s"),

    // Widget
    UNKNOWN_WIDGET("W0201", DiagnosticCategory.WIDGET, Severity.WARNING, "unknown widget type '%s', using placeholder"),
    NOT_A_WIDGET("W0202", DiagnosticCategory.WIDGET, Severity.WARNING, "top-level expression is not a widget constructor: %s"),

    // Validation
    UNMAPPED_POSITIONAL("W0301", DiagnosticCategory.VALIDATION, Severity.WARNING, "positional argument %d of '%s' has no property mapping, kept as '%s'"),
    DUPLICATE_ARGUMENT("W0302", DiagnosticCategory.VALIDATION, Severity.WARNING, "duplicate argument '%s' in '%s', first value kept"),
    NESTING_TOO_DEEP("E0303", DiagnosticCategory.VALIDATION, Severity.ERROR, "nesting depth exceeds limit of %d"),
    VALUE_OUT_OF_RANGE("W0304", DiagnosticCategory.VALIDATION, Severity.WARNING, "value %s of '%s' is outside %s");

    private final String code;
    private final DiagnosticCategory category;
    private final Severity severity;
    private final String template;

    DiagnosticCode(String code, DiagnosticCategory category, Severity severity, String template) {
        this.code = code;
        this.category = category;
        this.severity = severity;
        this.template = template;
    }

    public String code() {
        return code;
    }

    public DiagnosticCategory category() {
        return category;
    }

    public Severity severity() {
        return severity;
    }

    public String template() {
        return template;
    }

    public String render(Object... args) {
        return String.format(template, args);
    }
}
