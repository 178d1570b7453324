package org.pragmatica.widgets.lexer;

import org.pragmatica.widgets.error.Diagnostic;
import org.pragmatica.widgets.error.StageResult;

import java.util.List;

/**
 * Token stream of one source text together with lexical diagnostics.
 * The token list always ends with a single {@link Token.Eof}.
 */
public record LexResult(List<Token> tokens, List<Diagnostic> diagnostics, String source)
    implements StageResult<List<Token>> {

    public LexResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }

    @Override
    public List<Token> product() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public boolean hasErrorTokens() {
        return tokens.stream().anyMatch(Token.Error.class::isInstance);
    }
}
