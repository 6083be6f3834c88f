package org.witlang.compiler.diagnostics;

import org.witlang.compiler.frontend.lexer.Token;

/**
 * Raised for an error in the program being compiled, after it has been reported to the
 * {@link DiagnosticsEngine}. Unwinds the parse; no recovery is attempted.
 */
public class CompileError extends RuntimeException {

    private final transient Token token;

    /**
     * @param message The diagnostic message.
     * @param token The token at which the error was detected.
     */
    public CompileError(String message, Token token) {
        super(message);
        this.token = token;
    }

    /**
     * @return The token at which the error was detected.
     */
    public Token getToken() {
        return token;
    }
}
