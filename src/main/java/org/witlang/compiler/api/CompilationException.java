package org.witlang.compiler.api;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message, usually the diagnostics summary.
     */
    public CompilationException(String message) {
        super(message);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The internal error that aborted the compilation.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
