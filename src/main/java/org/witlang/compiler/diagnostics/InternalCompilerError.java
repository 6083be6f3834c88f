package org.witlang.compiler.diagnostics;

/**
 * A broken invariant inside the compiler itself, e.g. operands of different sizes reaching
 * the binary-operation emitter. Never caused by the input program alone and never reported
 * as a diagnostic.
 */
public class InternalCompilerError extends RuntimeException {

    /**
     * @param message A description of the violated invariant.
     */
    public InternalCompilerError(String message) {
        super(message);
    }
}
