package org.witlang.compiler.backend.emit;

import org.witlang.compiler.diagnostics.CompilerLogger;

import java.io.PrintWriter;
import java.io.Writer;

/**
 * Writes NASM assembly text line by line. Instructions are indented by two spaces;
 * labels and directives are not.
 */
public class AsmWriter {

    private static final String INDENT = "  ";

    private final PrintWriter out;
    private int instructionCount = 0;

    /**
     * @param sink The destination of the assembly text.
     */
    public AsmWriter(Writer sink) {
        this.out = new PrintWriter(sink);
    }

    /**
     * Writes an unindented line, e.g. a section or global directive.
     * @param text The line content.
     */
    public void directive(String text) {
        line(text);
    }

    /**
     * Writes a label definition.
     * @param name The label name.
     */
    public void label(String name) {
        line(name + ":");
    }

    /**
     * Writes an empty line.
     */
    public void blank() {
        line("");
    }

    /**
     * Writes an indented instruction.
     * @param text The instruction, e.g. {@code mov rax, 60}.
     */
    public void instruction(String text) {
        instructionCount++;
        CompilerLogger.trace("emit: " + text);
        line(INDENT + text);
    }

    /**
     * @return The number of instructions written so far.
     */
    public int instructionCount() {
        return instructionCount;
    }

    /**
     * Flushes buffered text to the sink.
     */
    public void flush() {
        out.flush();
    }

    // NASM output uses '\n' regardless of the platform separator.
    private void line(String text) {
        out.print(text);
        out.print('\n');
    }
}
