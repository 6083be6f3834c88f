package org.witlang.compiler.isa;

import org.witlang.compiler.diagnostics.InternalCompilerError;

/**
 * Operand sizes encodable in an instruction or a data definition.
 */
public enum OperandSize {
    BYTE(1, "byte", "db"),
    WORD(2, "word", "dw"),
    DWORD(4, "dword", "dd"),
    QWORD(8, "qword", "dq");

    private final int bytes;
    private final String keyword;
    private final String dataDirective;

    OperandSize(int bytes, String keyword, String dataDirective) {
        this.bytes = bytes;
        this.keyword = keyword;
        this.dataDirective = dataDirective;
    }

    /**
     * @param bytes A size in bytes.
     * @return The matching operand size.
     * @throws InternalCompilerError if the size is not 1, 2, 4 or 8.
     */
    public static OperandSize of(int bytes) {
        for (OperandSize size : values()) {
            if (size.bytes == bytes) {
                return size;
            }
        }
        throw new InternalCompilerError("Invalid operand size " + bytes);
    }

    public int bytes() {
        return bytes;
    }

    /**
     * @return The NASM size keyword used on memory operands, e.g. {@code dword}.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return The NASM data definition directive, e.g. {@code dd}.
     */
    public String dataDirective() {
        return dataDirective;
    }
}
