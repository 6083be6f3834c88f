package org.witlang.compiler.isa;

import org.witlang.compiler.diagnostics.InternalCompilerError;

/**
 * The x86-64 general purpose registers used by the code generator.
 */
public enum Register {
    RAX("al", "ax", "eax", "rax"),
    RBX("bl", "bx", "ebx", "rbx"),
    RCX("cl", "cx", "ecx", "rcx"),
    RDX("dl", "dx", "edx", "rdx"),
    RSI("sil", "si", "esi", "rsi"),
    RDI("dil", "di", "edi", "rdi"),
    RSP("spl", "sp", "esp", "rsp"),
    RBP("bpl", "bp", "ebp", "rbp"),
    R8("r8b", "r8w", "r8d", "r8"),
    R9("r9b", "r9w", "r9d", "r9"),
    R10("r10b", "r10w", "r10d", "r10"),
    R11("r11b", "r11w", "r11d", "r11");

    private final String byteName;
    private final String wordName;
    private final String dwordName;
    private final String qwordName;

    Register(String byteName, String wordName, String dwordName, String qwordName) {
        this.byteName = byteName;
        this.wordName = wordName;
        this.dwordName = dwordName;
        this.qwordName = qwordName;
    }

    /**
     * Returns the name of the sub-register covering the given number of low bytes.
     *
     * @param size The operand size in bytes (1, 2, 4 or 8).
     * @return The NASM register name, e.g. {@code r8d} for {@code R8} and size 4.
     */
    public String name(int size) {
        return switch (size) {
            case 1 -> byteName;
            case 2 -> wordName;
            case 4 -> dwordName;
            case 8 -> qwordName;
            default -> throw new InternalCompilerError("Invalid register size " + size + " for " + this);
        };
    }
}
