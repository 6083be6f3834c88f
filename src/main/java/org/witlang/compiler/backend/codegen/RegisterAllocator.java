package org.witlang.compiler.backend.codegen;

import org.witlang.compiler.backend.emit.AsmWriter;
import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.isa.Register;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Hands out general purpose registers for temporaries. A register is occupied exactly as long as a
 * live item refers to it. There is no spilling: exhausting the pool is an internal error.
 */
public class RegisterAllocator {

    /** Registers eligible for temporaries, in allocation order. */
    public static final List<Register> POOL = List.of(
            Register.R8, Register.R9, Register.R10, Register.R11,
            Register.RDX, Register.RBX, Register.RCX, Register.RSI, Register.RDI);

    private final AsmWriter out;
    private final Set<Register> occupied = EnumSet.noneOf(Register.class);

    /**
     * @param out The writer receiving save/restore instructions emitted by {@link #reserveFor}.
     */
    public RegisterAllocator(AsmWriter out) {
        this.out = out;
    }

    /**
     * @return The first free pool register, now marked occupied.
     * @throws InternalCompilerError if every pool register is occupied.
     */
    public Register acquire() {
        return acquireExcept();
    }

    /**
     * Like {@link #acquire()}, but never hands out one of the given registers.
     * @param excluded Registers the caller is about to clobber.
     * @return A free pool register, now marked occupied.
     */
    public Register acquireExcept(Register... excluded) {
        List<Register> skip = Arrays.asList(excluded);
        for (Register register : POOL) {
            if (!occupied.contains(register) && !skip.contains(register)) {
                occupied.add(register);
                return register;
            }
        }
        throw new InternalCompilerError("Register pool exhausted; expression too complex (occupied: " + occupied + ")");
    }

    /**
     * Marks a specific register as occupied, e.g. the accumulator holding a multiplication result.
     * @param register The register.
     * @throws InternalCompilerError if the register is already occupied.
     */
    public void claim(Register register) {
        if (!occupied.add(register)) {
            throw new InternalCompilerError("Register " + register + " is already occupied");
        }
    }

    /**
     * Marks registers as free. Releasing a free register has no effect.
     * @param registers The registers to release.
     */
    public void release(Register... registers) {
        for (Register register : registers) {
            occupied.remove(register);
        }
    }

    /**
     * @param register A register.
     * @return {@code true} if a live item refers to it.
     */
    public boolean isOccupied(Register register) {
        return occupied.contains(register);
    }

    /**
     * @return A snapshot of the occupied registers.
     */
    public Set<Register> occupied() {
        return Collections.unmodifiableSet(EnumSet.copyOf(occupied));
    }

    /**
     * Runs {@code body} with a scratch register that is released on every exit path.
     * @param body The code using the register.
     */
    public void withTemporary(Consumer<Register> body) {
        Register register = acquire();
        try {
            body.accept(register);
        } finally {
            release(register);
        }
    }

    /**
     * Lets {@code body} clobber the given registers. Each one currently holding a live value is
     * pushed before the body and popped after it, in reverse order.
     *
     * @param registers Registers the body writes to.
     * @param body The instruction sequence.
     */
    public void reserveFor(List<Register> registers, Runnable body) {
        List<Register> saved = new ArrayList<>();
        for (Register register : registers) {
            if (occupied.contains(register)) {
                out.instruction("push " + register.name(8));
                saved.add(register);
            }
        }
        body.run();
        Collections.reverse(saved);
        for (Register register : saved) {
            out.instruction("pop " + register.name(8));
        }
    }
}
