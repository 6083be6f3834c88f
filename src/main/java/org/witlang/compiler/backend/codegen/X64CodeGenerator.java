package org.witlang.compiler.backend.codegen;

import org.witlang.compiler.backend.emit.AsmWriter;
import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.frontend.semantics.BuiltinProcedure;
import org.witlang.compiler.frontend.semantics.Procedure;
import org.witlang.compiler.frontend.semantics.Variable;
import org.witlang.compiler.ir.ConstItem;
import org.witlang.compiler.ir.Item;
import org.witlang.compiler.ir.ItemPair;
import org.witlang.compiler.ir.MemItem;
import org.witlang.compiler.ir.RegItem;
import org.witlang.compiler.ir.StorageLocation;
import org.witlang.compiler.ir.VoidItem;
import org.witlang.compiler.isa.OperandSize;
import org.witlang.compiler.isa.Register;
import org.witlang.compiler.types.ArrayType;
import org.witlang.compiler.types.BinaryOperator;
import org.witlang.compiler.types.BuiltinType;
import org.witlang.compiler.types.DerivedType;
import org.witlang.compiler.types.PointerType;
import org.witlang.compiler.types.Type;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Translates typed operations on {@link Item}s into x86-64 NASM assembly for Linux.
 * <p>
 * Every operation consumes its operand items, releasing the registers they occupy unless the
 * result reuses them, and returns a new item. The generator is driven by the parser in textual
 * order and never revisits emitted code. It is not thread-safe.
 */
public class X64CodeGenerator {

    /** Label of the newline byte written by {@code write_eln}. */
    public static final String NEWLINE_LABEL = "wit$newl";
    /** Prefix of the labels of non-exported globals. */
    public static final String GLOBAL_PREFIX = "wit$global$";
    /** The program entry point. */
    public static final String ENTRY_LABEL = "_start";

    private static final int SYS_WRITE = 1;
    private static final int SYS_EXIT = 60;
    private static final int STDOUT = 1;

    private final AsmWriter out;
    private final RegisterAllocator allocator;
    // Local variable bytes of each active frame.
    private final Deque<Integer> frameTotals = new ArrayDeque<>();

    /**
     * @param out The writer receiving the assembly text.
     */
    public X64CodeGenerator(AsmWriter out) {
        this.out = out;
        this.allocator = new RegisterAllocator(out);
    }

    public RegisterAllocator allocator() {
        return allocator;
    }

    /**
     * @return The number of frames entered and not yet left.
     */
    public int frameDepth() {
        return frameTotals.size();
    }

    // ---------------------------------------------------------------------------------------------
    // Program structure and declarations
    // ---------------------------------------------------------------------------------------------

    public void programProlog() {
        out.directive("global " + ENTRY_LABEL);
        out.blank();
    }

    public void dataSection() {
        out.directive("section .data");
        out.directive(NEWLINE_LABEL + ": db 10");
    }

    public void textSection() {
        out.directive("section .text");
    }

    /**
     * Reserves data-section storage for global variables and records their locations.
     * Exported variables keep their source name as label; all others get a mangled label.
     *
     * @param globals The variables of one declaration block, in declaration order.
     */
    public void emitGlobals(List<Variable> globals) {
        for (Variable variable : globals) {
            if (variable.isExported()) {
                out.directive("global " + variable.name());
            }
        }
        for (Variable variable : globals) {
            String label = variable.isExported() ? variable.name() : GLOBAL_PREFIX + variable.name();
            Type type = variable.type();
            variable.assignStorage(StorageLocation.global(label, type.size()));
            if (type instanceof ArrayType array) {
                OperandSize unit = OperandSize.of(array.innermost().size());
                out.directive(label + ": times " + (type.size() / unit.bytes()) + " " + unit.dataDirective() + " 0");
            } else {
                out.directive(label + ": " + OperandSize.of(type.size()).dataDirective() + " 0");
            }
        }
    }

    /**
     * Enters the frame of the program body and emits the entry label.
     */
    public void enterProgram() {
        frameTotals.push(0);
        out.label(ENTRY_LABEL);
    }

    /**
     * Assigns frame offsets to local variables and reserves the stack space. A frame without
     * locals emits nothing.
     *
     * @param locals The variables of one declaration block, in declaration order.
     */
    public void emitLocals(List<Variable> locals) {
        if (frameTotals.isEmpty()) {
            throw new InternalCompilerError("Locals declared outside of a frame");
        }
        int total = frameTotals.pop();
        int before = total;
        for (Variable variable : locals) {
            int size = variable.type().size();
            total = Math.addExact(total, size);
            variable.assignStorage(StorageLocation.local(total, size));
        }
        frameTotals.push(total);
        if (total == 0) {
            return;
        }
        if (before == 0) {
            out.instruction("push rbp");
            out.instruction("mov rbp, rsp");
        }
        out.instruction("sub rsp, " + (total - before));
    }

    /**
     * Tears down the program frame and exits the process with status 0.
     */
    public void leaveProgram() {
        if (frameTotals.isEmpty()) {
            throw new InternalCompilerError("No active frame to leave");
        }
        if (frameTotals.pop() != 0) {
            out.instruction("mov rsp, rbp");
            out.instruction("pop rbp");
        }
        out.instruction("mov rax, " + SYS_EXIT);
        out.instruction("xor rdi, rdi");
        out.instruction("syscall");
    }

    /**
     * @param variable A variable whose declaration has been emitted.
     * @return A memory item addressing the variable.
     */
    public MemItem variable(Variable variable) {
        StorageLocation storage = variable.storage();
        if (storage.global()) {
            return MemItem.global(storage.label(), variable.type());
        }
        return MemItem.relative(Register.RBP, -storage.offset(), variable.type());
    }

    // ---------------------------------------------------------------------------------------------
    // Operations
    // ---------------------------------------------------------------------------------------------

    /**
     * Loads the address of a memory item.
     *
     * @param item The operand; must be a {@link MemItem}.
     * @return A register item of pointer type.
     */
    public Item address(Item item) {
        if (!(item instanceof MemItem mem)) {
            throw new InternalCompilerError("Invalid item " + describe(item) + " given to address");
        }
        Register register = allocator.acquire();
        out.instruction("lea " + register.name(Type.POINTER_SIZE) + ", " + mem.address());
        releaseExcept(register, item);
        return new RegItem(register, new PointerType(item.type()));
    }

    /**
     * Emits a two's complement negation.
     *
     * @param item The operand.
     * @return A register item of the operand's type.
     */
    public Item negate(Item item) {
        int size = item.type().size();
        if (item instanceof RegItem reg) {
            out.instruction("neg " + reg.register().name(size));
            return reg;
        }
        Register register = allocator.acquire();
        String name = register.name(size);
        out.instruction("mov " + name + ", " + operand(item));
        out.instruction("neg " + name);
        releaseExcept(register, item);
        return new RegItem(register, item.type());
    }

    /**
     * Widens the narrower operand to the type of the wider one. Constants are retyped, anything
     * else is cast.
     *
     * @param lhs The left operand.
     * @param rhs The right operand.
     * @return Both operands, now of equal size.
     */
    public ItemPair equalize(Item lhs, Item rhs) {
        int lhsSize = lhs.type().size();
        int rhsSize = rhs.type().size();
        if (lhsSize > rhsSize) {
            rhs = rhs instanceof ConstItem constant ? constant.retype(lhs.type()) : cast(rhs, lhs.type());
        } else if (lhsSize < rhsSize) {
            lhs = lhs instanceof ConstItem constant ? constant.retype(rhs.type()) : cast(lhs, rhs.type());
        }
        return new ItemPair(lhs, rhs);
    }

    /**
     * Emits a binary arithmetic operation. Both operands must already have equal sizes.
     *
     * @param lhs The left operand.
     * @param rhs The right operand.
     * @param op The operator.
     * @return A register item of the left operand's type.
     */
    public Item binary(Item lhs, Item rhs, BinaryOperator op) {
        int size = lhs.type().size();
        if (size != rhs.type().size()) {
            throw new InternalCompilerError("lhs and rhs sizes differ in binary operation: "
                    + lhs.type().displayName() + " " + op.symbol() + " " + rhs.type().displayName());
        }
        if (rhs instanceof ConstItem constant && (op.isMultiplicative() || !constant.fitsImmediate())) {
            // mul and div have no immediate form
            rhs = load(rhs);
        }
        if (op.isMultiplicative()) {
            return multiplicative(lhs, rhs, op, size);
        }

        Register dst;
        if (lhs instanceof RegItem reg) {
            dst = reg.register();
        } else {
            dst = allocator.acquire();
            out.instruction("mov " + dst.name(size) + ", " + operand(lhs));
        }
        if (op.isShift()) {
            dst = shift(dst, rhs, op, size);
        } else {
            String mnemonic = op == BinaryOperator.ADD ? "add" : "sub";
            out.instruction(mnemonic + " " + dst.name(size) + ", " + operand(rhs));
        }
        releaseExcept(dst, lhs, rhs);
        return new RegItem(dst, lhs.type());
    }

    private Register shift(Register dst, Item rhs, BinaryOperator op, int size) {
        String mnemonic = op == BinaryOperator.SHIFT_LEFT ? "shl" : "shr";
        if (rhs instanceof ConstItem constant) {
            out.instruction(mnemonic + " " + dst.name(size) + ", " + constant.value());
            return dst;
        }
        // A variable shift count must be in cl.
        if (dst == Register.RCX) {
            Register moved = allocator.acquireExcept(Register.RCX);
            out.instruction("mov " + moved.name(8) + ", rcx");
            allocator.release(Register.RCX);
            dst = moved;
        }
        String count = rhs instanceof RegItem reg ? reg.register().name(1) : OperandSize.BYTE.keyword() + " " + ((MemItem) rhs).address();
        String target = dst.name(size);
        allocator.reserveFor(List.of(Register.RCX), () -> {
            if (!"cl".equals(count)) {
                out.instruction("mov cl, " + count);
            }
            out.instruction(mnemonic + " " + target + ", cl");
        });
        return dst;
    }

    private Item multiplicative(Item lhs, Item rhs, BinaryOperator op, int size) {
        // rax and rdx are overwritten before the divisor is read
        if (uses(rhs, Register.RAX) || uses(rhs, Register.RDX)) {
            rhs = load(rhs);
        }
        boolean lhsInAccumulator = lhs instanceof RegItem reg && reg.register() == Register.RAX;
        boolean accumulatorBusy = allocator.isOccupied(Register.RAX) && !lhsInAccumulator;
        Register dst = accumulatorBusy ? allocator.acquireExcept(Register.RDX) : Register.RAX;
        List<Register> clobbered = accumulatorBusy ? List.of(Register.RAX, Register.RDX) : List.of(Register.RDX);

        String accumulator = Register.RAX.name(size);
        String source = operand(rhs);
        String lhsOperand = lhsInAccumulator ? null : operand(lhs);
        allocator.reserveFor(clobbered, () -> {
            if (lhsOperand != null) {
                out.instruction("mov " + accumulator + ", " + lhsOperand);
            }
            if (op == BinaryOperator.MULTIPLY) {
                out.instruction("mul " + source);
            } else {
                if (size == 1) {
                    out.instruction("movzx ax, al");
                } else {
                    out.instruction("xor edx, edx");
                }
                out.instruction("div " + source);
                if (op == BinaryOperator.REMAINDER) {
                    out.instruction(size == 1 ? "mov al, ah" : "mov " + accumulator + ", " + Register.RDX.name(size));
                }
            }
            if (dst != Register.RAX) {
                out.instruction("mov " + dst.name(size) + ", " + accumulator);
            }
        });
        releaseExcept(dst, lhs, rhs);
        if (dst == Register.RAX && !allocator.isOccupied(Register.RAX)) {
            allocator.claim(Register.RAX);
        }
        return new RegItem(dst, lhs.type());
    }

    /**
     * Converts an item to a type of a different size. Same-size casts only retype.
     *
     * @param item The operand; must not be a constant.
     * @param type The destination type.
     * @return The converted item.
     */
    public Item cast(Item item, Type type) {
        int from = item.type().size();
        int to = type.size();
        if (from == to) {
            return item.retype(type);
        }
        if (item instanceof RegItem reg) {
            // Narrowing needs nothing: the narrower sub-register already holds the low bits.
            if (to > from) {
                zeroExtend(reg.register(), from, to);
            }
            return new RegItem(reg.register(), type);
        }
        if (item instanceof MemItem mem) {
            Register register = allocator.acquire();
            if (to > from) {
                out.instruction("xor " + register.name(to) + ", " + register.name(to));
                out.instruction("mov " + register.name(from) + ", " + memory(mem, from));
            } else {
                out.instruction("mov " + register.name(to) + ", " + memory(mem, to));
            }
            releaseExcept(register, item);
            return new RegItem(register, type);
        }
        if (item instanceof ConstItem) {
            throw new InternalCompilerError("ConstItem given to cast; constants must be retyped by the caller");
        }
        throw new InternalCompilerError("Invalid item " + describe(item) + " given to cast");
    }

    private void zeroExtend(Register register, int from, int to) {
        switch (from) {
            case 1 -> out.instruction("and " + register.name(to) + ", 0xFF");
            case 2 -> out.instruction("and " + register.name(to) + ", 0xFFFF");
            // Writing a 32-bit register clears the upper half.
            case 4 -> out.instruction("mov " + register.name(4) + ", " + register.name(4));
            default -> throw new InternalCompilerError("Cannot widen from size " + from);
        }
    }

    /**
     * Emits a call to a procedure. Argument registers are released afterwards in every case.
     *
     * @param procedure The callee; only builtins exist.
     * @param arguments The evaluated arguments, already type-checked.
     * @return The result, or {@link VoidItem} for procedures without one.
     */
    public Item call(Procedure procedure, List<Item> arguments) {
        try {
            if (!(procedure instanceof BuiltinProcedure builtin)) {
                throw new InternalCompilerError("Invalid procedure kind given to call: " + procedure);
            }
            switch (builtin.builtin()) {
                case WRITE_ELN:
                    allocator.reserveFor(List.of(Register.RAX, Register.RCX, Register.RDX, Register.RSI, Register.RDI, Register.R11), () -> {
                        out.instruction("mov rax, " + SYS_WRITE);
                        out.instruction("mov rdi, " + STDOUT);
                        out.instruction("mov rsi, " + NEWLINE_LABEL);
                        out.instruction("mov rdx, 1");
                        out.instruction("syscall");
                    });
                    return VoidItem.INSTANCE;
                case DIGIT_TO_INT: {
                    Register register = allocator.acquire();
                    String name = register.name(1);
                    out.instruction("mov " + name + ", " + operand(arguments.get(0)));
                    out.instruction("sub " + name + ", " + (int) '0');
                    Type result = builtin.returnType()
                            .orElseThrow(() -> new InternalCompilerError("d2i must have a result type"));
                    return new RegItem(register, result);
                }
                default:
                    throw new InternalCompilerError("Invalid builtin " + builtin.builtin() + " given to call");
            }
        } finally {
            for (Item argument : arguments) {
                release(argument);
            }
        }
    }

    /**
     * Addresses an element of an array or of the memory a pointer points to. The byte offset is
     * the index times the element size.
     *
     * @param array A register or memory item of pointer or array type.
     * @param index The index value.
     * @return A memory item addressing the element.
     */
    public MemItem index(Item array, Item index) {
        if (!(array.type() instanceof DerivedType derived)) {
            throw new InternalCompilerError("Non-indexable type " + array.type().displayName() + " given to index");
        }
        Type element = derived.base();
        int elementSize = element.size();

        Register base;
        if (array instanceof RegItem reg) {
            base = reg.register();
        } else if (array instanceof MemItem mem) {
            // An array in memory needs its address in a register; a pointer needs its value.
            base = allocator.acquire();
            String mnemonic = derived instanceof ArrayType ? "lea " : "mov ";
            String source = derived instanceof ArrayType ? mem.address() : memory(mem, Type.POINTER_SIZE);
            out.instruction(mnemonic + base.name(Type.POINTER_SIZE) + ", " + source);
            releaseExcept(base, array);
        } else {
            throw new InternalCompilerError("Item " + describe(array) + " given as array to index");
        }

        if (index instanceof ConstItem constant) {
            return MemItem.relative(base, constant.value() * elementSize, element);
        }
        Register indexRegister = widenIndex(index);
        int scale = elementSize;
        if (scale != 1 && scale != 2 && scale != 4 && scale != 8) {
            out.instruction("imul " + indexRegister.name(8) + ", " + indexRegister.name(8) + ", " + elementSize);
            scale = 1;
        }
        return new MemItem(element, null, base, indexRegister, scale, 0);
    }

    private Register widenIndex(Item index) {
        Item wide = index.type().size() < Type.POINTER_SIZE ? cast(index, BuiltinType.LONG) : index;
        if (wide instanceof MemItem) {
            wide = load(wide);
        }
        if (!(wide instanceof RegItem reg)) {
            throw new InternalCompilerError("Invalid index item " + describe(index));
        }
        return reg.register();
    }

    /**
     * Stores a value into a memory item. Memory sources are staged through a scratch register.
     * The value is released; the target is returned still holding its registers, so the caller
     * releases it once it is no longer used.
     *
     * @param target The destination; must be a {@link MemItem} of the value's type.
     * @param value The value to store.
     * @return The target.
     */
    public Item assign(Item target, Item value) {
        if (!(target instanceof MemItem mem)) {
            throw new InternalCompilerError("Invalid assignment target " + describe(target));
        }
        int size = target.type().size();
        String destination = memory(mem, size);
        if (value instanceof MemItem || (value instanceof ConstItem constant && !constant.fitsImmediate())) {
            // No memory-to-memory moves on x86.
            String source = operand(value);
            allocator.withTemporary(register -> {
                out.instruction("mov " + register.name(size) + ", " + source);
                out.instruction("mov " + destination + ", " + register.name(size));
            });
        } else {
            out.instruction("mov " + destination + ", " + operand(value));
        }
        releaseExcept(null, value);
        return target;
    }

    /**
     * Releases the registers an item refers to.
     * @param items The items that are no longer used.
     */
    public void release(Item... items) {
        releaseExcept(null, items);
    }

    // ---------------------------------------------------------------------------------------------
    // Operand helpers
    // ---------------------------------------------------------------------------------------------

    /**
     * Renders an item as an instruction operand.
     * @param item A constant, register or memory item.
     * @return e.g. {@code 42}, {@code r8d} or {@code dword [wit$global$x]}.
     */
    public String operand(Item item) {
        if (item instanceof ConstItem constant) {
            return Long.toString(constant.value());
        }
        if (item instanceof RegItem reg) {
            return reg.register().name(item.type().size());
        }
        if (item instanceof MemItem mem) {
            return memory(mem, item.type().size());
        }
        throw new InternalCompilerError("Invalid item " + describe(item) + " given to operand");
    }

    private String memory(MemItem mem, int size) {
        return OperandSize.of(size).keyword() + " " + mem.address();
    }

    private RegItem load(Item item) {
        Register register = allocator.acquire();
        out.instruction("mov " + register.name(item.type().size()) + ", " + operand(item));
        releaseExcept(register, item);
        return new RegItem(register, item.type());
    }

    private static boolean uses(Item item, Register register) {
        if (item instanceof RegItem reg) {
            return reg.register() == register;
        }
        if (item instanceof MemItem mem) {
            return mem.registers().contains(register);
        }
        return false;
    }

    private void releaseExcept(Register keep, Item... items) {
        for (Item item : items) {
            if (item instanceof RegItem reg) {
                if (reg.register() != keep) allocator.release(reg.register());
            } else if (item instanceof MemItem mem) {
                for (Register register : mem.registers()) {
                    if (register != keep) allocator.release(register);
                }
            }
        }
    }

    private static String describe(Item item) {
        return item.getClass().getSimpleName();
    }
}
