package org.witlang.compiler.backend.codegen;

import org.witlang.compiler.backend.emit.AsmWriter;
import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.isa.Register;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the {@link RegisterAllocator}.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class RegisterAllocatorTest {

    @Mock
    private AsmWriter out;

    private RegisterAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new RegisterAllocator(out);
    }

    /**
     * Verifies that registers are handed out in the fixed pool order.
     */
    @Test
    void acquiresInPoolOrder() {
        assertThat(allocator.acquire()).isEqualTo(Register.R8);
        assertThat(allocator.acquire()).isEqualTo(Register.R9);
        allocator.release(Register.R8);
        assertThat(allocator.acquire()).isEqualTo(Register.R8);
        assertThat(allocator.occupied()).containsExactlyInAnyOrder(Register.R8, Register.R9);
    }

    /**
     * Acquire except skips excluded registers.
     */
    @Test
    void acquireExceptSkipsExcludedRegisters() {
        for (int i = 0; i < 4; i++) {
            allocator.acquire();
        }
        assertThat(allocator.acquireExcept(Register.RDX)).isEqualTo(Register.RBX);
    }

    /**
     * Running out of registers is an internal error, since there is no spilling.
     */
    @Test
    void exhaustionIsAnInternalError() {
        for (int i = 0; i < RegisterAllocator.POOL.size(); i++) {
            allocator.acquire();
        }
        assertThatThrownBy(allocator::acquire)
                .isInstanceOf(InternalCompilerError.class)
                .hasMessageContaining("Register pool exhausted");
    }

    /**
     * Claim rejects occupied registers.
     */
    @Test
    void claimRejectsOccupiedRegisters() {
        allocator.claim(Register.RAX);
        assertThat(allocator.isOccupied(Register.RAX)).isTrue();
        assertThatThrownBy(() -> allocator.claim(Register.RAX)).isInstanceOf(InternalCompilerError.class);
    }

    /**
     * Releasing a free register is allowed and has no effect.
     */
    @Test
    void releaseIsIdempotent() {
        Register register = allocator.acquire();
        allocator.release(register);
        allocator.release(register);
        assertThat(allocator.occupied()).isEmpty();
    }

    /**
     * Verifies that a scoped temporary is returned to the pool even if the body throws.
     */
    @Test
    @SuppressWarnings("unchecked")
    void temporaryIsReleasedWhenTheBodyThrows() {
        Consumer<Register> body = mock(Consumer.class);
        doThrow(new IllegalStateException("boom")).when(body).accept(any());

        assertThatThrownBy(() -> allocator.withTemporary(body)).isInstanceOf(IllegalStateException.class);
        verify(body).accept(Register.R8);
        assertThat(allocator.occupied()).isEmpty();
    }

    /**
     * Verifies that only occupied registers are pushed around a clobbering sequence, and that they
     * are popped in reverse order.
     */
    @Test
    void reserveForSavesOnlyOccupiedRegistersAndRestoresInReverse() {
        allocator.acquire(); // r8
        allocator.acquire(); // r9
        allocator.acquire(); // r10
        allocator.acquire(); // r11
        allocator.acquire(); // rdx
        allocator.claim(Register.RAX);

        allocator.reserveFor(List.of(Register.RAX, Register.RCX, Register.RDX), () -> out.instruction("syscall"));

        InOrder order = inOrder(out);
        order.verify(out).instruction("push rax");
        order.verify(out).instruction("push rdx");
        order.verify(out).instruction("syscall");
        order.verify(out).instruction("pop rdx");
        order.verify(out).instruction("pop rax");
        verify(out, never()).instruction("push rcx");
    }
}
