package org.witlang.compiler.frontend;

import org.witlang.compiler.backend.codegen.X64CodeGenerator;
import org.witlang.compiler.backend.emit.AsmWriter;
import org.witlang.compiler.diagnostics.CompileError;
import org.witlang.compiler.diagnostics.Diagnostic;
import org.witlang.compiler.diagnostics.DiagnosticsEngine;
import org.witlang.compiler.frontend.lexer.Lexer;
import org.witlang.compiler.frontend.parser.Parser;
import org.witlang.compiler.frontend.semantics.SymbolTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}: constant folding, precedence and the diagnostics
 * reported for ill-formed or ill-typed programs.
 */
@Tag("unit")
public class ParserTest {

    private DiagnosticsEngine diagnostics;
    private X64CodeGenerator generator;
    private StringWriter text;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        text = new StringWriter();
        generator = new X64CodeGenerator(new AsmWriter(text));
    }

    private String parse(String source) {
        Parser parser = new Parser(new Lexer(source, diagnostics, "test.wit").scanTokens(),
                diagnostics, new SymbolTable(), generator);
        parser.parseProgram();
        return text.toString();
    }

    private void assertRejected(String source, String message) {
        assertThatThrownBy(() -> parse(source))
                .isInstanceOf(CompileError.class)
                .hasMessageContaining(message);
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains(message);
    }

    /**
     * Verifies that constant expressions are folded at compile time with the expected precedence,
     * associativity and division semantics, so that no arithmetic instruction is emitted.
     */
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "1 + 2 * 3    | 7",
            "(1 + 2) * 3  | 9",
            "1 << 3       | 8",
            "1 << 1 + 1   | 4",
            "2 - 1 - 1    | 0",
            "16 / 4 / 2   | 2",
            "-7 / 2       | -3",
            "7 % -3       | -2",
            "0x10 - 0b11  | 13",
            "-(2 * 3)     | -6"
    })
    void foldsConstantExpressions(String expression, long expected) {
        String asm = parse("var x: Int begin x := " + expression + " end");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(asm).contains("  mov dword [wit$global$x], " + expected + "\n");
        assertThat(asm).doesNotContain("add ", "imul", "mul ", "shl");
    }

    /**
     * Folded constant takes the wider type.
     */
    @Test
    void foldedConstantTakesTheWiderType() {
        String asm = parse("var x: Long begin x := 1 + 2l end");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(asm).contains("mov qword [wit$global$x], 3");
    }

    /**
     * Casting a constant changes its type without emitting code.
     */
    @Test
    void castConstantIsRetyped() {
        String asm = parse("var c: Byte begin c := 65 as Byte end");

        assertThat(asm).contains("mov byte [wit$global$c], 65");
    }

    /**
     * Verifies that casting a constant to a narrower type truncates its value the way a runtime cast
     * would.
     */
    @Test
    void narrowingConstantCastTruncates() {
        String asm = parse("var b: Byte, i: Int begin b := 300 as Byte i := (256 as Byte) as Int end");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(asm).contains("mov byte [wit$global$b], 44\n", "mov dword [wit$global$i], 0\n");
    }

    /**
     * Procedures without arguments can be called with or without parentheses.
     */
    @Test
    void pascalStyleCallWithoutParentheses() {
        String asm = parse("begin write_eln write_eln() end");

        assertThat(asm.split("syscall", -1)).hasSize(4);
    }

    /**
     * Verifies that a local declared in the body shadows a global of the same name.
     */
    @Test
    void localsAreScopedToTheBody() {
        String asm = parse("var x: Int begin var x: Long x := 5l end");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(asm).contains("mov qword [rbp-8], 5");
    }

    /**
     * Assignment requires exactly matching types.
     */
    @Test
    void rejectsAssignmentOfDifferentTypes() {
        assertRejected("var x: Byte begin x := 1 end", "incompatible types Byte and Int in assignment");
    }

    /**
     * Rejects undeclared identifiers.
     */
    @Test
    void rejectsUndeclaredIdentifiers() {
        assertRejected("begin y := 1 end", "undeclared identifier y");
    }

    /**
     * Rejects redeclaration.
     */
    @Test
    void rejectsRedeclaration() {
        assertRejected("var x: Int, x: Long begin end", "'x' is already declared in this scope");
    }

    /**
     * Only global variables can be exported.
     */
    @Test
    void rejectsExportOfLocals() {
        assertRejected("begin var export x: Int end", "cannot export non-global variable");
    }

    /**
     * Rejects constant division by zero.
     */
    @Test
    void rejectsConstantDivisionByZero() {
        assertRejected("var x: Int begin x := 1 / (2 - 2) end", "division by zero");
    }

    /**
     * Rejects non constant array sizes.
     */
    @Test
    void rejectsNonConstantArraySizes() {
        assertRejected("var n: Int begin var a: Int[n] end", "array size must be constant");
    }

    /**
     * A variable has no storage until its declaration block is complete, so it cannot be used
     * inside that block.
     */
    @Test
    void rejectsUseWithinTheSameDeclarationBlock() {
        assertRejected("var n: Int, a: Int[n] begin end", "cannot be used within its own declaration block");
    }

    /**
     * Rejects variable length arrays.
     */
    @Test
    void rejectsVariableLengthArrays() {
        assertRejected("var a: Int[] begin end", "variable-length arrays are not supported");
    }

    /**
     * Rejects non positive array sizes.
     */
    @Test
    void rejectsNonPositiveArraySizes() {
        assertRejected("var a: Int[0] begin end", "array size must be positive");
    }

    /**
     * Rejects binary operators on arrays.
     */
    @Test
    void rejectsBinaryOperatorsOnArrays() {
        assertRejected("var a: Int[2], x: Int begin x := a + 1 end", "does not support the binary operator +");
    }

    /**
     * Verifies that pointers accept multiplicative and shift operators against integers, with the
     * operation carried out at pointer width.
     */
    @Test
    void multipliesAndShiftsPointers() {
        String asm = parse("var p: Int* begin p := p * 2 p := p << 1 end");

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(asm).contains("  mov rax, qword [wit$global$p]\n", "  mul r8\n", "  shl r8, 1\n");
    }

    /**
     * Rejects arithmetic between pointers to different types.
     */
    @Test
    void rejectsArithmeticBetweenPointersToDifferentTypes() {
        assertRejected("var p: Int*, q: Long* begin p := p - q end", "incompatible types Int* and Long* in binary operation");
    }

    /**
     * An array whose byte size overflows an {@code int} is reported instead of wrapping to a negative
     * frame adjustment.
     */
    @Test
    void rejectsArraysLargerThanTheAddressableSize() {
        assertRejected("begin var a: Long[300000000] end", "array too large");
    }

    /**
     * The size check also applies to the total size of nested arrays.
     */
    @Test
    void rejectsNestedArraysLargerThanTheAddressableSize() {
        assertRejected("var a: Long[65536][65536] begin end", "array too large: Long[65536][65536]");
    }

    /**
     * Verifies that locals which fit individually but together overflow the frame are reported.
     */
    @Test
    void rejectsLocalFramesLargerThanTheAddressableSize() {
        assertRejected("begin var a: Int[300000000], b: Int[300000000] end", "local variables too large");
    }

    /**
     * Rejects indexing scalars.
     */
    @Test
    void rejectsIndexingScalars() {
        assertRejected("var x: Int begin x[0] := 1 end", "Int does not support indexing");
    }

    /**
     * Verifies that builtin procedure arguments are checked against the declared parameter types.
     */
    @Test
    void rejectsWrongArgumentTypes() {
        assertRejected("var b: Byte begin b := d2i(1) end", "argument 1 to procedure d2i expected type Char, got Int");
    }

    /**
     * Rejects wrong argument counts.
     */
    @Test
    void rejectsWrongArgumentCounts() {
        assertRejected("begin write_eln(1) end", "procedure write_eln expects 0 arguments, got 1");
    }

    /**
     * The result of a procedure without return value cannot be used as an operand.
     */
    @Test
    void rejectsVoidValuesInExpressions() {
        assertRejected("var x: Int begin x := write_eln end", "cannot use void value as expression");
    }

    /**
     * Rejects casts of arrays.
     */
    @Test
    void rejectsCastsOfArrays() {
        assertRejected("var a: Int[2], p: Int* begin p := a as Int* end", "cannot cast Int[2] to Int*");
    }

    /**
     * A statement must be an assignment or a call.
     */
    @Test
    void rejectsBareExpressionStatements() {
        assertRejected("var x: Int begin x end", "expected assignment or call");
    }

    /**
     * Rejects trailing input.
     */
    @Test
    void rejectsTrailingInput() {
        assertRejected("begin end end", "expected end of input");
    }

    /**
     * Rejects missing begin.
     */
    @Test
    void rejectsMissingBegin() {
        assertRejected("var x: Int x := 1 end", "expected 'begin'");
    }

    /**
     * Verifies that the diagnostic points at the line and column of the token that caused it.
     */
    @Test
    void reportsPositionOfTheOffendingToken() {
        assertThatThrownBy(() -> parse("var x: Byte\nbegin\n  x := 1\nend"))
                .isInstanceOfSatisfying(CompileError.class, e -> {
                    assertThat(e.getToken().line()).isEqualTo(3);
                    assertThat(e.getToken().text()).isEqualTo(":=");
                });
        assertThat(diagnostics.getDiagnostics().get(0))
                .extracting(Diagnostic::fileName, Diagnostic::lineNumber, Diagnostic::columnNumber)
                .containsExactly("test.wit", 3, 5);
    }
}
