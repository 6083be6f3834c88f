package org.witlang.compiler;

import org.witlang.compiler.api.AssemblyArtifact;
import org.witlang.compiler.api.CompilationException;
import org.witlang.compiler.api.ICompiler;
import org.witlang.compiler.backend.codegen.X64CodeGenerator;
import org.witlang.compiler.backend.emit.AsmWriter;
import org.witlang.compiler.diagnostics.CompileError;
import org.witlang.compiler.diagnostics.CompilerLogger;
import org.witlang.compiler.diagnostics.DiagnosticsEngine;
import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.frontend.lexer.Lexer;
import org.witlang.compiler.frontend.lexer.Token;
import org.witlang.compiler.frontend.parser.Parser;
import org.witlang.compiler.frontend.semantics.SymbolTable;

import java.io.StringWriter;
import java.util.List;

/**
 * The main compiler implementation. Lexes the whole source, then runs the single-pass
 * parser which emits assembly as it goes. It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private int verbosity = -1;

    @Override
    public AssemblyArtifact compile(List<String> sourceLines, String programName) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        CompilerLogger.info("Compiler: " + programName);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        String fullSource = String.join("\n", sourceLines) + "\n";
        List<Token> tokens = new Lexer(fullSource, diagnostics, programName).scanTokens();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }
        CompilerLogger.debug("Lexer produced " + tokens.size() + " tokens");

        // Phase 2: Parsing, checking and emission in one pass
        StringWriter text = new StringWriter();
        AsmWriter out = new AsmWriter(text);
        X64CodeGenerator generator = new X64CodeGenerator(out);
        Parser parser = new Parser(tokens, diagnostics, new SymbolTable(), generator);
        try {
            parser.parseProgram();
        } catch (CompileError e) {
            throw new CompilationException(diagnostics.summary(), e);
        }
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary());
        }

        if (!generator.allocator().occupied().isEmpty()) {
            throw new InternalCompilerError("Registers still occupied after compilation: " + generator.allocator().occupied());
        }
        out.flush();
        CompilerLogger.info("Compiler: emitted " + out.instructionCount() + " instructions for " + programName);
        return new AssemblyArtifact(programName, text.toString(), out.instructionCount());
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
