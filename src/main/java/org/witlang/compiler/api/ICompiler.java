package org.witlang.compiler.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the Wit compiler.
 */
public interface ICompiler {

    /**
     * Compiles the given source code to NASM assembly.
     *
     * @param sourceLines A list of strings representing the lines of the source program.
     * @param programName A name for the program, used in diagnostics.
     * @return An {@link AssemblyArtifact} holding the generated assembly text.
     * @throws CompilationException if errors occur during the compilation process.
     */
    AssemblyArtifact compile(List<String> sourceLines, String programName) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=error, 1=warn, 2=info, 3=debug, 4=trace).
     */
    void setVerbosity(int level);

    /**
     * Compiles the source code from a file.
     * @param programPath The path to the source file.
     * @return An {@link AssemblyArtifact} holding the generated assembly text.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the file cannot be read.
     */
    default AssemblyArtifact compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readAllLines(programPath), programPath.getFileName().toString());
    }
}
