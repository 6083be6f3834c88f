package org.witlang.cli.commands;

import com.typesafe.config.Config;
import org.witlang.cli.CommandLineInterface;
import org.witlang.compiler.Compiler;
import org.witlang.compiler.api.AssemblyArtifact;
import org.witlang.compiler.api.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a Wit source file to NASM assembly.")
public class CompileCommand implements Callable<Integer> {

    /** Exit code for programs rejected by the compiler. */
    public static final int EXIT_COMPILE_ERROR = 1;
    /** Exit code for unreadable sources or unwritable outputs. */
    public static final int EXIT_IO_ERROR = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the Wit source file.")
    private File file;

    @Option(names = {"-o", "--output"}, description = "The output file; '-' or absent writes to stdout.")
    private String output;

    @Option(names = "--derive-output", description = "Write <source-stem><extension> next to the source file.")
    private boolean deriveOutput;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter err = spec.commandLine().getErr();

        List<String> sourceLines;
        try {
            sourceLines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + file + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        Compiler compiler = new Compiler();
        compiler.setVerbosity(config.getInt("witc.compiler.verbosity"));
        AssemblyArtifact artifact;
        try {
            artifact = compiler.compile(sourceLines, file.getName());
        } catch (CompilationException e) {
            err.println(e.getMessage());
            return EXIT_COMPILE_ERROR;
        }

        Path target = resolveOutput(config.getString("witc.output.extension"));
        if (target == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(artifact.assembly());
            out.flush();
            return 0;
        }
        try {
            Files.writeString(target, artifact.assembly(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot write " + target + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        LOGGER.info("Wrote {} instructions to {}", artifact.instructionCount(), target);
        return 0;
    }

    private Path resolveOutput(String extension) {
        if (output != null && !"-".equals(output)) {
            return Path.of(output);
        }
        if (deriveOutput) {
            String name = file.getName();
            int dot = name.lastIndexOf('.');
            String stem = dot > 0 ? name.substring(0, dot) : name;
            Path source = file.toPath().toAbsolutePath();
            return source.resolveSibling(stem + extension);
        }
        return null;
    }
}
