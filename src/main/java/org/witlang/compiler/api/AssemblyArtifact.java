package org.witlang.compiler.api;

/**
 * The immutable result of a successful compilation.
 *
 * @param programName The name the program was compiled under.
 * @param assembly The complete NASM source text, ready for {@code nasm -f elf64}.
 * @param instructionCount The number of instructions in the text section.
 */
public record AssemblyArtifact(String programName, String assembly, int instructionCount) {}
