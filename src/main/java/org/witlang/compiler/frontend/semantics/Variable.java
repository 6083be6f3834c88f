package org.witlang.compiler.frontend.semantics;

import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.frontend.lexer.Token;
import org.witlang.compiler.ir.StorageLocation;
import org.witlang.compiler.types.Type;

import java.util.Objects;

/**
 * A declared variable. Its storage location is assigned exactly once, when the code generator
 * emits the declaration.
 */
public final class Variable implements Symbol {

    private final Token declaration;
    private final Type type;
    private final boolean exported;
    private StorageLocation storage;

    /**
     * @param declaration The identifier token of the declaration.
     * @param type The declared type.
     * @param exported Whether the variable is visible to the linker under its source name.
     */
    public Variable(Token declaration, Type type, boolean exported) {
        this.declaration = Objects.requireNonNull(declaration);
        this.type = Objects.requireNonNull(type);
        this.exported = exported;
    }

    @Override
    public String name() {
        return declaration.text();
    }

    public Token declaration() {
        return declaration;
    }

    public Type type() {
        return type;
    }

    public boolean isExported() {
        return exported;
    }

    /**
     * @return {@code true} once the declaration has been emitted.
     */
    public boolean hasStorage() {
        return storage != null;
    }

    /**
     * @return The storage location.
     * @throws InternalCompilerError if the declaration has not been emitted yet.
     */
    public StorageLocation storage() {
        if (storage == null) {
            throw new InternalCompilerError("Variable '" + name() + "' has no storage assigned");
        }
        return storage;
    }

    /**
     * @param storage The storage location chosen by the code generator.
     * @throws InternalCompilerError if a location was already assigned.
     */
    public void assignStorage(StorageLocation storage) {
        if (this.storage != null) {
            throw new InternalCompilerError("Variable '" + name() + "' already has storage assigned");
        }
        this.storage = Objects.requireNonNull(storage);
    }

    @Override
    public String toString() {
        return "Variable{" + name() + ": " + type.displayName() + (exported ? ", exported" : "") + '}';
    }
}
