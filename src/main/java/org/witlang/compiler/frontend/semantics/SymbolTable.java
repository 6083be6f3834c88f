package org.witlang.compiler.frontend.semantics;

import org.witlang.compiler.diagnostics.InternalCompilerError;
import org.witlang.compiler.types.BuiltinType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A stack of lexical scopes. The global scope sits at index 0, is pre-populated with the builtin
 * types and procedures and is never removed. Lookups walk from the innermost scope outwards.
 * <p>
 * One instance belongs to one compilation.
 */
public class SymbolTable {

    private final List<Map<String, Symbol>> scopes = new ArrayList<>();

    /**
     * Constructs a symbol table holding only the global scope.
     */
    public SymbolTable() {
        Map<String, Symbol> global = new HashMap<>();
        for (BuiltinType.Kind kind : BuiltinType.Kind.values()) {
            global.put(kind.sourceName(), new TypeSymbol(kind.sourceName(), new BuiltinType(kind)));
        }
        global.put(BuiltinProcedure.WRITE_ELN.name(), BuiltinProcedure.WRITE_ELN);
        global.put(BuiltinProcedure.DIGIT_TO_INT.name(), BuiltinProcedure.DIGIT_TO_INT);
        scopes.add(global);
    }

    /**
     * Enters a new innermost scope.
     */
    public void enterScope() {
        scopes.add(new HashMap<>());
    }

    /**
     * Leaves the innermost scope.
     * @throws InternalCompilerError when called on the global scope.
     */
    public void leaveScope() {
        if (scopes.size() == 1) {
            throw new InternalCompilerError("Cannot leave the global scope");
        }
        scopes.remove(scopes.size() - 1);
    }

    /**
     * @return {@code true} if the innermost scope is the global scope.
     */
    public boolean isGlobalScope() {
        return scopes.size() == 1;
    }

    /**
     * @return The number of scopes, including the global scope.
     */
    public int depth() {
        return scopes.size();
    }

    /**
     * Defines a symbol in the innermost scope.
     *
     * @param symbol The symbol to define.
     * @return {@code false} if the name is already defined in the innermost scope; the table is then unchanged.
     */
    public boolean define(Symbol symbol) {
        return scopes.get(scopes.size() - 1).putIfAbsent(symbol.name(), symbol) == null;
    }

    /**
     * Resolves a name, searching from the innermost scope outwards.
     * @param name The name to resolve.
     * @return The first matching symbol, or empty if the name is not declared.
     */
    public Optional<Symbol> resolve(String name) {
        for (int i = scopes.size() - 1; i >= 0; i--) {
            Symbol symbol = scopes.get(i).get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }
}
