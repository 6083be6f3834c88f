package org.witlang.compiler.frontend.parser;

import org.witlang.compiler.backend.codegen.X64CodeGenerator;
import org.witlang.compiler.diagnostics.CompileError;
import org.witlang.compiler.diagnostics.DiagnosticsEngine;
import org.witlang.compiler.frontend.lexer.Token;
import org.witlang.compiler.frontend.lexer.TokenType;
import org.witlang.compiler.frontend.semantics.Procedure;
import org.witlang.compiler.frontend.semantics.Symbol;
import org.witlang.compiler.frontend.semantics.SymbolTable;
import org.witlang.compiler.frontend.semantics.TypeSymbol;
import org.witlang.compiler.frontend.semantics.Variable;
import org.witlang.compiler.ir.ConstItem;
import org.witlang.compiler.ir.Item;
import org.witlang.compiler.ir.ItemPair;
import org.witlang.compiler.ir.VoidItem;
import org.witlang.compiler.types.ArrayType;
import org.witlang.compiler.types.BinaryOperator;
import org.witlang.compiler.types.BuiltinType;
import org.witlang.compiler.types.PointerType;
import org.witlang.compiler.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single-pass recursive-descent parser. There is no syntax tree: every construct is type-checked
 * against the {@link SymbolTable} and handed to the {@link X64CodeGenerator} as soon as it is
 * recognized. Binary expressions are parsed by precedence climbing and folded when both operands
 * are constant.
 * <p>
 * The first error is reported to the {@link DiagnosticsEngine} and aborts the parse with a
 * {@link CompileError}.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbols;
    private final X64CodeGenerator generator;
    private int current = 0;

    /**
     * An expression result together with the token it started at, for error positions.
     */
    private record Operand(Token start, Item item) {}

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors.
     * @param symbols The scope stack of this compilation.
     * @param generator The code generator receiving each recognized construct.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, SymbolTable symbols, X64CodeGenerator generator) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.symbols = symbols;
        this.generator = generator;
    }

    /**
     * Parses a whole program: an optional global {@code var} block followed by
     * {@code begin ... end} and the end of input.
     */
    public void parseProgram() {
        generator.programProlog();
        generator.dataSection();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations();
        }
        generator.textSection();
        consume(TokenType.BEGIN, "expected 'begin'");

        symbols.enterScope();
        generator.enterProgram();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations();
        }
        parseBlock();
        consume(TokenType.END, "expected 'end'");
        generator.leaveProgram();
        symbols.leaveScope();

        if (!check(TokenType.END_OF_FILE)) {
            throw error("expected end of input, got '" + peek().text() + "'", peek());
        }
    }

    /**
     * Parses a {@code var} block, defines its variables in the current scope and emits their
     * storage. {@code export} is only legal at global scope.
     */
    void parseVariableDeclarations() {
        Token keyword = consume(TokenType.VAR, "expected 'var'");
        boolean global = symbols.isGlobalScope();
        List<Variable> declared = new ArrayList<>();
        long frameSize = 0;
        do {
            boolean exported = false;
            if (match(TokenType.EXPORT)) {
                if (!global) {
                    throw error("cannot export non-global variable", previous());
                }
                exported = true;
            }
            Token name = consume(TokenType.IDENTIFIER, "expected variable name");
            consume(TokenType.COLON, "expected ':' after variable name");
            Type type = parseDeclaredType();
            Variable variable = new Variable(name, type, exported);
            if (!symbols.define(variable)) {
                throw error("'" + name.text() + "' is already declared in this scope", name);
            }
            declared.add(variable);
            frameSize += type.size();
        } while (match(TokenType.COMMA));

        if (global) {
            generator.emitGlobals(declared);
        } else {
            if (frameSize > Integer.MAX_VALUE) {
                throw error("local variables too large: " + frameSize + " bytes", keyword);
            }
            generator.emitLocals(declared);
        }
    }

    /**
     * Parses a type: a type name followed by any number of {@code [constant]} and {@code *}
     * suffixes, applied left to right.
     * @return The declared type.
     */
    Type parseDeclaredType() {
        Token name = consume(TokenType.IDENTIFIER, "expected type name");
        Type type = lookupType(name);
        while (true) {
            if (match(TokenType.LEFT_BRACKET)) {
                Token open = previous();
                if (check(TokenType.RIGHT_BRACKET)) {
                    throw error("variable-length arrays are not supported", open);
                }
                Item count = parseExpression();
                if (!(count instanceof ConstItem constant)) {
                    throw error("array size must be constant", open);
                }
                if (constant.value() <= 0 || constant.value() > Integer.MAX_VALUE) {
                    throw error("array size must be positive, got " + constant.value(), open);
                }
                if (constant.value() * type.size() > Integer.MAX_VALUE) {
                    throw error("array too large: " + type.displayName() + "[" + constant.value() + "]", open);
                }
                consume(TokenType.RIGHT_BRACKET, "expected ']' after array size");
                type = new ArrayType(type, (int) constant.value());
            } else if (match(TokenType.STAR)) {
                type = new PointerType(type);
            } else {
                return type;
            }
        }
    }

    private void parseBlock() {
        while (!check(TokenType.END)) {
            if (!check(TokenType.IDENTIFIER)) {
                throw error("expected statement", peek());
            }
            generator.release(parseIdentifierLed(false));
        }
    }

    /**
     * Parses an expression.
     * @return The resulting item; constant if the whole expression folded.
     */
    public Item parseExpression() {
        return parseExpression(0);
    }

    private Item parseExpression(int minPrecedence) {
        Operand first = parsePrimary();
        Item result = first.item();
        if (result instanceof VoidItem) {
            throw error("cannot use void value as expression", first.start());
        }

        // Casts bind tighter than any binary operator.
        if (match(TokenType.AS)) {
            result = parseCast(result, previous());
        }

        while (peek().type().isBinaryOperator() && peek().type().binaryOperator().precedence() >= minPrecedence) {
            Token operator = advance();
            BinaryOperator op = operator.type().binaryOperator();
            Item rhs = parseExpression(op.precedence() + 1);
            result = combine(result, rhs, op, operator);
        }
        return result;
    }

    private Item combine(Item lhs, Item rhs, BinaryOperator op, Token operator) {
        if (!lhs.type().supports(op)) {
            throw error("type " + lhs.type().displayName() + " does not support the binary operator " + op.symbol(), operator);
        }
        if (!lhs.type().supportsWith(op, rhs.type())) {
            throw error("incompatible types " + lhs.type().displayName() + " and " + rhs.type().displayName()
                    + " in binary operation", operator);
        }
        if (lhs instanceof ConstItem left && rhs instanceof ConstItem right) {
            Type type = right.type().size() > left.type().size() ? right.type() : left.type();
            return new ConstItem(type, evaluate(left.value(), right.value(), op, operator));
        }
        if (!lhs.type().equals(rhs.type())) {
            ItemPair equalized = generator.equalize(lhs, rhs);
            lhs = equalized.left();
            rhs = equalized.right();
        }
        return generator.binary(lhs, rhs, op);
    }

    private long evaluate(long lhs, long rhs, BinaryOperator op, Token operator) {
        return switch (op) {
            case ADD -> lhs + rhs;
            case SUBTRACT -> lhs - rhs;
            case MULTIPLY -> lhs * rhs;
            case DIVIDE -> {
                if (rhs == 0) throw error("division by zero in constant expression", operator);
                yield lhs / rhs;
            }
            case REMAINDER -> {
                if (rhs == 0) throw error("division by zero in constant expression", operator);
                yield Math.floorMod(lhs, rhs);
            }
            case SHIFT_LEFT -> lhs << rhs;
            case SHIFT_RIGHT -> lhs >> rhs;
        };
    }

    private Item parseCast(Item item, Token as) {
        Type target = parseDeclaredType();
        if (item.type() instanceof ArrayType || target instanceof ArrayType) {
            throw error("cannot cast " + item.type().displayName() + " to " + target.displayName(), as);
        }
        if (item instanceof ConstItem constant) {
            return constant.retype(target);
        }
        return generator.cast(item, target);
    }

    private Operand parsePrimary() {
        Token start = peek();
        switch (start.type()) {
            case INTEGER: {
                advance();
                String text = start.text();
                Type type = text.endsWith("l") || text.endsWith("L") ? BuiltinType.LONG : BuiltinType.INT;
                return new Operand(start, new ConstItem(type, (Long) start.value()));
            }
            case CHARACTER:
                advance();
                return new Operand(start, new ConstItem(BuiltinType.CHAR, (Long) start.value()));
            case IDENTIFIER:
                return new Operand(start, parseIdentifierLed(true));
            case LEFT_PAREN: {
                advance();
                Item inner = parseExpression();
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                return new Operand(start, inner);
            }
            default:
                if (start.type().isUnaryOperator()) {
                    return parseUnary();
                }
                throw error("expected expression", start);
        }
    }

    private Operand parseUnary() {
        Token operator = advance();
        Operand operand = parsePrimary();
        Item item = operand.item();
        if (item instanceof VoidItem) {
            throw error("cannot use void value as expression", operand.start());
        }
        if (operator.type() == TokenType.AMPERSAND) {
            if (!item.isAddressable()) {
                throw error("expression is not addressable", operator);
            }
            return new Operand(operator, generator.address(item));
        }
        if (!item.type().supports(BinaryOperator.SUBTRACT)) {
            throw error("type " + item.type().displayName() + " does not support negation", operator);
        }
        if (item instanceof ConstItem constant) {
            return new Operand(operator, new ConstItem(constant.type(), -constant.value()));
        }
        return new Operand(operator, generator.negate(item));
    }

    /**
     * Parses a construct starting with an identifier: an assignment, a call, an indexed access or
     * a plain variable reference.
     *
     * @param bare {@code true} if a plain reference is acceptable, i.e. in expression position.
     * @return The resulting item.
     */
    private Item parseIdentifierLed(boolean bare) {
        Token name = advance();
        if (check(TokenType.ASSIGN)) {
            Variable variable = lookupVariable(name);
            return parseAssignment(generator.variable(variable), advance());
        }
        if (check(TokenType.LEFT_PAREN)) {
            return parseCall(name, lookupProcedure(name));
        }
        if (check(TokenType.LEFT_BRACKET)) {
            Item element = parseIndex(name);
            if (check(TokenType.ASSIGN)) {
                return parseAssignment(element, advance());
            }
            if (!bare) {
                throw error("expected assignment or call", peek());
            }
            return element;
        }
        Optional<Symbol> symbol = symbols.resolve(name.text());
        if (symbol.isPresent() && symbol.get() instanceof Procedure procedure) {
            return parseCall(name, procedure);
        }
        if (!bare) {
            throw error("expected assignment or call", peek());
        }
        return generator.variable(lookupVariable(name));
    }

    private Item parseAssignment(Item target, Token assign) {
        Operand value = new Operand(peek(), parseExpression());
        if (!target.type().equals(value.item().type())) {
            throw error("incompatible types " + target.type().displayName() + " and "
                    + value.item().type().displayName() + " in assignment", assign);
        }
        if (target.type() instanceof ArrayType) {
            throw error("cannot assign a value of array type " + target.type().displayName(), assign);
        }
        return generator.assign(target, value.item());
    }

    private Item parseCall(Token name, Procedure procedure) {
        List<Item> arguments = new ArrayList<>();
        // Parentheses may be omitted when there are no arguments.
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(parseExpression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "expected ')' after arguments");
        }
        List<Type> parameters = procedure.parameterTypes();
        if (arguments.size() != parameters.size()) {
            throw error("procedure " + name.text() + " expects " + parameters.size() + " arguments, got "
                    + arguments.size(), name);
        }
        for (int i = 0; i < parameters.size(); i++) {
            Type actual = arguments.get(i).type();
            if (!actual.equals(parameters.get(i))) {
                throw error("argument " + (i + 1) + " to procedure " + name.text() + " expected type "
                        + parameters.get(i).displayName() + ", got " + actual.displayName(), name);
            }
        }
        return generator.call(procedure, arguments);
    }

    private Item parseIndex(Token name) {
        Item current = generator.variable(lookupVariable(name));
        while (match(TokenType.LEFT_BRACKET)) {
            Token open = previous();
            if (!current.type().indexes()) {
                throw error(current.type().displayName() + " does not support indexing", open);
            }
            Item index = parseExpression();
            if (!current.type().indexesWith(index.type())) {
                throw error(current.type().displayName() + " cannot be indexed with " + index.type().displayName(), open);
            }
            consume(TokenType.RIGHT_BRACKET, "expected ']' after index");
            current = generator.index(current, index);
        }
        return current;
    }

    // ---------------------------------------------------------------------------------------------
    // Symbol lookups
    // ---------------------------------------------------------------------------------------------

    private Variable lookupVariable(Token name) {
        Symbol symbol = symbols.resolve(name.text())
                .orElseThrow(() -> error("undeclared identifier " + name.text(), name));
        if (!(symbol instanceof Variable variable)) {
            throw error(name.text() + " is not a variable", name);
        }
        if (!variable.hasStorage()) {
            throw error("variable " + name.text() + " cannot be used within its own declaration block", name);
        }
        return variable;
    }

    private Type lookupType(Token name) {
        Symbol symbol = symbols.resolve(name.text())
                .orElseThrow(() -> error("undeclared type " + name.text(), name));
        if (!(symbol instanceof TypeSymbol type)) {
            throw error(name.text() + " is not a type", name);
        }
        return type.type();
    }

    private Procedure lookupProcedure(Token name) {
        Symbol symbol = symbols.resolve(name.text())
                .orElseThrow(() -> error("undeclared procedure " + name.text(), name));
        if (!(symbol instanceof Procedure procedure)) {
            throw error(name.text() + " is not a procedure", name);
        }
        return procedure;
    }

    // ---------------------------------------------------------------------------------------------
    // Token stream
    // ---------------------------------------------------------------------------------------------

    private CompileError error(String message, Token at) {
        diagnostics.reportError(message, at.fileName(), at.line(), at.column());
        return new CompileError(message, at);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        Token unexpected = peek();
        String got = unexpected.type() == TokenType.END_OF_FILE ? "end of input" : "'" + unexpected.text() + "'";
        throw error(errorMessage + ", got " + got, unexpected);
    }
}
