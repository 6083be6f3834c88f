package org.witlang.compiler.ir;

/**
 * The two operands of a binary operation after type equalization.
 */
public record ItemPair(Item left, Item right) {}
