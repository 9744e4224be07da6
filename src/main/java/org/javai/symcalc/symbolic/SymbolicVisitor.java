package org.javai.symcalc.symbolic;

/**
 * Visitor over {@link SymbolicExpression} trees. Every transformation of the symbolic
 * engine is a visitor, so each must handle every node kind.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SymbolicVisitor<R> {

	R visitNumber(SymbolicExpression.NumberExpr expr);

	R visitVariable(SymbolicExpression.VariableExpr expr);

	R visitBinary(SymbolicExpression.BinaryExpr expr);

	R visitUnary(SymbolicExpression.UnaryExpr expr);

	R visitFunction(SymbolicExpression.FunctionExpr expr);
}
