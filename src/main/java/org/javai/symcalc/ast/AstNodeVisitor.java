package org.javai.symcalc.ast;

/**
 * Visitor over {@link AstNode} trees, one method per node kind.
 *
 * @param <R> the return type of the visitor operations
 */
public interface AstNodeVisitor<R> {

	R visitNumber(AstNode.NumberNode node);

	R visitVariable(AstNode.VariableNode node);

	R visitBinary(AstNode.BinaryOpNode node);

	R visitUnary(AstNode.UnaryOpNode node);

	R visitFunction(AstNode.FunctionNode node);
}
