package org.javai.symcalc.ast;

import java.util.List;

/**
 * Rebuilds a tree node by node, yielding a copy that shares nothing with the original.
 */
final class AstCopier implements AstNodeVisitor<AstNode> {

	static final AstCopier INSTANCE = new AstCopier();

	private AstCopier() {
	}

	@Override
	public AstNode visitNumber(AstNode.NumberNode node) {
		return new AstNode.NumberNode(node.value());
	}

	@Override
	public AstNode visitVariable(AstNode.VariableNode node) {
		return new AstNode.VariableNode(node.name());
	}

	@Override
	public AstNode visitBinary(AstNode.BinaryOpNode node) {
		return new AstNode.BinaryOpNode(node.op(), node.left().accept(this), node.right().accept(this));
	}

	@Override
	public AstNode visitUnary(AstNode.UnaryOpNode node) {
		return new AstNode.UnaryOpNode(node.op(), node.operand().accept(this));
	}

	@Override
	public AstNode visitFunction(AstNode.FunctionNode node) {
		List<AstNode> arguments = node.arguments().stream()
				.map(argument -> argument.accept(this))
				.toList();
		return new AstNode.FunctionNode(node.name(), arguments);
	}
}
