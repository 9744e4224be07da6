package org.javai.symcalc.symbolic;

import java.util.List;

/**
 * Rebuilds a symbolic tree node by node.
 */
final class SymbolicCopier implements SymbolicVisitor<SymbolicExpression> {

	static final SymbolicCopier INSTANCE = new SymbolicCopier();

	private SymbolicCopier() {
	}

	@Override
	public SymbolicExpression visitNumber(SymbolicExpression.NumberExpr expr) {
		return new SymbolicExpression.NumberExpr(expr.value());
	}

	@Override
	public SymbolicExpression visitVariable(SymbolicExpression.VariableExpr expr) {
		return new SymbolicExpression.VariableExpr(expr.name());
	}

	@Override
	public SymbolicExpression visitBinary(SymbolicExpression.BinaryExpr expr) {
		return new SymbolicExpression.BinaryExpr(expr.op(), expr.left().accept(this), expr.right().accept(this));
	}

	@Override
	public SymbolicExpression visitUnary(SymbolicExpression.UnaryExpr expr) {
		return new SymbolicExpression.UnaryExpr(expr.op(), expr.operand().accept(this));
	}

	@Override
	public SymbolicExpression visitFunction(SymbolicExpression.FunctionExpr expr) {
		List<SymbolicExpression> arguments = expr.arguments().stream()
				.map(argument -> argument.accept(this))
				.toList();
		return new SymbolicExpression.FunctionExpr(expr.name(), arguments);
	}
}
