package org.javai.symcalc.symbolic;

import java.util.List;
import org.javai.symcalc.ast.AstNode;
import org.javai.symcalc.ast.AstNodeVisitor;

/**
 * Maps an AST onto the equivalent symbolic expression, node kind for node kind.
 */
public final class AstToSymbolicConverter implements AstNodeVisitor<SymbolicExpression> {

	private static final AstToSymbolicConverter INSTANCE = new AstToSymbolicConverter();

	private AstToSymbolicConverter() {
	}

	/**
	 * @throws TransformException if {@code ast} is null
	 */
	public static SymbolicExpression convert(AstNode ast) {
		if (ast == null) {
			throw new TransformException("Cannot convert a null AST node");
		}
		return ast.accept(INSTANCE);
	}

	@Override
	public SymbolicExpression visitNumber(AstNode.NumberNode node) {
		return SymbolicExpression.number(node.value());
	}

	@Override
	public SymbolicExpression visitVariable(AstNode.VariableNode node) {
		return SymbolicExpression.variable(node.name());
	}

	@Override
	public SymbolicExpression visitBinary(AstNode.BinaryOpNode node) {
		SymbolicExpression.BinaryOperator op = switch (node.op()) {
			case ADD -> SymbolicExpression.BinaryOperator.ADD;
			case SUBTRACT -> SymbolicExpression.BinaryOperator.SUBTRACT;
			case MULTIPLY -> SymbolicExpression.BinaryOperator.MULTIPLY;
			case DIVIDE -> SymbolicExpression.BinaryOperator.DIVIDE;
			case POWER -> SymbolicExpression.BinaryOperator.POWER;
		};
		return new SymbolicExpression.BinaryExpr(op, node.left().accept(this), node.right().accept(this));
	}

	@Override
	public SymbolicExpression visitUnary(AstNode.UnaryOpNode node) {
		SymbolicExpression.UnaryOperator op = switch (node.op()) {
			case PLUS -> SymbolicExpression.UnaryOperator.POS;
			case MINUS -> SymbolicExpression.UnaryOperator.NEG;
			case SIN -> SymbolicExpression.UnaryOperator.SIN;
			case COS -> SymbolicExpression.UnaryOperator.COS;
			case TAN -> SymbolicExpression.UnaryOperator.TAN;
			case LOG10 -> SymbolicExpression.UnaryOperator.LOG;
			case LN -> SymbolicExpression.UnaryOperator.LN;
			case SQRT -> SymbolicExpression.UnaryOperator.SQRT;
			case ABS -> SymbolicExpression.UnaryOperator.ABS;
		};
		return new SymbolicExpression.UnaryExpr(op, node.operand().accept(this));
	}

	@Override
	public SymbolicExpression visitFunction(AstNode.FunctionNode node) {
		List<SymbolicExpression> arguments = node.arguments().stream()
				.map(argument -> argument.accept(this))
				.toList();
		return new SymbolicExpression.FunctionExpr(node.name(), arguments);
	}
}
