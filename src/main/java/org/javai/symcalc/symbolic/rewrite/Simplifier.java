package org.javai.symcalc.symbolic.rewrite;

import static org.javai.symcalc.symbolic.SymbolicExpression.number;

import java.util.List;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicExpression.BinaryOperator;
import org.javai.symcalc.symbolic.SymbolicExpression.NumberExpr;
import org.javai.symcalc.symbolic.SymbolicExpression.UnaryOperator;
import org.javai.symcalc.symbolic.SymbolicVisitor;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Bottom-up algebraic simplification.
 * <p>
 * Children are simplified first, then the node itself is rewritten using the identity and
 * annihilator rules for its operator, folding any operation whose operands are all numbers.
 * Every rewrite produces a node to which no rule applies again, so simplifying a simplified
 * tree returns an equal tree.
 * <table>
 * <caption>Rewrites by operator</caption>
 * <tr><td>+</td><td>0 + x → x, x + 0 → x</td></tr>
 * <tr><td>-</td><td>x - 0 → x, 0 - x → -x</td></tr>
 * <tr><td>*</td><td>0 * x, x * 0 → 0; 1 * x, x * 1 → x</td></tr>
 * <tr><td>/</td><td>x / 0 fails; 0 / x → 0; x / 1 → x</td></tr>
 * <tr><td>^</td><td>x ^ 0 → 1; x ^ 1 → x; 0 ^ x → 0; 1 ^ x → 1</td></tr>
 * <tr><td>+x</td><td>x</td></tr>
 * <tr><td>-x</td><td>-0 → 0; -(-x) → x</td></tr>
 * </table>
 */
public final class Simplifier implements SymbolicVisitor<SymbolicExpression> {

	private static final Simplifier INSTANCE = new Simplifier();

	private Simplifier() {
	}

	public static SymbolicExpression simplify(SymbolicExpression expr) {
		return expr.accept(INSTANCE);
	}

	@Override
	public SymbolicExpression visitNumber(SymbolicExpression.NumberExpr expr) {
		return expr;
	}

	@Override
	public SymbolicExpression visitVariable(SymbolicExpression.VariableExpr expr) {
		return expr;
	}

	@Override
	public SymbolicExpression visitBinary(SymbolicExpression.BinaryExpr expr) {
		return rewriteBinary(expr.op(), expr.left().accept(this), expr.right().accept(this));
	}

	@Override
	public SymbolicExpression visitUnary(SymbolicExpression.UnaryExpr expr) {
		return rewriteUnary(expr.op(), expr.operand().accept(this));
	}

	@Override
	public SymbolicExpression visitFunction(SymbolicExpression.FunctionExpr expr) {
		List<SymbolicExpression> arguments = expr.arguments().stream()
				.map(argument -> argument.accept(this))
				.toList();
		SymbolicExpression.FunctionExpr rebuilt = new SymbolicExpression.FunctionExpr(expr.name(), arguments);

		if (arguments.stream().allMatch(argument -> argument instanceof NumberExpr)) {
			return number(fold(rebuilt));
		}
		return rebuilt;
	}

	private static SymbolicExpression rewriteBinary(BinaryOperator op, SymbolicExpression left,
			SymbolicExpression right) {
		boolean numeric = left instanceof NumberExpr && right instanceof NumberExpr;

		switch (op) {
			case ADD -> {
				if (left.isZero()) {
					return right;
				}
				if (right.isZero()) {
					return left;
				}
			}
			case SUBTRACT -> {
				if (right.isZero()) {
					return left;
				}
				if (left.isZero()) {
					return rewriteUnary(UnaryOperator.NEG, right);
				}
			}
			case MULTIPLY -> {
				if (left.isZero() || right.isZero()) {
					return number(0.0);
				}
				if (left.isOne()) {
					return right;
				}
				if (right.isOne()) {
					return left;
				}
			}
			case DIVIDE -> {
				if (right.isZero()) {
					throw new TransformException("Division by zero while simplifying " + left + " / " + right);
				}
				if (left.isZero()) {
					return number(0.0);
				}
				if (right.isOne()) {
					return left;
				}
			}
			case POWER -> {
				if (right.isZero()) {
					return number(1.0);
				}
				if (right.isOne()) {
					return left;
				}
				if (left.isZero()) {
					return number(0.0);
				}
				if (left.isOne()) {
					return number(1.0);
				}
			}
		}

		SymbolicExpression.BinaryExpr rebuilt = new SymbolicExpression.BinaryExpr(op, left, right);
		return numeric ? number(fold(rebuilt)) : rebuilt;
	}

	private static SymbolicExpression rewriteUnary(UnaryOperator op, SymbolicExpression operand) {
		if (op == UnaryOperator.POS) {
			return operand;
		}
		if (op == UnaryOperator.NEG) {
			if (operand.isZero()) {
				return number(0.0);
			}
			if (operand instanceof SymbolicExpression.UnaryExpr inner && inner.op() == UnaryOperator.NEG) {
				return inner.operand();
			}
		}

		SymbolicExpression.UnaryExpr rebuilt = new SymbolicExpression.UnaryExpr(op, operand);
		return operand instanceof NumberExpr ? number(fold(rebuilt)) : rebuilt;
	}

	private static double fold(SymbolicExpression constant) {
		return Constants.valueOf(constant, "Simplifying");
	}
}
