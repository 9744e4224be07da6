package org.javai.symcalc.symbolic.rewrite;

import static org.javai.symcalc.symbolic.SymbolicExpression.add;
import static org.javai.symcalc.symbolic.SymbolicExpression.divide;
import static org.javai.symcalc.symbolic.SymbolicExpression.multiply;
import static org.javai.symcalc.symbolic.SymbolicExpression.negate;
import static org.javai.symcalc.symbolic.SymbolicExpression.number;
import static org.javai.symcalc.symbolic.SymbolicExpression.power;
import static org.javai.symcalc.symbolic.SymbolicExpression.subtract;
import static org.javai.symcalc.symbolic.SymbolicExpression.unary;
import static org.javai.symcalc.symbolic.SymbolicExpression.variable;

import java.util.Objects;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicExpression.UnaryOperator;
import org.javai.symcalc.symbolic.SymbolicVisitor;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Symbolic integration for a small set of closed forms.
 * <p>
 * Only these shapes integrate; anything else fails with a {@link TransformException}:
 * <ul>
 * <li>constants and variables (other variables are treated as constants)</li>
 * <li>sums and differences of integrable terms</li>
 * <li>a constant times an integrable term, on either side</li>
 * <li>{@code c / x} and {@code x^n} for constant {@code c} and {@code n}</li>
 * <li>{@code sin(x)}, {@code cos(x)} and {@code ln(x)}</li>
 * </ul>
 * "{@code x}" here means an operand whose printed form is exactly the integration variable.
 * No constant of integration is added.
 */
public final class Integrator implements SymbolicVisitor<SymbolicExpression> {

	private final String variable;

	private Integrator(String variable) {
		this.variable = Objects.requireNonNull(variable, "variable must not be null");
	}

	public static SymbolicExpression integrate(SymbolicExpression expr, String variable) {
		return expr.accept(new Integrator(variable));
	}

	@Override
	public SymbolicExpression visitNumber(SymbolicExpression.NumberExpr expr) {
		return multiply(number(expr.value()), variable(variable));
	}

	@Override
	public SymbolicExpression visitVariable(SymbolicExpression.VariableExpr expr) {
		if (expr.name().equals(variable)) {
			return divide(power(variable(variable), number(2.0)), number(2.0));
		}
		return multiply(variable(expr.name()), variable(variable));
	}

	@Override
	public SymbolicExpression visitBinary(SymbolicExpression.BinaryExpr expr) {
		SymbolicExpression left = expr.left();
		SymbolicExpression right = expr.right();

		return switch (expr.op()) {
			case ADD -> add(left.accept(this), right.accept(this));
			case SUBTRACT -> subtract(left.accept(this), right.accept(this));
			case MULTIPLY -> {
				if (left.isConstant()) {
					yield multiply(left, right.accept(this));
				}
				if (right.isConstant()) {
					yield multiply(left.accept(this), right);
				}
				throw new TransformException(
						"Integration by parts not implemented for general multiplication: " + expr);
			}
			case DIVIDE -> {
				if (left.isConstant() && isIntegrationVariable(right)) {
					yield multiply(left, unary(UnaryOperator.LN, variable(variable)));
				}
				throw new TransformException("Complex division integration not implemented: " + expr);
			}
			case POWER -> {
				if (isIntegrationVariable(left) && right.isConstant()) {
					double n = Constants.valueOf(right, "Integrating power");
					if (n == -1.0) {
						yield unary(UnaryOperator.LN, variable(variable));
					}
					yield divide(power(variable(variable), number(n + 1.0)), number(n + 1.0));
				}
				throw new TransformException("Complex power integration not implemented: " + expr);
			}
		};
	}

	@Override
	public SymbolicExpression visitUnary(SymbolicExpression.UnaryExpr expr) {
		return switch (expr.op()) {
			case POS -> expr.operand().accept(this);
			case NEG -> negate(expr.operand().accept(this));
			case SIN, COS, LN -> integrateElementary(expr.op(), expr.operand(), expr);
			default -> throw new TransformException(
					"Integration not implemented for this unary operation: " + expr);
		};
	}

	@Override
	public SymbolicExpression visitFunction(SymbolicExpression.FunctionExpr expr) {
		if (expr.arguments().size() != 1) {
			throw new TransformException("Integration not implemented for multi-argument functions: " + expr);
		}
		UnaryOperator op = UnaryOperator.forFunctionName(expr.name())
				.filter(candidate -> candidate == UnaryOperator.SIN
						|| candidate == UnaryOperator.COS
						|| candidate == UnaryOperator.LN)
				.orElseThrow(() -> new TransformException(
						"Integration not implemented for function: " + expr.name()));
		return integrateElementary(op, expr.arguments().get(0), expr);
	}

	private SymbolicExpression integrateElementary(UnaryOperator op, SymbolicExpression operand,
			SymbolicExpression original) {
		if (!isIntegrationVariable(operand)) {
			throw new TransformException("Integration not implemented for " + original
					+ ": argument must be exactly " + variable);
		}
		return switch (op) {
			case SIN -> negate(unary(UnaryOperator.COS, variable(variable)));
			case COS -> unary(UnaryOperator.SIN, variable(variable));
			// x*ln(x) - x
			case LN -> subtract(
					multiply(variable(variable), unary(UnaryOperator.LN, variable(variable))),
					variable(variable));
			default -> throw new IllegalArgumentException("No elementary integral for " + op);
		};
	}

	/**
	 * Compares printed forms rather than structure, so {@code x + 0} does not count as {@code x}.
	 */
	private boolean isIntegrationVariable(SymbolicExpression expr) {
		return expr.toString().equals(variable);
	}
}
