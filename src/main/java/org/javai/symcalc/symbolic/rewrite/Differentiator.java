package org.javai.symcalc.symbolic.rewrite;

import static org.javai.symcalc.symbolic.SymbolicExpression.add;
import static org.javai.symcalc.symbolic.SymbolicExpression.divide;
import static org.javai.symcalc.symbolic.SymbolicExpression.multiply;
import static org.javai.symcalc.symbolic.SymbolicExpression.negate;
import static org.javai.symcalc.symbolic.SymbolicExpression.number;
import static org.javai.symcalc.symbolic.SymbolicExpression.power;
import static org.javai.symcalc.symbolic.SymbolicExpression.subtract;
import static org.javai.symcalc.symbolic.SymbolicExpression.unary;

import java.util.Objects;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicExpression.UnaryOperator;
import org.javai.symcalc.symbolic.SymbolicVisitor;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Symbolic differentiation rules.
 * <p>
 * Results are built structurally and left unsimplified: {@code d/dx x^2} yields
 * {@code x^1 * (2 * 1)}. Exponents must be constant; {@code log} and {@code abs} have no rule.
 */
public final class Differentiator implements SymbolicVisitor<SymbolicExpression> {

	private final String variable;

	private Differentiator(String variable) {
		this.variable = Objects.requireNonNull(variable, "variable must not be null");
	}

	public static SymbolicExpression differentiate(SymbolicExpression expr, String variable) {
		return expr.accept(new Differentiator(variable));
	}

	@Override
	public SymbolicExpression visitNumber(SymbolicExpression.NumberExpr expr) {
		return number(0.0);
	}

	@Override
	public SymbolicExpression visitVariable(SymbolicExpression.VariableExpr expr) {
		return number(expr.name().equals(variable) ? 1.0 : 0.0);
	}

	@Override
	public SymbolicExpression visitBinary(SymbolicExpression.BinaryExpr expr) {
		SymbolicExpression u = expr.left();
		SymbolicExpression v = expr.right();

		return switch (expr.op()) {
			case ADD -> add(u.accept(this), v.accept(this));
			case SUBTRACT -> subtract(u.accept(this), v.accept(this));
			// u*dv + v*du
			case MULTIPLY -> add(multiply(u, v.accept(this)), multiply(v, u.accept(this)));
			// (v*du - u*dv) / v^2
			case DIVIDE -> divide(
					subtract(multiply(v, u.accept(this)), multiply(u, v.accept(this))),
					power(v, number(2.0)));
			case POWER -> differentiatePower(u, v);
		};
	}

	private SymbolicExpression differentiatePower(SymbolicExpression base, SymbolicExpression exponent) {
		if (!exponent.isConstant()) {
			throw new TransformException("Differentiation of variable exponents not implemented: "
					+ power(base, exponent));
		}
		double n = Constants.valueOf(exponent, "Differentiating power");
		return multiply(power(base, number(n - 1.0)), multiply(number(n), base.accept(this)));
	}

	@Override
	public SymbolicExpression visitUnary(SymbolicExpression.UnaryExpr expr) {
		return differentiateUnary(expr.op(), expr.operand());
	}

	@Override
	public SymbolicExpression visitFunction(SymbolicExpression.FunctionExpr expr) {
		if (expr.arguments().size() != 1) {
			throw new TransformException("Differentiation not implemented for multi-argument functions: " + expr);
		}
		UnaryOperator op = UnaryOperator.forFunctionName(expr.name())
				.orElseThrow(() -> new TransformException(
						"Differentiation not implemented for function: " + expr.name()));
		return differentiateUnary(op, expr.arguments().get(0));
	}

	private SymbolicExpression differentiateUnary(UnaryOperator op, SymbolicExpression u) {
		return switch (op) {
			case POS -> u.accept(this);
			case NEG -> negate(u.accept(this));
			case SIN -> multiply(unary(UnaryOperator.COS, u), u.accept(this));
			case COS -> multiply(negate(unary(UnaryOperator.SIN, u)), u.accept(this));
			// sec^2(u) written as 1/cos(u)^2
			case TAN -> multiply(divide(number(1.0), power(unary(UnaryOperator.COS, u), number(2.0))), u.accept(this));
			case LN -> multiply(divide(number(1.0), u), u.accept(this));
			case SQRT -> multiply(
					divide(number(1.0), multiply(number(2.0), unary(UnaryOperator.SQRT, u))),
					u.accept(this));
			case LOG, ABS -> throw new TransformException(
					"Differentiation not implemented for this operation: " + op.name().toLowerCase());
		};
	}
}
