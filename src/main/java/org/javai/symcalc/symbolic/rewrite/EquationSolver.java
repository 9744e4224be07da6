package org.javai.symcalc.symbolic.rewrite;

import static org.javai.symcalc.symbolic.SymbolicExpression.divide;
import static org.javai.symcalc.symbolic.SymbolicExpression.negate;
import static org.javai.symcalc.symbolic.SymbolicExpression.number;

import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicExpression.BinaryExpr;
import org.javai.symcalc.symbolic.SymbolicExpression.BinaryOperator;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Solves {@code expr = 0} for two narrow shapes of the simplified expression.
 * <ul>
 * <li>{@code c + f} and {@code c - f} with constant {@code c}: the result is {@code -c / f}
 * and {@code c / f} respectively, with {@code f} left as it is.</li>
 * <li>{@code a*x + c} and {@code a*x - c} with constants {@code a}, {@code c} (the coefficient may
 * sit on either side of {@code x}, or be absent): the result is {@code -c / a} and {@code c / a}.</li>
 * </ul>
 * Any other equation is rejected. The returned expression is not simplified.
 */
public final class EquationSolver {

	private EquationSolver() {
	}

	/**
	 * @throws TransformException if the equation has neither recognised shape, or cannot be simplified
	 */
	public static SymbolicExpression solve(SymbolicExpression expr, String variable) {
		Objects.requireNonNull(variable, "variable must not be null");
		SymbolicExpression simplified;
		try {
			simplified = Simplifier.simplify(expr);
		} catch (TransformException e) {
			throw new TransformException("Equation solving failed: " + e.getMessage(), e);
		}

		if (simplified instanceof BinaryExpr sum
				&& (sum.is(BinaryOperator.ADD) || sum.is(BinaryOperator.SUBTRACT))) {
			boolean adding = sum.is(BinaryOperator.ADD);

			if (sum.left().isConstant()) {
				SymbolicExpression constant = sum.left();
				return divide(adding ? negate(constant) : constant, sum.right());
			}

			if (sum.right().isConstant()) {
				Optional<SymbolicExpression> coefficient = linearCoefficient(sum.left(), variable);
				if (coefficient.isPresent()) {
					SymbolicExpression constant = sum.right();
					return divide(adding ? negate(constant) : constant, coefficient.get());
				}
			}
		}

		throw new TransformException(
				"Equation solving failed: complex equation solving not implemented for " + simplified);
	}

	private static Optional<SymbolicExpression> linearCoefficient(SymbolicExpression term, String variable) {
		if (isVariable(term, variable)) {
			return Optional.of(number(1.0));
		}
		if (term instanceof BinaryExpr product && product.is(BinaryOperator.MULTIPLY)) {
			if (product.left().isConstant() && isVariable(product.right(), variable)) {
				return Optional.of(product.left());
			}
			if (product.right().isConstant() && isVariable(product.left(), variable)) {
				return Optional.of(product.right());
			}
		}
		return Optional.empty();
	}

	private static boolean isVariable(SymbolicExpression expr, String variable) {
		return expr instanceof SymbolicExpression.VariableExpr v && v.name().equals(variable);
	}
}
