package org.javai.symcalc.symbolic.rewrite;

import org.javai.symcalc.math.EvaluationException;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.TransformException;

/**
 * Evaluation of constant subtrees on behalf of the rewrite rules.
 */
final class Constants {

	private Constants() {
	}

	/**
	 * Evaluates a subtree known to contain no variables.
	 *
	 * @param context what the rule was doing, used in the failure message
	 * @throws TransformException if the subtree cannot be evaluated
	 */
	static double valueOf(SymbolicExpression constant, String context) {
		try {
			return constant.evaluate();
		} catch (EvaluationException e) {
			throw new TransformException(context + ": cannot evaluate " + constant + ": " + e.getMessage(), e);
		}
	}
}
