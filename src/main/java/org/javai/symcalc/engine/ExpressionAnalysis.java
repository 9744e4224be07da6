package org.javai.symcalc.engine;

import java.util.Objects;
import java.util.Optional;
import org.javai.symcalc.symbolic.SymbolicExpression;

/**
 * The parsed form of an expression together with its derivative and integral.
 * Each calculus step succeeds or fails on its own, so an expression that cannot be
 * integrated still reports its derivative.
 *
 * @param input the text that was analysed
 * @param variable the variable of differentiation and integration
 * @param expression the parsed expression
 * @param derivative outcome of differentiating
 * @param integral outcome of integrating
 */
public record ExpressionAnalysis(String input, String variable, SymbolicExpression expression,
		Step derivative, Step integral) {

	public ExpressionAnalysis {
		Objects.requireNonNull(expression, "expression must not be null");
		Objects.requireNonNull(derivative, "derivative must not be null");
		Objects.requireNonNull(integral, "integral must not be null");
	}

	/**
	 * One calculus step. On success both {@code result} and {@code simplified} are set; when the
	 * transformation itself failed neither is; when only simplification failed, {@code result}
	 * holds the unsimplified tree.
	 */
	public record Step(SymbolicExpression result, SymbolicExpression simplified, CasError error) {

		static Step succeeded(SymbolicExpression result, SymbolicExpression simplified) {
			return new Step(result, simplified, null);
		}

		static Step failed(SymbolicExpression partial, CasError error) {
			return new Step(partial, null, error);
		}

		public boolean isSuccess() {
			return error == null;
		}

		public Optional<SymbolicExpression> simplifiedResult() {
			return Optional.ofNullable(simplified);
		}

		public Optional<CasError> failure() {
			return Optional.ofNullable(error);
		}
	}
}
