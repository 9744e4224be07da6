package org.javai.symcalc.symbolic.rewrite;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.javai.symcalc.parse.ExprParser;
import org.javai.symcalc.symbolic.AstToSymbolicConverter;
import org.javai.symcalc.symbolic.SymbolicExpression;
import org.javai.symcalc.symbolic.TransformException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EquationSolverTest {

	private static SymbolicExpression solve(String text, String variable) {
		SymbolicExpression expr = AstToSymbolicConverter.convert(new ExprParser(text).parse());
		return EquationSolver.solve(expr, variable);
	}

	private static SymbolicExpression solve(String text) {
		return solve(text, "x");
	}

	@Nested
	@DisplayName("linear in the variable")
	class Linear {

		@Test
		void coefficientBeforeVariable() {
			SymbolicExpression root = solve("2*x - 3");

			assertThat(root).hasToString("(3 / 2)");
			assertThat(root.evaluate()).isEqualTo(1.5);
		}

		@Test
		void coefficientAfterVariable() {
			assertThat(solve("x*4 + 8").evaluate()).isEqualTo(-2.0);
		}

		@Test
		void implicitCoefficient() {
			assertThat(solve("5x + 10").evaluate()).isEqualTo(-2.0);
		}

		@Test
		void bareVariable() {
			assertThat(solve("x + 5").evaluate()).isEqualTo(-5.0);
			assertThat(solve("x - 7").evaluate()).isEqualTo(7.0);
		}

		@Test
		void simplifiesBeforeMatching() {
			assertThat(solve("(x + 0) * 1 - 3").evaluate()).isEqualTo(3.0);
		}

		@Test
		void otherVariable() {
			assertThat(solve("3y - 6", "y").evaluate()).isEqualTo(2.0);
		}
	}

	@Nested
	@DisplayName("constant on the left")
	class ConstantFirst {

		@Test
		void sumDividesNegatedConstantByRemainder() {
			assertThat(solve("3 + x")).hasToString("(-3 / x)");
		}

		@Test
		void differenceDividesConstantByRemainder() {
			assertThat(solve("5 - 2x")).hasToString("(5 / 2x)");
		}
	}

	@Nested
	@DisplayName("unsupported equations")
	class Unsupported {

		@Test
		void quadratic() {
			assertThatThrownBy(() -> solve("x^2 - 4"))
					.isInstanceOf(TransformException.class)
					.hasMessage("Equation solving failed: complex equation solving not implemented for ((x ^ 2) - 4)");
		}

		@Test
		void noConstantTerm() {
			assertThatThrownBy(() -> solve("2x"))
					.isInstanceOf(TransformException.class)
					.hasMessageStartingWith("Equation solving failed");
		}

		@Test
		void wrongVariable() {
			assertThatThrownBy(() -> solve("2x - 3", "y"))
					.isInstanceOf(TransformException.class);
		}

		@Test
		void simplificationFailure() {
			assertThatThrownBy(() -> solve("x / 0 + 1"))
					.isInstanceOf(TransformException.class)
					.hasMessage("Equation solving failed: Division by zero while simplifying x / 0");
		}
	}
}
