package org.javai.symcalc.symbolic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.javai.symcalc.symbolic.SymbolicExpression.add;
import static org.javai.symcalc.symbolic.SymbolicExpression.function;
import static org.javai.symcalc.symbolic.SymbolicExpression.multiply;
import static org.javai.symcalc.symbolic.SymbolicExpression.negate;
import static org.javai.symcalc.symbolic.SymbolicExpression.number;
import static org.javai.symcalc.symbolic.SymbolicExpression.unary;
import static org.javai.symcalc.symbolic.SymbolicExpression.variable;

import java.util.Map;
import org.javai.symcalc.math.EvaluationException;
import org.junit.jupiter.api.Test;

class SymbolicExpressionTest {

	@Test
	void constancyDependsOnVariables() {
		assertThat(add(number(1), number(2)).isConstant()).isTrue();
		assertThat(function("sin", number(1)).isConstant()).isTrue();
		assertThat(multiply(number(2), variable("x")).isConstant()).isFalse();
	}

	@Test
	void zeroIsLiteral() {
		assertThat(number(0).isZero()).isTrue();
		assertThat(number(-0.0).isZero()).isTrue();
		assertThat(negate(number(0)).isZero()).isTrue();
		assertThat(unary(SymbolicExpression.UnaryOperator.SIN, number(0)).isZero()).isFalse();
		assertThat(add(number(0), number(0)).isZero()).isFalse();
	}

	@Test
	void oneIsLiteral() {
		assertThat(number(1).isOne()).isTrue();
		assertThat(multiply(number(1), number(1)).isOne()).isFalse();
	}

	@Test
	void evaluateWithBindings() {
		SymbolicExpression expr = add(multiply(number(2), variable("x")), function("sqrt", variable("y")));

		assertThat(expr.evaluate(Map.of("x", 3.0, "y", 16.0))).isEqualTo(10.0);
	}

	@Test
	void evaluateReportsUnboundVariable() {
		assertThatThrownBy(() -> variable("z").evaluate())
				.isInstanceOf(EvaluationException.class)
				.hasMessage("Undefined variable: z");
	}

	@Test
	void copyIsEqualButDistinct() {
		SymbolicExpression expr = add(variable("x"), function("cos", variable("x")));

		SymbolicExpression copy = expr.copy();

		assertThat(copy).isEqualTo(expr).isNotSameAs(expr);
	}

	@Test
	void functionNameMapsToOperator() {
		assertThat(SymbolicExpression.UnaryOperator.forFunctionName("ln"))
				.contains(SymbolicExpression.UnaryOperator.LN);
		assertThat(SymbolicExpression.UnaryOperator.forFunctionName("exp")).isEmpty();
	}
}
