package org.javai.symcalc.math;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FunctionRegistryTest {

	@Test
	void standardRegistryHoldsAllBuiltIns() {
		assertThat(FunctionRegistry.standard().names())
				.containsExactly("sin", "cos", "tan", "log", "ln", "sqrt", "abs");
	}

	@Test
	void lookupByName() {
		assertThat(FunctionRegistry.standard().lookup("ln")).contains(MathFunction.LN);
		assertThat(FunctionRegistry.standard().lookup("exp")).isEmpty();
		assertThat(FunctionRegistry.standard().lookup(null)).isEmpty();
	}

	@Test
	void restrictedRegistry() {
		FunctionRegistry registry = FunctionRegistry.of(MathFunction.SQRT, MathFunction.ABS);

		assertThat(registry.contains("sqrt")).isTrue();
		assertThat(registry.contains("sin")).isFalse();
		assertThat(registry).hasToString("FunctionRegistry[sqrt, abs]");
	}

	@Test
	void restrictedRegistryNeedsAFunction() {
		assertThatThrownBy(FunctionRegistry::of).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> FunctionRegistry.of(MathFunction.SIN, null))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void namesAreUnmodifiable() {
		assertThatThrownBy(() -> FunctionRegistry.standard().names().add("exp"))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void functionsCheckTheirDomain() {
		assertThat(MathFunction.ABS.apply(-2.5)).isEqualTo(2.5);
		assertThatThrownBy(() -> MathFunction.SQRT.apply(-1))
				.isInstanceOf(EvaluationException.class)
				.hasMessage("Square root of negative number: -1.0");
	}
}
